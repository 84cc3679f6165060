package com.nosota.msettle.controller;

import com.nosota.msettle.api.LedgerApi;
import com.nosota.msettle.api.dto.LedgerEntryDTO;
import com.nosota.msettle.api.model.Assets;
import com.nosota.msettle.api.request.DepositRequest;
import com.nosota.msettle.api.request.TransferRequest;
import com.nosota.msettle.api.request.WithdrawalRequest;
import com.nosota.msettle.api.response.*;
import com.nosota.msettle.dto.TransferResult;
import com.nosota.msettle.mapper.LedgerEntryMapper;
import com.nosota.msettle.service.AccountLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for ledger operations.
 *
 * <p>Implements {@link LedgerApi} interface for:
 * <ul>
 *   <li>Deposits and withdrawals at the system boundary</li>
 *   <li>Fee-skimmed transfers between principals</li>
 *   <li>Balance, journal and reconciliation queries</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class LedgerController implements LedgerApi {

    private final AccountLedgerService accountLedgerService;

    @Override
    public ResponseEntity<DepositResponse> deposit(String caller, DepositRequest request) throws Exception {
        String asset = assetOf(request.asset());
        UUID referenceId = accountLedgerService.deposit(caller, asset, request.amount(), request.externalReference());
        DepositResponse response = new DepositResponse(
                referenceId,
                caller,
                asset,
                request.amount(),
                accountLedgerService.getBalance(caller, asset),
                request.externalReference()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<WithdrawalResponse> withdraw(String caller, WithdrawalRequest request) throws Exception {
        String asset = assetOf(request.asset());
        UUID referenceId = accountLedgerService.withdraw(caller, asset, request.amount(), request.destinationAccount());
        WithdrawalResponse response = new WithdrawalResponse(
                referenceId,
                caller,
                asset,
                request.amount(),
                accountLedgerService.getBalance(caller, asset),
                request.destinationAccount()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(String principal) {
        BalanceResponse response = new BalanceResponse(
                principal,
                accountLedgerService.getBalance(principal, Assets.NATIVE),
                accountLedgerService.getTokenBalances(principal)
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<TransferResponse> transferWithFee(String caller, TransferRequest request) throws Exception {
        TransferResult result = accountLedgerService.transferFromCaller(
                caller, request.recipient(), request.amount(), request.feeBps());
        TransferResponse response = new TransferResponse(
                result.referenceId(),
                caller,
                request.recipient(),
                result.amount(),
                result.fee(),
                result.netAmount(),
                accountLedgerService.getBalance(caller, Assets.NATIVE),
                accountLedgerService.getBalance(request.recipient(), Assets.NATIVE)
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<List<LedgerEntryDTO>> getEntries(UUID referenceId) {
        return ResponseEntity.ok(LedgerEntryMapper.INSTANCE.toDTOList(accountLedgerService.getEntries(referenceId)));
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcile(String asset) {
        ReconciliationResponse response = accountLedgerService.reconcile(asset);
        if (!response.consistent()) {
            log.error("Ledger inconsistent for asset {}: balances={}, journal={}",
                    response.asset(), response.totalBalances(), response.journalSum());
        }
        return ResponseEntity.ok(response);
    }

    private static String assetOf(String asset) {
        return Assets.isNative(asset) ? Assets.NATIVE : asset;
    }
}
