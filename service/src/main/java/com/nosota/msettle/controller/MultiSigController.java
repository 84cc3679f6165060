package com.nosota.msettle.controller;

import com.nosota.msettle.api.MultiSigApi;
import com.nosota.msettle.api.request.*;
import com.nosota.msettle.api.response.PendingTransactionResponse;
import com.nosota.msettle.api.response.WalletResponse;
import com.nosota.msettle.mapper.MultiSigMapper;
import com.nosota.msettle.model.MultiSigWallet;
import com.nosota.msettle.model.PendingTransaction;
import com.nosota.msettle.service.MultiSigExecutionService;
import com.nosota.msettle.service.MultiSigWalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for multi-sig wallets.
 *
 * <p>Implements {@link MultiSigApi} interface for:
 * <ul>
 *   <li>Wallet lifecycle and admin operations (owners, threshold, deactivation)</li>
 *   <li>Pending transaction workflow (propose, confirm, revoke, execute, cancel)</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class MultiSigController implements MultiSigApi {

    private final MultiSigWalletService multiSigWalletService;
    private final MultiSigExecutionService multiSigExecutionService;

    // ==================== Wallets ====================

    @Override
    public ResponseEntity<WalletResponse> createMultiSigWallet(String caller, CreateWalletRequest request)
            throws Exception {
        MultiSigWallet wallet = multiSigWalletService.createWallet(caller, request.owners(), request.threshold());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(wallet));
    }

    @Override
    public ResponseEntity<WalletResponse> getWallet(UUID walletId) {
        return ResponseEntity.ok(toResponse(multiSigWalletService.getWallet(walletId)));
    }

    @Override
    public ResponseEntity<WalletResponse> depositToWallet(String caller, UUID walletId, AmountRequest request)
            throws Exception {
        MultiSigWallet wallet = multiSigWalletService.depositToWallet(walletId, caller, request.amount());
        return ResponseEntity.ok(toResponse(wallet));
    }

    @Override
    public ResponseEntity<WalletResponse> addOwner(String caller, UUID walletId, OwnerRequest request)
            throws Exception {
        return ResponseEntity.ok(toResponse(multiSigWalletService.addOwner(walletId, caller, request.owner())));
    }

    @Override
    public ResponseEntity<WalletResponse> removeOwner(String caller, UUID walletId, String owner) throws Exception {
        return ResponseEntity.ok(toResponse(multiSigWalletService.removeOwner(walletId, caller, owner)));
    }

    @Override
    public ResponseEntity<WalletResponse> changeThreshold(String caller, UUID walletId, ThresholdRequest request)
            throws Exception {
        MultiSigWallet wallet = multiSigWalletService.changeThreshold(walletId, caller, request.threshold());
        return ResponseEntity.ok(toResponse(wallet));
    }

    @Override
    public ResponseEntity<WalletResponse> deactivateWallet(String caller, UUID walletId) throws Exception {
        return ResponseEntity.ok(toResponse(multiSigWalletService.deactivateWallet(walletId, caller)));
    }

    // ==================== Transactions ====================

    @Override
    public ResponseEntity<PendingTransactionResponse> proposeTransaction(String caller, UUID walletId,
                                                                         ProposeTransactionRequest request)
            throws Exception {
        PendingTransaction transaction = multiSigWalletService.proposeTransaction(walletId, caller,
                request.command(), request.destination(), request.value(), request.payload(), request.argument());
        return ResponseEntity.status(HttpStatus.CREATED).body(MultiSigMapper.INSTANCE.toResponse(transaction));
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> getTransaction(UUID walletId, Long txIndex) {
        return ok(multiSigWalletService.getTransaction(walletId, txIndex));
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> confirmTransaction(String caller, UUID walletId, Long txIndex)
            throws Exception {
        return ok(multiSigWalletService.confirmTransaction(walletId, txIndex, caller));
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> revokeConfirmation(String caller, UUID walletId, Long txIndex)
            throws Exception {
        return ok(multiSigWalletService.revokeConfirmation(walletId, txIndex, caller));
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> executeTransaction(String caller, UUID walletId, Long txIndex)
            throws Exception {
        return ok(multiSigExecutionService.executeTransaction(walletId, txIndex, caller));
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> cancelTransaction(String caller, UUID walletId, Long txIndex)
            throws Exception {
        return ok(multiSigWalletService.cancelTransaction(walletId, txIndex, caller));
    }

    private WalletResponse toResponse(MultiSigWallet wallet) {
        return MultiSigMapper.INSTANCE.toResponse(wallet, multiSigWalletService.getWalletBalance(wallet.getId()));
    }

    private static ResponseEntity<PendingTransactionResponse> ok(PendingTransaction transaction) {
        return ResponseEntity.ok(MultiSigMapper.INSTANCE.toResponse(transaction));
    }
}
