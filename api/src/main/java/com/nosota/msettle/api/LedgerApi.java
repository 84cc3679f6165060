package com.nosota.msettle.api;

import com.nosota.msettle.api.dto.LedgerEntryDTO;
import com.nosota.msettle.api.request.DepositRequest;
import com.nosota.msettle.api.request.TransferRequest;
import com.nosota.msettle.api.request.WithdrawalRequest;
import com.nosota.msettle.api.response.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Ledger API interface for collaborator modules.
 *
 * <p>Defines REST endpoints for account-level operations:
 * <ul>
 *   <li>Deposits and withdrawals (value entering/leaving the ledger)</li>
 *   <li>Fee-skimmed transfers between principals</li>
 *   <li>Query operations (balance, journal entries, reconciliation)</li>
 * </ul>
 *
 * <p><b>Note:</b> Conditional transfers live in {@link EscrowApi}, {@link MultiSigApi},
 * {@link AuctionApi} and {@link PaymentApi}.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>LedgerController - in service module (server-side implementation)</li>
 *   <li>LedgerClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/ledger")
public interface LedgerApi {

    /**
     * Credits the caller's account with funds from an external source.
     *
     * @param caller  Verified caller identity
     * @param request Deposit details
     * @return Deposit response with the new balance
     */
    @PostMapping("/deposit")
    ResponseEntity<DepositResponse> deposit(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid DepositRequest request) throws Exception;

    /**
     * Debits the caller's account, moving funds out of the ledger.
     *
     * @param caller  Verified caller identity
     * @param request Withdrawal details
     * @return Withdrawal response with the new balance
     */
    @PostMapping("/withdraw")
    ResponseEntity<WithdrawalResponse> withdraw(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid WithdrawalRequest request) throws Exception;

    /**
     * Gets native and token balances of a principal.
     *
     * @param principal Account owner
     * @return Balance response
     */
    @GetMapping("/accounts/{principal}/balance")
    ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("principal") String principal);

    /**
     * Transfers native currency from the caller, skimming the platform fee.
     *
     * @param caller  Verified caller identity (the sender)
     * @param request Transfer details
     * @return Transfer response with fee breakdown and new balances
     */
    @PostMapping("/transfer")
    ResponseEntity<TransferResponse> transferWithFee(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid TransferRequest request) throws Exception;

    /**
     * Gets all journal entries recorded under a reference (escrow, auction, payment, transfer).
     *
     * @param referenceId Reference UUID
     * @return Entries in insertion order
     */
    @GetMapping("/entries")
    ResponseEntity<List<LedgerEntryDTO>> getEntries(
            @RequestParam("referenceId") @NotNull UUID referenceId);

    /**
     * Compares the sum of balances with the journal sum for an asset.
     *
     * @param asset Asset to reconcile, native currency by default
     * @return Reconciliation response
     */
    @GetMapping("/reconciliation")
    ResponseEntity<ReconciliationResponse> reconcile(
            @RequestParam(value = "asset", required = false) String asset);
}
