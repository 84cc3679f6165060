package com.nosota.msettle.api;

import com.nosota.msettle.api.request.*;
import com.nosota.msettle.api.response.PendingTransactionResponse;
import com.nosota.msettle.api.response.WalletResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Multi-sig wallet API: shared custody released only after a confirmation threshold.
 *
 * <p>Pending transactions are addressed by their wallet-scoped index.
 */
@RequestMapping("/api/v1/multisig/wallets")
public interface MultiSigApi {

    @PostMapping
    ResponseEntity<WalletResponse> createMultiSigWallet(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid CreateWalletRequest request) throws Exception;

    @GetMapping("/{walletId}")
    ResponseEntity<WalletResponse> getWallet(
            @PathVariable("walletId") UUID walletId);

    /**
     * Moves native funds from the caller into the wallet. Anyone may deposit.
     */
    @PostMapping("/{walletId}/deposit")
    ResponseEntity<WalletResponse> depositToWallet(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @RequestBody @Valid AmountRequest request) throws Exception;

    /**
     * Proposes a transaction; the proposing owner's confirmation is recorded immediately.
     */
    @PostMapping("/{walletId}/transactions")
    ResponseEntity<PendingTransactionResponse> proposeTransaction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @RequestBody @Valid ProposeTransactionRequest request) throws Exception;

    @GetMapping("/{walletId}/transactions/{txIndex}")
    ResponseEntity<PendingTransactionResponse> getTransaction(
            @PathVariable("walletId") UUID walletId,
            @PathVariable("txIndex") Long txIndex);

    @PostMapping("/{walletId}/transactions/{txIndex}/confirm")
    ResponseEntity<PendingTransactionResponse> confirmTransaction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @PathVariable("txIndex") Long txIndex) throws Exception;

    @PostMapping("/{walletId}/transactions/{txIndex}/revoke")
    ResponseEntity<PendingTransactionResponse> revokeConfirmation(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @PathVariable("txIndex") Long txIndex) throws Exception;

    /**
     * Executes a sufficiently confirmed transaction. The wallet is debited before the
     * destination is invoked.
     */
    @PostMapping("/{walletId}/transactions/{txIndex}/execute")
    ResponseEntity<PendingTransactionResponse> executeTransaction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @PathVariable("txIndex") Long txIndex) throws Exception;

    @PostMapping("/{walletId}/transactions/{txIndex}/cancel")
    ResponseEntity<PendingTransactionResponse> cancelTransaction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @PathVariable("txIndex") Long txIndex) throws Exception;

    @PostMapping("/{walletId}/owners")
    ResponseEntity<WalletResponse> addOwner(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @RequestBody @Valid OwnerRequest request) throws Exception;

    @DeleteMapping("/{walletId}/owners/{owner}")
    ResponseEntity<WalletResponse> removeOwner(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @PathVariable("owner") String owner) throws Exception;

    @PutMapping("/{walletId}/threshold")
    ResponseEntity<WalletResponse> changeThreshold(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId,
            @RequestBody @Valid ThresholdRequest request) throws Exception;

    @PostMapping("/{walletId}/deactivate")
    ResponseEntity<WalletResponse> deactivateWallet(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("walletId") UUID walletId) throws Exception;
}
