package com.nosota.msettle.api;

import com.nosota.msettle.api.request.*;
import com.nosota.msettle.api.response.PendingTransactionResponse;
import com.nosota.msettle.api.response.WalletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of MultiSigApi.
 *
 * <p>Not a Spring @Component; see {@link LedgerClient} for registration.
 */
@RequiredArgsConstructor
@Slf4j
public class MultiSigClient implements MultiSigApi {

    private static final String BASE = "/api/v1/multisig/wallets";

    private final WebClient webClient;

    @Override
    public ResponseEntity<WalletResponse> createMultiSigWallet(String caller, CreateWalletRequest request) {
        log.debug("Calling createMultiSigWallet: admin={}, owners={}, threshold={}",
                caller, request.owners(), request.threshold());

        return webClient.post()
                .uri(BASE)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletResponse> getWallet(UUID walletId) {
        return webClient.get()
                .uri(BASE + "/{walletId}", walletId)
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletResponse> depositToWallet(String caller, UUID walletId, AmountRequest request) {
        log.debug("Calling depositToWallet: walletId={}, amount={}", walletId, request.amount());

        return webClient.post()
                .uri(BASE + "/{walletId}/deposit", walletId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> proposeTransaction(String caller, UUID walletId,
                                                                         ProposeTransactionRequest request) {
        log.debug("Calling proposeTransaction: walletId={}, command={}", walletId, request.command());

        return webClient.post()
                .uri(BASE + "/{walletId}/transactions", walletId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(PendingTransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> getTransaction(UUID walletId, Long txIndex) {
        return webClient.get()
                .uri(BASE + "/{walletId}/transactions/{txIndex}", walletId, txIndex)
                .retrieve()
                .toEntity(PendingTransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> confirmTransaction(String caller, UUID walletId, Long txIndex) {
        return transactionAction(caller, walletId, txIndex, "confirm");
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> revokeConfirmation(String caller, UUID walletId, Long txIndex) {
        return transactionAction(caller, walletId, txIndex, "revoke");
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> executeTransaction(String caller, UUID walletId, Long txIndex) {
        return transactionAction(caller, walletId, txIndex, "execute");
    }

    @Override
    public ResponseEntity<PendingTransactionResponse> cancelTransaction(String caller, UUID walletId, Long txIndex) {
        return transactionAction(caller, walletId, txIndex, "cancel");
    }

    @Override
    public ResponseEntity<WalletResponse> addOwner(String caller, UUID walletId, OwnerRequest request) {
        return webClient.post()
                .uri(BASE + "/{walletId}/owners", walletId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletResponse> removeOwner(String caller, UUID walletId, String owner) {
        return webClient.delete()
                .uri(BASE + "/{walletId}/owners/{owner}", walletId, owner)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletResponse> changeThreshold(String caller, UUID walletId, ThresholdRequest request) {
        return webClient.put()
                .uri(BASE + "/{walletId}/threshold", walletId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletResponse> deactivateWallet(String caller, UUID walletId) {
        return webClient.post()
                .uri(BASE + "/{walletId}/deactivate", walletId)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    private ResponseEntity<PendingTransactionResponse> transactionAction(String caller, UUID walletId,
                                                                         Long txIndex, String action) {
        log.debug("Calling multisig {}: walletId={}, txIndex={}, caller={}", action, walletId, txIndex, caller);

        return webClient.post()
                .uri(BASE + "/{walletId}/transactions/{txIndex}/{action}", walletId, txIndex, action)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(PendingTransactionResponse.class)
                .block();
    }
}
