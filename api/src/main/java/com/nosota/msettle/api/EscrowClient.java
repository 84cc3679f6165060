package com.nosota.msettle.api;

import com.nosota.msettle.api.request.CreateEscrowRequest;
import com.nosota.msettle.api.request.ResolveEscrowRequest;
import com.nosota.msettle.api.response.EscrowResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of EscrowApi.
 *
 * <p>Not a Spring @Component; see {@link LedgerClient} for registration.
 */
@RequiredArgsConstructor
@Slf4j
public class EscrowClient implements EscrowApi {

    private static final String BASE = "/api/v1/escrows";

    private final WebClient webClient;

    @Override
    public ResponseEntity<EscrowResponse> createEscrow(String caller, CreateEscrowRequest request) {
        log.debug("Calling createEscrow: buyer={}, seller={}, amount={}",
                caller, request.seller(), request.amount());

        return webClient.post()
                .uri(BASE)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> releaseEscrow(String caller, UUID escrowId) {
        return action(caller, escrowId, "release");
    }

    @Override
    public ResponseEntity<EscrowResponse> refundEscrow(String caller, UUID escrowId) {
        return action(caller, escrowId, "refund");
    }

    @Override
    public ResponseEntity<EscrowResponse> disputeEscrow(String caller, UUID escrowId) {
        return action(caller, escrowId, "dispute");
    }

    @Override
    public ResponseEntity<EscrowResponse> resolveEscrow(String caller, UUID escrowId, ResolveEscrowRequest request) {
        log.debug("Calling resolveEscrow: escrowId={}, winner={}", escrowId, request.winner());

        return webClient.post()
                .uri(BASE + "/{escrowId}/resolve", escrowId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> claimExpiredEscrow(String caller, UUID escrowId) {
        return action(caller, escrowId, "claim-expired");
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow(UUID escrowId) {
        return webClient.get()
                .uri(BASE + "/{escrowId}", escrowId)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<EscrowResponse>> getEscrowsByParticipant(String participant) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE)
                        .queryParam("participant", participant)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<EscrowResponse>>() {})
                .block();
    }

    private ResponseEntity<EscrowResponse> action(String caller, UUID escrowId, String action) {
        log.debug("Calling escrow {}: escrowId={}, caller={}", action, escrowId, caller);

        return webClient.post()
                .uri(BASE + "/{escrowId}/{action}", escrowId, action)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }
}
