package com.nosota.msettle.api;

import com.nosota.msettle.api.request.CreateEscrowRequest;
import com.nosota.msettle.api.request.ResolveEscrowRequest;
import com.nosota.msettle.api.response.EscrowResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Escrow API: two-party conditional holds.
 *
 * <p>Lifecycle: create (funds held) → release | refund | dispute → resolve, or
 * claim-expired by the buyer once the escrow has expired.
 */
@RequestMapping("/api/v1/escrows")
public interface EscrowApi {

    /**
     * Creates and funds an escrow; the caller is the buyer.
     */
    @PostMapping
    ResponseEntity<EscrowResponse> createEscrow(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid CreateEscrowRequest request) throws Exception;

    /**
     * Pays the seller (minus fee). Buyer only, before expiry.
     */
    @PostMapping("/{escrowId}/release")
    ResponseEntity<EscrowResponse> releaseEscrow(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("escrowId") UUID escrowId) throws Exception;

    /**
     * Returns the full amount to the buyer. Seller only.
     */
    @PostMapping("/{escrowId}/refund")
    ResponseEntity<EscrowResponse> refundEscrow(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("escrowId") UUID escrowId) throws Exception;

    /**
     * Raises a dispute. Buyer or seller.
     */
    @PostMapping("/{escrowId}/dispute")
    ResponseEntity<EscrowResponse> disputeEscrow(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("escrowId") UUID escrowId) throws Exception;

    /**
     * Resolves a dispute. Arbiter only.
     */
    @PostMapping("/{escrowId}/resolve")
    ResponseEntity<EscrowResponse> resolveEscrow(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("escrowId") UUID escrowId,
            @RequestBody @Valid ResolveEscrowRequest request) throws Exception;

    /**
     * Refunds the buyer after expiry. Buyer only.
     */
    @PostMapping("/{escrowId}/claim-expired")
    ResponseEntity<EscrowResponse> claimExpiredEscrow(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("escrowId") UUID escrowId) throws Exception;

    @GetMapping("/{escrowId}")
    ResponseEntity<EscrowResponse> getEscrow(
            @PathVariable("escrowId") UUID escrowId);

    /**
     * Lists escrows where the principal is buyer or seller, newest first.
     */
    @GetMapping
    ResponseEntity<List<EscrowResponse>> getEscrowsByParticipant(
            @RequestParam("participant") String participant);
}
