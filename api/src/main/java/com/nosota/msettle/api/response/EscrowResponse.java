package com.nosota.msettle.api.response;

import com.nosota.msettle.api.model.DisputeWinner;
import com.nosota.msettle.api.model.EscrowStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Response describing an escrow.
 */
public record EscrowResponse(
        UUID id,
        String buyer,
        String seller,
        String arbiter,
        Long amount,
        Integer feeBps,
        EscrowStatus status,
        String disputedBy,
        DisputeWinner winner,
        String description,
        Instant createdAt,
        Instant expiresAt,
        Instant closedAt
) {}
