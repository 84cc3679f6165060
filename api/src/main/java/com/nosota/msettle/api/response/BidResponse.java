package com.nosota.msettle.api.response;

import java.time.Instant;
import java.util.UUID;

/**
 * Response describing an accepted bid.
 */
public record BidResponse(
        UUID id,
        UUID auctionId,
        String bidder,
        Long amount,
        Instant placedAt
) {}
