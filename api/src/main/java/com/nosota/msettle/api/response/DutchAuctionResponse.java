package com.nosota.msettle.api.response;

import com.nosota.msettle.api.model.AuctionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Response describing a Dutch auction.
 *
 * @param currentPrice Effective price at response time (final price once completed)
 */
public record DutchAuctionResponse(
        UUID id,
        String itemRef,
        String itemToken,
        Long itemQuantity,
        String seller,
        Long startingPrice,
        Long reservePrice,
        Long decrementAmount,
        Long decrementIntervalSeconds,
        Long currentPrice,
        AuctionStatus status,
        String buyer,
        Long finalPrice,
        Instant startTime,
        Instant endTime,
        Instant settledAt
) {}
