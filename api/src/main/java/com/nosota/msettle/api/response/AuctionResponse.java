package com.nosota.msettle.api.response;

import com.nosota.msettle.api.model.AuctionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Response describing an English auction.
 */
public record AuctionResponse(
        UUID id,
        String itemRef,
        String itemToken,
        Long itemQuantity,
        String seller,
        Long startingPrice,
        Long currentPrice,
        String highestBidder,
        Long minIncrement,
        Long reservePrice,
        Integer bidCount,
        AuctionStatus status,
        String winner,
        Instant startTime,
        Instant endTime,
        Instant settledAt
) {}
