package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for creating an English (ascending-bid) auction. The caller is the seller.
 *
 * <p>If {@code itemToken} is set, {@code itemQuantity} units of that token are moved from the
 * seller into auction custody and handed to the winner on settlement.
 *
 * @param itemRef         Reference of the auctioned item in the collaborator's catalogue
 * @param itemToken       Token representing the item, optional
 * @param itemQuantity    Token quantity, required when {@code itemToken} is set
 * @param startingPrice   Initial current price
 * @param durationSeconds Bidding window length
 * @param minIncrement    Minimum raise over the current price
 * @param reservePrice    Minimum acceptable final price, optional
 */
public record CreateAuctionRequest(
        @NotBlank(message = "Item reference is required")
        String itemRef,

        String itemToken,

        @Positive
        Long itemQuantity,

        @NotNull(message = "Starting price is required")
        @Positive(message = "Starting price must be positive")
        Long startingPrice,

        @NotNull(message = "Duration is required")
        @Positive(message = "Duration must be positive")
        Long durationSeconds,

        @NotNull(message = "Minimum increment is required")
        @Positive(message = "Minimum increment must be positive")
        Long minIncrement,

        @Positive(message = "Reserve price must be positive")
        Long reservePrice
) {
}
