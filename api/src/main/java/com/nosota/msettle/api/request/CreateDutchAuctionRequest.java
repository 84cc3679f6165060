package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for creating a Dutch (descending-price) auction. The caller is the seller.
 *
 * @param itemRef                  Reference of the auctioned item
 * @param itemToken                Token representing the item, optional
 * @param itemQuantity             Token quantity, required when {@code itemToken} is set
 * @param startingPrice            Price at creation
 * @param reservePrice             Floor price, strictly between 0 and the starting price
 * @param decrementAmount          Price drop per interval
 * @param decrementIntervalSeconds Length of one interval
 * @param durationSeconds          Auction length; must be long enough to reach the reserve
 */
public record CreateDutchAuctionRequest(
        @NotBlank(message = "Item reference is required")
        String itemRef,

        String itemToken,

        @Positive
        Long itemQuantity,

        @NotNull @Positive
        Long startingPrice,

        @NotNull @Positive
        Long reservePrice,

        @NotNull @Positive
        Long decrementAmount,

        @NotNull @Positive
        Long decrementIntervalSeconds,

        @NotNull @Positive
        Long durationSeconds
) {
}
