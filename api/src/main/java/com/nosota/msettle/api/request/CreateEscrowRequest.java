package com.nosota.msettle.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for creating (and funding) an escrow. The caller is the buyer.
 *
 * @param seller           Principal paid on release
 * @param amount           Amount moved from the buyer into escrow custody
 * @param expiresInSeconds Lifetime of the escrow; after it the buyer may claim a refund
 * @param arbiter          Principal resolving disputes; platform default if null
 * @param feeBps           Platform fee applied on release; default rate if null
 * @param description      Free-form description (order reference, item)
 */
public record CreateEscrowRequest(
        @NotBlank(message = "Seller is required")
        String seller,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @NotNull(message = "Expiry is required")
        @Positive(message = "Expiry must be positive")
        Long expiresInSeconds,

        String arbiter,

        @PositiveOrZero
        @Max(10000)
        Integer feeBps,

        String description
) {
}
