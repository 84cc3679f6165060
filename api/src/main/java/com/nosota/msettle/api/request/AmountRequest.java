package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request carrying a single native amount (wallet deposit, bid).
 *
 * @param amount Amount in minor units
 */
public record AmountRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount
) {
}
