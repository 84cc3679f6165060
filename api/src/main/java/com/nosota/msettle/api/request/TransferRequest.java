package com.nosota.msettle.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for a fee-skimmed transfer of native currency from the caller.
 *
 * @param recipient Principal receiving {@code amount - fee}
 * @param amount    Gross amount debited from the caller
 * @param feeBps    Fee rate in basis points; clamped to the configured maximum, default rate if null
 */
public record TransferRequest(
        @NotBlank(message = "Recipient is required")
        String recipient,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @PositiveOrZero
        @Max(10000)
        Integer feeBps
) {
}
