package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request for splitting an amount between recipients by percentage.
 *
 * @param amount      Total amount to split
 * @param recipients  Receiving principals
 * @param percentages Whole percentages per recipient; must sum to exactly 100
 */
public record SplitPaymentRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @NotEmpty(message = "Recipients are required")
        List<String> recipients,

        @NotEmpty(message = "Percentages are required")
        List<Integer> percentages
) {
}
