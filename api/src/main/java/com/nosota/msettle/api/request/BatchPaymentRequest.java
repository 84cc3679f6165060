package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request for paying several recipients individual amounts in one operation.
 *
 * @param fundedAmount Amount the caller commits; must cover the sum of amounts, excess is returned
 * @param recipients   Receiving principals
 * @param amounts      Gross amount per recipient
 */
public record BatchPaymentRequest(
        @NotNull(message = "Funded amount is required")
        @Positive(message = "Funded amount must be positive")
        Long fundedAmount,

        @NotEmpty(message = "Recipients are required")
        List<String> recipients,

        @NotEmpty(message = "Amounts are required")
        List<Long> amounts
) {
}
