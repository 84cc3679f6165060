package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for an immediate fee-skimmed payment from the caller.
 *
 * @param recipient   Receiving principal
 * @param amount      Gross amount
 * @param description Free-form description
 */
public record DirectPaymentRequest(
        @NotBlank(message = "Recipient is required")
        String recipient,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        String description
) {
}
