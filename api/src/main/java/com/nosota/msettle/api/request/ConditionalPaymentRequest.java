package com.nosota.msettle.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;

/**
 * Request for a payment released once a verifier proves its condition.
 *
 * @param recipient Receiving principal
 * @param amount    Gross amount held from the caller
 * @param verifier  Principal allowed to fulfil or reject the condition
 * @param condition Release condition
 * @param deadline  After this moment the payment can no longer be fulfilled
 */
public record ConditionalPaymentRequest(
        @NotBlank(message = "Recipient is required")
        String recipient,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @NotBlank(message = "Verifier is required")
        String verifier,

        @NotNull(message = "Condition is required")
        @Valid
        ConditionSpec condition,

        @NotNull(message = "Deadline is required")
        Instant deadline
) {
}
