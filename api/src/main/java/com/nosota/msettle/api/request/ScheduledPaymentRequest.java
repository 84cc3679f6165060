package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;

/**
 * Request for a payment held until a release time.
 *
 * @param recipient   Receiving principal
 * @param amount      Gross amount held from the caller
 * @param releaseTime Earliest moment the payment may be executed
 * @param description Free-form description
 */
public record ScheduledPaymentRequest(
        @NotBlank(message = "Recipient is required")
        String recipient,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @NotNull(message = "Release time is required")
        Instant releaseTime,

        String description
) {
}
