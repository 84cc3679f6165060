package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for a recurring payment: first installment now, the rest scheduled.
 *
 * @param recipient       Receiving principal
 * @param amount          Gross amount per installment
 * @param intervalSeconds Distance between installments
 * @param count           Total number of installments (including the first)
 */
public record RecurringPaymentRequest(
        @NotBlank(message = "Recipient is required")
        String recipient,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @NotNull(message = "Interval is required")
        @Positive(message = "Interval must be positive")
        Long intervalSeconds,

        @NotNull(message = "Count is required")
        @Positive(message = "Count must be positive")
        Integer count
) {
}
