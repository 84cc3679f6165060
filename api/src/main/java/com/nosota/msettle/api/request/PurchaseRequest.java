package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for buying a Dutch auction item at its current effective price.
 *
 * @param maxPayment Highest price the buyer accepts; only the effective price is charged
 */
public record PurchaseRequest(
        @NotNull(message = "Payment is required")
        @Positive(message = "Payment must be positive")
        Long maxPayment
) {
}
