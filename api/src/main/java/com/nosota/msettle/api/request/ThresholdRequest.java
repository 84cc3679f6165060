package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for changing the confirmation threshold of a multi-sig wallet.
 *
 * @param threshold New threshold (1..owner count)
 */
public record ThresholdRequest(
        @NotNull(message = "Threshold is required")
        @Positive(message = "Threshold must be positive")
        Integer threshold
) {
}
