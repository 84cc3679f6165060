package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request for creating a multi-sig wallet. The caller becomes the wallet admin.
 *
 * @param owners    Distinct owner principals (at least one)
 * @param threshold Confirmations required before execution (1..owners.size())
 */
public record CreateWalletRequest(
        @NotEmpty(message = "At least one owner is required")
        List<String> owners,

        @NotNull(message = "Threshold is required")
        @Positive(message = "Threshold must be positive")
        Integer threshold
) {
}
