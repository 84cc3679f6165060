package com.nosota.msettle.api.request;

import com.nosota.msettle.api.model.DisputeWinner;
import jakarta.validation.constraints.NotNull;

/**
 * Arbiter's decision on a disputed escrow.
 *
 * @param winner Party receiving the escrowed funds
 */
public record ResolveEscrowRequest(
        @NotNull(message = "Winner is required")
        DisputeWinner winner
) {
}
