package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Request for adding an owner to a multi-sig wallet.
 *
 * @param owner Principal to add
 */
public record OwnerRequest(
        @NotBlank(message = "Owner is required")
        String owner
) {
}
