package com.nosota.msettle.api.request;

import com.nosota.msettle.api.model.CommandType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for proposing a multi-sig transaction. The caller must be an owner.
 *
 * @param command     Command to execute once confirmed
 * @param destination Receiving principal (TRANSFER/FORWARD) or owner (ADD_OWNER/REMOVE_OWNER)
 * @param value       Native amount moved out of the wallet, or the new threshold (CHANGE_THRESHOLD)
 * @param payload     Opaque call data handed to the destination (FORWARD only)
 * @param argument    Free-form note kept with the transaction
 */
public record ProposeTransactionRequest(
        @NotNull(message = "Command is required")
        CommandType command,

        String destination,

        @PositiveOrZero(message = "Value must not be negative")
        Long value,

        byte[] payload,

        String argument
) {
}
