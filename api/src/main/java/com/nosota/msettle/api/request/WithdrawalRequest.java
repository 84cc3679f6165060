package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for withdrawing funds out of the ledger.
 *
 * @param asset               Asset to debit ({@code NATIVE} or a token id), optional
 * @param amount              Amount to withdraw (in minor units)
 * @param destinationAccount  External destination (bank account, address), for audit only
 */
public record WithdrawalRequest(
        String asset,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        String destinationAccount
) {
}
