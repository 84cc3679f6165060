package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for depositing funds to an account from an external source.
 *
 * <p>Deposit represents value entering the ledger (bank transfer, card top-up, bridge).
 * The caller's account is credited; a missing asset means the native currency.
 *
 * @param asset             Asset to credit ({@code NATIVE} or a token id), optional
 * @param amount            Amount to deposit (in minor units)
 * @param externalReference External reference ID (e.g., bank transaction ID)
 */
public record DepositRequest(
        String asset,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        String externalReference
) {
}
