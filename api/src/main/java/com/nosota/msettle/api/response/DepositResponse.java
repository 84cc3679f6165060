package com.nosota.msettle.api.response;

import java.util.UUID;

/**
 * Response for deposit operation.
 *
 * @param referenceId       Ledger reference of the deposit entry
 * @param principal         Credited account
 * @param asset             Credited asset
 * @param amount            Deposited amount
 * @param balance           Balance after the deposit
 * @param externalReference External reference echoed back
 */
public record DepositResponse(
        UUID referenceId,
        String principal,
        String asset,
        Long amount,
        Long balance,
        String externalReference
) {}
