package com.nosota.msettle.api.response;

import java.util.UUID;

/**
 * Response for withdrawal operation.
 */
public record WithdrawalResponse(
        UUID referenceId,
        String principal,
        String asset,
        Long amount,
        Long balance,
        String destinationAccount
) {}
