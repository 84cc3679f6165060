package com.nosota.msettle.dto;

import lombok.Builder;

import java.util.UUID;

/**
 * Outcome of a fee-skimmed transfer.
 *
 * @param referenceId Reference the journal entries were written under
 * @param amount      Gross amount debited from the sender
 * @param fee         Amount credited to the platform
 * @param netAmount   Amount credited to the recipient ({@code amount - fee})
 */
@Builder
public record TransferResult(
        UUID referenceId,
        long amount,
        long fee,
        long netAmount
) {
}
