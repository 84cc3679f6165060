package com.nosota.msettle.api.response;

import java.util.UUID;

/**
 * Response for fee-skimmed transfer operation.
 */
public record TransferResponse(
        UUID referenceId,
        String sender,
        String recipient,
        Long amount,
        Long fee,
        Long netAmount,
        Long senderBalance,
        Long recipientBalance
) {}
