package com.nosota.msettle.api.response;

import com.nosota.msettle.api.model.CommandType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response describing a multi-sig pending transaction.
 *
 * @param txIndex       Wallet-scoped transaction number
 * @param confirmations Owners that confirmed, in no particular order
 */
public record PendingTransactionResponse(
        UUID id,
        UUID walletId,
        Long txIndex,
        String creator,
        CommandType command,
        String destination,
        Long value,
        byte[] payload,
        String argument,
        List<String> confirmations,
        boolean executed,
        boolean cancelled,
        Instant createdAt,
        Instant executedAt
) {}
