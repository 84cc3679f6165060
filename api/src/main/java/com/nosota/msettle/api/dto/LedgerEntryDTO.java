package com.nosota.msettle.api.dto;

import com.nosota.msettle.api.model.TransactionType;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger journal entry.
 *
 * @param amount Signed amount: positive for CREDIT, negative for DEBIT
 */
public record LedgerEntryDTO(
        Long id,
        UUID referenceId,
        String principal,
        String asset,
        Long amount,
        TransactionType type,
        String description,
        Instant createdAt
) {}
