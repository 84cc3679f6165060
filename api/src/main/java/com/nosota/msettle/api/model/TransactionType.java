package com.nosota.msettle.api.model;

/**
 * Direction of a ledger entry.
 */
public enum TransactionType {
    CREDIT,
    DEBIT
}
