package com.nosota.msettle.event;

public enum SettlementEventKind {
    DEPOSITED,
    WITHDRAWN,
    TRANSFERRED,

    ESCROW_CREATED,
    ESCROW_RELEASED,
    ESCROW_REFUNDED,
    ESCROW_DISPUTED,
    ESCROW_RESOLVED,

    WALLET_CREATED,
    WALLET_DEPOSITED,
    WALLET_DEACTIVATED,
    TRANSACTION_PROPOSED,
    TRANSACTION_CONFIRMED,
    CONFIRMATION_REVOKED,
    TRANSACTION_EXECUTED,
    TRANSACTION_CANCELLED,
    OWNER_ADDED,
    OWNER_REMOVED,
    THRESHOLD_CHANGED,

    AUCTION_CREATED,
    BID_PLACED,
    AUCTION_ENDED,
    AUCTION_CANCELLED,
    DUTCH_AUCTION_CREATED,
    DUTCH_AUCTION_PURCHASED,
    DUTCH_AUCTION_ENDED,

    PAYMENT_CREATED,
    PAYMENT_COMPLETED,
    PAYMENT_CANCELLED,
    PAYMENT_FAILED,
    PAYMENT_REFUNDED
}
