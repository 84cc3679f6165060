package com.nosota.msettle.api.model;

/**
 * Payment status in the settlement system.
 */
public enum PaymentStatus {
    /**
     * PENDING: Funds are held in payment custody waiting for a release time or condition.
     */
    PENDING,

    /**
     * COMPLETED: Recipient(s) paid (minus platform fee).
     * This is a final state.
     */
    COMPLETED,

    /**
     * CANCELLED: Sender cancelled before release; held funds returned.
     * This is a final state.
     */
    CANCELLED,

    /**
     * FAILED: Verifier rejected the condition; held funds returned.
     * This is a final state.
     */
    FAILED,

    /**
     * REFUNDED: Condition deadline passed; held funds returned.
     * This is a final state.
     */
    REFUNDED;

    public boolean isFinal() {
        return this != PENDING;
    }
}
