package com.nosota.msettle.api.model;

/**
 * Escrow status in the settlement system.
 * Tracks the lifecycle of a two-party conditional hold.
 */
public enum EscrowStatus {
    /**
     * CREATED: Escrow record exists but holds no funds.
     * Not reachable through the API: creation and funding happen in one step.
     */
    CREATED,

    /**
     * FUNDED: Buyer's amount is in escrow custody.
     * Can be released, refunded, disputed or claimed after expiry.
     */
    FUNDED,

    /**
     * RELEASED: Seller was paid (minus platform fee).
     * This is a final state.
     */
    RELEASED,

    /**
     * REFUNDED: Full amount returned to the buyer (seller refund or expiry claim).
     * This is a final state.
     */
    REFUNDED,

    /**
     * DISPUTED: One of the parties raised a dispute.
     * Only the arbiter can move the escrow forward.
     */
    DISPUTED,

    /**
     * RESOLVED: Arbiter decided the dispute in favour of buyer or seller.
     * This is a final state.
     */
    RESOLVED
}
