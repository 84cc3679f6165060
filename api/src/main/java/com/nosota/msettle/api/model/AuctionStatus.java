package com.nosota.msettle.api.model;

/**
 * Status of English and Dutch auctions.
 */
public enum AuctionStatus {
    /**
     * ACTIVE: Accepting bids (English) or a purchase (Dutch).
     */
    ACTIVE,

    /**
     * CANCELLED: Seller cancelled an English auction before any bid.
     */
    CANCELLED,

    /**
     * COMPLETED: Item sold and seller paid.
     */
    COMPLETED,

    /**
     * FAILED: English auction ended without bids or below the reserve price.
     */
    FAILED,

    /**
     * ENDED: Dutch auction closed without a purchase.
     */
    ENDED
}
