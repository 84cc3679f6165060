package com.nosota.msettle.api.model;

/**
 * Party in whose favour an escrow dispute is resolved.
 */
public enum DisputeWinner {
    BUYER,
    SELLER
}
