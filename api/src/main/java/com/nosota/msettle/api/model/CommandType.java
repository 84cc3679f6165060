package com.nosota.msettle.api.model;

/**
 * Command carried by a multi-sig pending transaction.
 * <p>
 * The engine understands every command except {@link #FORWARD}, which is passed through
 * to the destination together with its opaque payload.
 * </p>
 */
public enum CommandType {
    /**
     * Plain value transfer from the wallet to the destination principal.
     */
    TRANSFER,

    /**
     * Value transfer plus invocation of externally controlled code at the destination.
     */
    FORWARD,

    /**
     * Adds the destination principal to the owner set.
     */
    ADD_OWNER,

    /**
     * Removes the destination principal from the owner set.
     */
    REMOVE_OWNER,

    /**
     * Replaces the confirmation threshold with the transaction value.
     */
    CHANGE_THRESHOLD;

    public boolean movesValue() {
        return this == TRANSFER || this == FORWARD;
    }
}
