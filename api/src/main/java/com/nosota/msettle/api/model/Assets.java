package com.nosota.msettle.api.model;

/**
 * Asset identifiers understood by the ledger.
 * <p>
 * Any asset other than {@link #NATIVE} is a fungible token identified by an arbitrary string.
 * </p>
 */
public final class Assets {

    /**
     * The platform's native currency.
     */
    public static final String NATIVE = "NATIVE";

    private Assets() {
    }

    public static boolean isNative(String asset) {
        return asset == null || NATIVE.equals(asset);
    }
}
