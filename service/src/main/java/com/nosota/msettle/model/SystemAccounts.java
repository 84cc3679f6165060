package com.nosota.msettle.model;

import java.util.UUID;

/**
 * Reserved principals holding platform fees and protocol custody.
 */
public final class SystemAccounts {

    public static final String PREFIX = "sys:";

    public static final String PLATFORM = PREFIX + "platform";
    public static final String ESCROW = PREFIX + "escrow";
    public static final String AUCTION = PREFIX + "auction";
    public static final String PAYMENT = PREFIX + "payment";

    private SystemAccounts() {
    }

    public static String multiSig(UUID walletId) {
        return PREFIX + "multisig:" + walletId;
    }

    public static boolean isSystem(String principal) {
        return principal != null && principal.startsWith(PREFIX);
    }
}
