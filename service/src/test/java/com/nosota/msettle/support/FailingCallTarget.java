package com.nosota.msettle.support;

import com.nosota.msettle.service.CallTarget;

/**
 * Call target that rejects every call.
 */
public class FailingCallTarget implements CallTarget {

    public static final String ADDRESS = "contract:failing";

    @Override
    public String address() {
        return ADDRESS;
    }

    @Override
    public void onCall(String source, long value, byte[] payload) {
        throw new IllegalStateException("call rejected by " + ADDRESS);
    }
}
