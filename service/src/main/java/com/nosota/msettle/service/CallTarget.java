package com.nosota.msettle.service;

/**
 * Externally controlled code reachable through a multi-sig FORWARD execution.
 *
 * <p>Implementations are registered as Spring beans and looked up by {@link #address()}.
 * They run outside any ledger transaction and may call back into the service.
 */
public interface CallTarget {

    /**
     * Principal the target is deployed at.
     */
    String address();

    /**
     * Handles a forwarded call. Throwing marks the call as failed.
     *
     * @param source  Principal the value came from ({@code sys:multisig:<walletId>})
     * @param value   Native amount already credited to {@link #address()}
     * @param payload Opaque payload of the pending transaction, possibly null
     */
    void onCall(String source, long value, byte[] payload) throws Exception;
}
