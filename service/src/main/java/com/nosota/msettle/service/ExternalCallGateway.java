package com.nosota.msettle.service;

/**
 * The only way out of the core: invoking an external destination after a multi-sig
 * execution has been committed.
 */
public interface ExternalCallGateway {

    /**
     * Whether code is deployed at the destination. Calls to destinations without code are no-ops.
     */
    boolean hasCode(String destination);

    /**
     * Invokes the destination.
     *
     * @throws Exception whatever the destination throws
     */
    void invoke(String source, String destination, long value, byte[] payload) throws Exception;
}
