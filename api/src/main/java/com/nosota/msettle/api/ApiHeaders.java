package com.nosota.msettle.api;

/**
 * HTTP headers shared by all settlement endpoints.
 */
public final class ApiHeaders {

    /**
     * Verified identity of the principal performing the call.
     * <p>
     * Authentication happens upstream (gateway); the service trusts this value as the caller.
     * </p>
     */
    public static final String CALLER_ID = "X-Caller-Id";

    /**
     * Optional correlation id propagated into the logging MDC.
     */
    public static final String CORRELATION_ID = "X-Correlation-Id";

    private ApiHeaders() {
    }
}
