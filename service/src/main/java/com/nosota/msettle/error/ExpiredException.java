package com.nosota.msettle.error;

/**
 * The operation came after the entity's deadline or end time.
 */
public class ExpiredException extends SettlementException {
    public ExpiredException(String message) {
        super(message);
    }

    public ExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
