package com.nosota.msettle.error;

/**
 * Root of the checked failures raised by settlement operations.
 *
 * <p>Every operation checks its preconditions before mutating anything and runs in a single
 * JPA transaction rolled back on any {@code SettlementException}, so a thrown exception
 * always means "nothing changed".
 */
public class SettlementException extends Exception {
    public SettlementException() {
    }

    public SettlementException(String message) {
        super(message);
    }

    public SettlementException(String message, Throwable cause) {
        super(message, cause);
    }

    public SettlementException(Throwable cause) {
        super(cause);
    }
}
