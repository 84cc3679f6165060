package com.nosota.msettle.error;

/**
 * The entity is not in a state that allows the operation.
 */
public class InvalidStateException extends SettlementException {
    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
