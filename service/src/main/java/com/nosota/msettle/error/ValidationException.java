package com.nosota.msettle.error;

/**
 * Malformed input: non-positive amount, bad percentages, overflow, self-transfer.
 */
public class ValidationException extends SettlementException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
