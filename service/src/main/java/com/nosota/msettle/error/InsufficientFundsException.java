package com.nosota.msettle.error;

/**
 * A debit would take a balance below zero.
 */
public class InsufficientFundsException extends SettlementException {
    public InsufficientFundsException(String message) {
        super(message);
    }

    public InsufficientFundsException(String message, Throwable cause) {
        super(message, cause);
    }
}
