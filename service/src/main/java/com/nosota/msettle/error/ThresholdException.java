package com.nosota.msettle.error;

/**
 * A confirmation threshold or payment cap was not met.
 */
public class ThresholdException extends SettlementException {
    public ThresholdException(String message) {
        super(message);
    }

    public ThresholdException(String message, Throwable cause) {
        super(message, cause);
    }
}
