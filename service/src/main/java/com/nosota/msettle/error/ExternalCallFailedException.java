package com.nosota.msettle.error;

/**
 * The destination invoked by a forwarded multi-sig execution failed.
 *
 * <p>Raised after the execution has been committed: the wallet stays debited and the
 * transaction stays executed.
 */
public class ExternalCallFailedException extends SettlementException {
    public ExternalCallFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
