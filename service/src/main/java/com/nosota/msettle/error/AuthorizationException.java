package com.nosota.msettle.error;

/**
 * The caller is not allowed to perform the operation on this entity.
 */
public class AuthorizationException extends SettlementException {
    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
