package com.nosota.msettle.service;

import com.nosota.msettle.error.AuthorizationException;
import com.nosota.msettle.error.ValidationException;
import com.nosota.msettle.model.SystemAccounts;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.Instant;

/**
 * Checks on principals supplied from outside the core.
 */
final class CallerGuard {

    private CallerGuard() {
    }

    /**
     * The acting principal must be present and must not be a reserved system account.
     */
    static void requireCaller(String caller) throws AuthorizationException {
        if (!StringUtils.hasText(caller)) {
            throw new AuthorizationException("Caller identity is required");
        }
        if (SystemAccounts.isSystem(caller)) {
            throw new AuthorizationException("Caller may not act as system account " + caller);
        }
    }

    /**
     * A counterparty named in a request must be present and must not be a reserved system account.
     */
    static void requireParticipant(String principal, String role) throws ValidationException {
        if (!StringUtils.hasText(principal)) {
            throw new ValidationException(role + " is required");
        }
        if (SystemAccounts.isSystem(principal)) {
            throw new ValidationException(role + " may not be a system account: " + principal);
        }
    }

    static void requirePositive(Long amount, String what) throws ValidationException {
        if (amount == null || amount <= 0) {
            throw new ValidationException(what + " must be positive, got " + amount);
        }
    }

    /**
     * {@code base} shifted by {@code seconds}, rejected when it falls outside the supported time range.
     */
    static Instant offset(Instant base, long seconds, String what) throws ValidationException {
        try {
            return base.plusSeconds(seconds);
        } catch (DateTimeException | ArithmeticException e) {
            throw new ValidationException(what + " is out of range: " + seconds + "s from " + base, e);
        }
    }
}
