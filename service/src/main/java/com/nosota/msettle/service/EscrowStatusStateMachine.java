package com.nosota.msettle.service;

import com.nosota.msettle.api.model.EscrowStatus;
import com.nosota.msettle.error.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating EscrowStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *          CREATED
 *             |
 *          FUNDED
 *             |
 *     +-------+--------+
 *     |       |        |
 * RELEASED REFUNDED DISPUTED
 *                      |
 *                   RESOLVED
 * </pre>
 *
 * <p>RELEASED, REFUNDED and RESOLVED are terminal, so an escrow reaches exactly one outcome.
 * CREATED and FUNDED are passed in a single creation step.
 */
@Component
public class EscrowStatusStateMachine {

    private static final Map<EscrowStatus, Set<EscrowStatus>> ALLOWED_TRANSITIONS = Map.of(
            EscrowStatus.CREATED, EnumSet.of(EscrowStatus.FUNDED),
            EscrowStatus.FUNDED, EnumSet.of(
                    EscrowStatus.RELEASED,
                    EscrowStatus.REFUNDED,
                    EscrowStatus.DISPUTED
            ),
            EscrowStatus.DISPUTED, EnumSet.of(EscrowStatus.RESOLVED)
    );

    /**
     * Unlike ledger statuses, a same-status transition is never allowed: releasing a released
     * escrow must fail.
     */
    public boolean isTransitionAllowed(EscrowStatus fromStatus, EscrowStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<EscrowStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * @throws InvalidStateException if the transition is not allowed
     */
    public void validateTransition(EscrowStatus fromStatus, EscrowStatus toStatus) throws InvalidStateException {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStateException(
                    String.format("Invalid escrow status transition: %s → %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    public boolean isFinalState(EscrowStatus status) {
        return status == EscrowStatus.RELEASED
                || status == EscrowStatus.REFUNDED
                || status == EscrowStatus.RESOLVED;
    }

    public Set<EscrowStatus> getAllowedTransitions(EscrowStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
