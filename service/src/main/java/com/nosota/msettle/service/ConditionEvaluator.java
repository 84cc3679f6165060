package com.nosota.msettle.service;

import com.nosota.msettle.api.model.ConditionType;
import com.nosota.msettle.error.ThresholdException;
import com.nosota.msettle.error.ValidationException;
import com.nosota.msettle.model.Payment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Release conditions of conditional payments.
 *
 * <ul>
 *   <li>TIME: now is at or after {@code notBefore}</li>
 *   <li>SIGNATURES: at least {@code threshold} distinct required signers appear in the proof</li>
 *   <li>CONTRACT_PRESENCE: code is deployed at {@code target}</li>
 *   <li>CUSTOM: the verifier's call is the proof</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConditionEvaluator {

    private final ExternalCallGateway externalCallGateway;
    private final Clock clock;

    /**
     * Checks that a condition carries what its type needs. Called at payment creation.
     */
    public void validate(ConditionType type, Instant notBefore, List<String> requiredSigners,
                         Integer threshold, String target) throws ValidationException {
        if (type == null) {
            throw new ValidationException("Condition type is required");
        }
        switch (type) {
            case TIME -> {
                if (notBefore == null) {
                    throw new ValidationException("TIME condition requires notBefore");
                }
            }
            case SIGNATURES -> {
                if (requiredSigners == null || requiredSigners.isEmpty()) {
                    throw new ValidationException("SIGNATURES condition requires signers");
                }
                int distinct = new HashSet<>(requiredSigners).size();
                if (threshold == null || threshold < 1 || threshold > distinct) {
                    throw new ValidationException(
                            String.format("SIGNATURES threshold must be within [1, %d], got %s", distinct, threshold));
                }
            }
            case CONTRACT_PRESENCE -> {
                if (!StringUtils.hasText(target)) {
                    throw new ValidationException("CONTRACT_PRESENCE condition requires a target");
                }
            }
            case CUSTOM -> {
                // nothing to carry
            }
        }
    }

    /**
     * Checks a proof against the payment's condition.
     *
     * @param signers Signers presented by the verifier; used by SIGNATURES only
     * @throws ThresholdException if the condition is not met
     */
    public void verify(Payment payment, List<String> signers) throws ThresholdException {
        ConditionType type = payment.getConditionType();
        switch (type) {
            case TIME -> {
                Instant now = clock.instant();
                if (now.isBefore(payment.getConditionNotBefore())) {
                    throw new ThresholdException(String.format(
                            "Payment %s may not be released before %s", payment.getId(), payment.getConditionNotBefore()));
                }
            }
            case SIGNATURES -> {
                Set<String> valid = new HashSet<>(payment.getRequiredSigners());
                Set<String> presented = signers == null ? Set.of() : new HashSet<>(signers);
                valid.retainAll(presented);
                if (valid.size() < payment.getConditionThreshold()) {
                    throw new ThresholdException(String.format(
                            "Payment %s has %d valid signatures, %d required",
                            payment.getId(), valid.size(), payment.getConditionThreshold()));
                }
            }
            case CONTRACT_PRESENCE -> {
                if (!externalCallGateway.hasCode(payment.getConditionTarget())) {
                    throw new ThresholdException(String.format(
                            "No code deployed at %s for payment %s", payment.getConditionTarget(), payment.getId()));
                }
            }
            case CUSTOM -> log.debug("Custom condition of payment {} accepted by verifier", payment.getId());
        }
    }
}
