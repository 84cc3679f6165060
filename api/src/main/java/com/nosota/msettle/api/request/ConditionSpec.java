package com.nosota.msettle.api.request;

import com.nosota.msettle.api.model.ConditionType;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * Release condition of a conditional payment.
 *
 * @param type            Kind of check performed on fulfilment
 * @param notBefore       TIME: moment after which the condition holds
 * @param requiredSigners SIGNATURES: principals whose approval counts
 * @param threshold       SIGNATURES: distinct approvals needed
 * @param target          CONTRACT_PRESENCE: address that must have code registered
 */
public record ConditionSpec(
        @NotNull(message = "Condition type is required")
        ConditionType type,

        Instant notBefore,

        List<String> requiredSigners,

        Integer threshold,

        String target
) {
}
