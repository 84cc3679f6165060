package com.nosota.msettle.api.response;

import com.nosota.msettle.api.dto.PaymentLegDTO;
import com.nosota.msettle.api.model.ConditionType;
import com.nosota.msettle.api.model.PaymentKind;
import com.nosota.msettle.api.model.PaymentStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response describing a payment.
 *
 * @param legs           Per-recipient breakdown once settled (all kinds)
 * @param refundedAmount Amount returned to the sender (batch excess, cancellations)
 */
public record PaymentResponse(
        UUID id,
        PaymentKind kind,
        PaymentStatus status,
        String sender,
        String recipient,
        Long amount,
        Integer feeBps,
        Instant releaseTime,
        UUID parentPaymentId,
        Integer installment,
        String verifier,
        ConditionType conditionType,
        Instant deadline,
        List<PaymentLegDTO> legs,
        Long refundedAmount,
        String description,
        Instant createdAt,
        Instant completedAt
) {}
