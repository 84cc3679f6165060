package com.nosota.msettle.model;

import com.nosota.msettle.api.model.ConditionType;
import com.nosota.msettle.api.model.PaymentKind;
import com.nosota.msettle.api.model.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A payment of any kind.
 *
 * <p>Pending SCHEDULED and CONDITIONAL payments hold their amount in {@code sys:payment}.
 * SPLIT and BATCH payments fan out to {@link #legs} and have no single recipient. Recurring
 * chains link installments to the first one through {@link #parentPaymentId}.
 */
@Entity
@Table(name = "payment")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Payment {
    @Id
    private UUID id;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false, length = 128)
    private String sender;

    @Column(length = 128)
    private String recipient;

    @Column(nullable = false)
    private Long amount;

    @Column(name = "fee_bps", nullable = false)
    private Integer feeBps;

    @Column(name = "release_time")
    private Instant releaseTime;

    @Column(name = "parent_payment_id")
    private UUID parentPaymentId;

    private Integer installment;

    // Condition (CONDITIONAL only)

    @Column(length = 128)
    private String verifier;

    @Enumerated(EnumType.STRING)
    @Column(name = "condition_type", length = 20)
    private ConditionType conditionType;

    @Column(name = "condition_not_before")
    private Instant conditionNotBefore;

    @Column(name = "condition_target", length = 128)
    private String conditionTarget;

    @Column(name = "condition_threshold")
    private Integer conditionThreshold;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_required_signer", joinColumns = @JoinColumn(name = "payment_id"))
    @OrderColumn(name = "signer_order")
    @Column(name = "signer", nullable = false, length = 128)
    private List<String> requiredSigners = new ArrayList<>();

    private Instant deadline;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_leg", joinColumns = @JoinColumn(name = "payment_id"))
    @OrderColumn(name = "leg_order")
    private List<PaymentLeg> legs = new ArrayList<>();

    /**
     * Part of a batch's funded amount that never left the sender.
     */
    @Column(name = "refunded_amount")
    private Long refundedAmount;

    private String description;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
