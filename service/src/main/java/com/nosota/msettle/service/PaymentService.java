package com.nosota.msettle.service;

import com.nosota.msettle.api.model.Assets;
import com.nosota.msettle.api.model.ConditionType;
import com.nosota.msettle.api.model.PaymentKind;
import com.nosota.msettle.api.model.PaymentStatus;
import com.nosota.msettle.dto.TransferResult;
import com.nosota.msettle.error.*;
import com.nosota.msettle.event.SettlementEventKind;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.Payment;
import com.nosota.msettle.model.PaymentLeg;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.repository.PaymentRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Direct, scheduled, conditional, recurring, split and batch payments.
 *
 * <p>Pending payments (scheduled, conditional, recurring installments) hold their amount in
 * {@code sys:payment}; settlement moves it to the recipient fee-skimmed, cancellation and refund
 * move it back to the sender in full.
 *
 * <p>Nothing here waits: due payments are settled only when {@link #executeScheduledPayment} is
 * called, by a client or by the payment keeper.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PaymentRepository paymentRepository;
    private final AccountLedgerService accountLedgerService;
    private final ConditionEvaluator conditionEvaluator;
    private final FeePolicy feePolicy;
    private final IdGenerator idGenerator;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;

    // ==================== Direct ====================

    /**
     * Immediate fee-skimmed transfer.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment createDirectPayment(String sender, String recipient, Long amount, String description)
            throws SettlementException {
        CallerGuard.requireCaller(sender);
        CallerGuard.requireParticipant(recipient, "Recipient");
        CallerGuard.requirePositive(amount, "Payment amount");

        Payment payment = newPayment(PaymentKind.DIRECT, sender, recipient, amount, description);
        accountLedgerService.transferWithFee(sender, recipient, amount, payment.getFeeBps(),
                payment.getId(), "Direct payment");
        complete(payment);
        payment = paymentRepository.save(payment);

        eventPublisher.publish(payment.getId(), SettlementEventKind.PAYMENT_COMPLETED);
        log.info("Direct payment {}: {} -> {}, amount={}", payment.getId(), sender, recipient, amount);
        return payment;
    }

    // ==================== Scheduled ====================

    /**
     * Holds the amount until {@code releaseTime}.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment createScheduledPayment(String sender, String recipient, Long amount, @NotNull Instant releaseTime,
                                          String description) throws SettlementException {
        CallerGuard.requireCaller(sender);
        CallerGuard.requireParticipant(recipient, "Recipient");
        CallerGuard.requirePositive(amount, "Payment amount");
        if (sender.equals(recipient)) {
            throw new ValidationException("Sender and recipient must differ");
        }
        if (releaseTime.isBefore(clock.instant())) {
            throw new ValidationException("Release time is in the past: " + releaseTime);
        }

        Payment payment = newPayment(PaymentKind.SCHEDULED, sender, recipient, amount, description);
        payment.setReleaseTime(releaseTime);
        hold(payment);
        payment = paymentRepository.save(payment);

        eventPublisher.publish(payment.getId(), SettlementEventKind.PAYMENT_CREATED);
        log.info("Scheduled payment {}: {} -> {}, amount={}, releaseTime={}",
                payment.getId(), sender, recipient, amount, releaseTime);
        return payment;
    }

    /**
     * Settles a scheduled payment (or recurring installment) whose release time has come.
     * Anyone may trigger it.
     *
     * @throws InvalidStateException if not yet due, or no longer pending
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment executeScheduledPayment(@NotNull UUID paymentId, String caller) throws SettlementException {
        Payment payment = getForUpdate(paymentId);
        requireKind(payment, PaymentKind.SCHEDULED);
        requirePending(payment);
        Instant now = clock.instant();
        if (now.isBefore(payment.getReleaseTime())) {
            throw new InvalidStateException(String.format(
                    "Payment %s is not due until %s", paymentId, payment.getReleaseTime()));
        }

        accountLedgerService.transferWithFee(SystemAccounts.PAYMENT, payment.getRecipient(), payment.getAmount(),
                payment.getFeeBps(), paymentId, "Scheduled payment release");
        complete(payment);
        payment = paymentRepository.save(payment);

        eventPublisher.publish(paymentId, SettlementEventKind.PAYMENT_COMPLETED);
        log.info("Executed scheduled payment {} (triggered by {})", paymentId, caller);
        return payment;
    }

    /**
     * Cancels a pending scheduled payment and refunds the sender. Sender only.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment cancelScheduledPayment(@NotNull UUID paymentId, String caller) throws SettlementException {
        Payment payment = getForUpdate(paymentId);
        requireKind(payment, PaymentKind.SCHEDULED);
        requireSender(payment, caller);
        requirePending(payment);

        refund(payment, PaymentStatus.CANCELLED, "Scheduled payment cancelled");
        payment = paymentRepository.save(payment);

        eventPublisher.publish(paymentId, SettlementEventKind.PAYMENT_CANCELLED);
        log.info("Cancelled scheduled payment {}", paymentId);
        return payment;
    }

    // ==================== Conditional ====================

    /**
     * Holds the amount until the verifier proves the condition, rejects, or the deadline passes.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment createConditionalPayment(String sender, String recipient, Long amount, String verifier,
                                            @NotNull ConditionType conditionType, Instant notBefore,
                                            List<String> requiredSigners, Integer threshold, String target,
                                            @NotNull Instant deadline) throws SettlementException {
        CallerGuard.requireCaller(sender);
        CallerGuard.requireParticipant(recipient, "Recipient");
        CallerGuard.requireParticipant(verifier, "Verifier");
        CallerGuard.requirePositive(amount, "Payment amount");
        if (sender.equals(recipient)) {
            throw new ValidationException("Sender and recipient must differ");
        }
        if (!deadline.isAfter(clock.instant())) {
            throw new ValidationException("Deadline must be in the future: " + deadline);
        }
        conditionEvaluator.validate(conditionType, notBefore, requiredSigners, threshold, target);

        Payment payment = newPayment(PaymentKind.CONDITIONAL, sender, recipient, amount, null);
        payment.setVerifier(verifier);
        payment.setConditionType(conditionType);
        payment.setConditionNotBefore(notBefore);
        payment.setConditionTarget(target);
        payment.setConditionThreshold(threshold);
        if (requiredSigners != null) {
            payment.getRequiredSigners().addAll(requiredSigners.stream().distinct().toList());
        }
        payment.setDeadline(deadline);
        hold(payment);
        payment = paymentRepository.save(payment);

        eventPublisher.publish(payment.getId(), SettlementEventKind.PAYMENT_CREATED);
        log.info("Conditional payment {}: {} -> {}, amount={}, condition={}, verifier={}, deadline={}",
                payment.getId(), sender, recipient, amount, conditionType, verifier, deadline);
        return payment;
    }

    /**
     * Releases a conditional payment after checking the proof. Verifier only, before the deadline.
     *
     * @param signers Signatures presented for a SIGNATURES condition
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment fulfillConditionalPayment(@NotNull UUID paymentId, String caller, List<String> signers)
            throws SettlementException {
        Payment payment = getForUpdate(paymentId);
        requireKind(payment, PaymentKind.CONDITIONAL);
        requirePending(payment);
        requireVerifier(payment, caller);
        if (clock.instant().isAfter(payment.getDeadline())) {
            throw new ExpiredException(String.format(
                    "Payment %s passed its deadline %s", paymentId, payment.getDeadline()));
        }
        conditionEvaluator.verify(payment, signers);

        accountLedgerService.transferWithFee(SystemAccounts.PAYMENT, payment.getRecipient(), payment.getAmount(),
                payment.getFeeBps(), paymentId, "Conditional payment release");
        complete(payment);
        payment = paymentRepository.save(payment);

        eventPublisher.publish(paymentId, SettlementEventKind.PAYMENT_COMPLETED);
        log.info("Conditional payment {} fulfilled by {}", paymentId, caller);
        return payment;
    }

    /**
     * Verifier declares the condition failed; the sender is refunded.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment rejectConditionalPayment(@NotNull UUID paymentId, String caller) throws SettlementException {
        Payment payment = getForUpdate(paymentId);
        requireKind(payment, PaymentKind.CONDITIONAL);
        requirePending(payment);
        requireVerifier(payment, caller);

        refund(payment, PaymentStatus.FAILED, "Conditional payment rejected");
        payment = paymentRepository.save(payment);

        eventPublisher.publish(paymentId, SettlementEventKind.PAYMENT_FAILED);
        log.info("Conditional payment {} rejected by {}", paymentId, caller);
        return payment;
    }

    /**
     * Refunds a conditional payment whose deadline has passed unfulfilled. Anyone may trigger it;
     * the money only ever goes back to the sender.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment refundExpiredPayment(@NotNull UUID paymentId, String caller) throws SettlementException {
        Payment payment = getForUpdate(paymentId);
        requireKind(payment, PaymentKind.CONDITIONAL);
        requirePending(payment);
        if (!clock.instant().isAfter(payment.getDeadline())) {
            throw new InvalidStateException(String.format(
                    "Payment %s has not passed its deadline %s", paymentId, payment.getDeadline()));
        }

        refund(payment, PaymentStatus.REFUNDED, "Conditional payment expired");
        payment = paymentRepository.save(payment);

        eventPublisher.publish(paymentId, SettlementEventKind.PAYMENT_REFUNDED);
        log.info("Expired conditional payment {} refunded (triggered by {})", paymentId, caller);
        return payment;
    }

    // ==================== Recurring ====================

    /**
     * Settles the first installment now and schedules {@code count - 1} more, one per interval.
     *
     * @return The first installment, parent of the chain
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment createRecurringPayment(String sender, String recipient, Long amount, Long intervalSeconds,
                                          Integer count) throws SettlementException {
        CallerGuard.requireCaller(sender);
        CallerGuard.requireParticipant(recipient, "Recipient");
        CallerGuard.requirePositive(amount, "Installment amount");
        CallerGuard.requirePositive(intervalSeconds, "Interval");
        if (count == null || count < 1) {
            throw new ValidationException("Installment count must be positive, got " + count);
        }
        if (sender.equals(recipient)) {
            throw new ValidationException("Sender and recipient must differ");
        }
        long total;
        long lastOffset;
        try {
            total = Math.multiplyExact(amount, (long) count);
            lastOffset = Math.multiplyExact(intervalSeconds, (long) count - 1);
        } catch (ArithmeticException e) {
            throw new ValidationException("Recurring payment total overflows", e);
        }
        Instant now = clock.instant();
        CallerGuard.offset(now, lastOffset, "Last installment time");
        long available = accountLedgerService.getBalance(sender, Assets.NATIVE);
        if (available < total) {
            throw new InsufficientFundsException(String.format(
                    "Recurring payment needs %d, %s holds %d", total, sender, available));
        }

        Payment parent = newPayment(PaymentKind.RECURRING, sender, recipient, amount, null);
        parent.setInstallment(1);
        parent.setReleaseTime(now);
        accountLedgerService.transferWithFee(sender, recipient, amount, parent.getFeeBps(),
                parent.getId(), "Recurring payment installment 1");
        complete(parent);
        parent = paymentRepository.save(parent);

        for (int k = 1; k < count; k++) {
            Payment installment = newPayment(PaymentKind.SCHEDULED, sender, recipient, amount,
                    "Recurring payment installment " + (k + 1));
            installment.setParentPaymentId(parent.getId());
            installment.setInstallment(k + 1);
            installment.setReleaseTime(CallerGuard.offset(now, intervalSeconds * k, "Installment time"));
            hold(installment);
            paymentRepository.save(installment);
        }

        eventPublisher.publish(parent.getId(), SettlementEventKind.PAYMENT_CREATED);
        log.info("Recurring payment {}: {} -> {}, {} x {} every {}s",
                parent.getId(), sender, recipient, count, amount, intervalSeconds);
        return parent;
    }

    /**
     * Cancels every pending installment of a recurring chain and refunds them. Sender only.
     *
     * @return The installments cancelled
     */
    @Transactional(rollbackOn = SettlementException.class)
    public List<Payment> cancelRecurringPayment(@NotNull UUID parentPaymentId, String caller)
            throws SettlementException {
        Payment parent = getForUpdate(parentPaymentId);
        requireKind(parent, PaymentKind.RECURRING);
        requireSender(parent, caller);

        List<Payment> cancelled = new ArrayList<>();
        for (Payment installment : paymentRepository.findByParentPaymentIdOrderByInstallmentAsc(parentPaymentId)) {
            if (installment.getStatus() == PaymentStatus.PENDING) {
                refund(installment, PaymentStatus.CANCELLED, "Recurring payment cancelled");
                cancelled.add(paymentRepository.save(installment));
                eventPublisher.publish(installment.getId(), SettlementEventKind.PAYMENT_CANCELLED);
            }
        }
        if (cancelled.isEmpty()) {
            throw new InvalidStateException("Recurring payment " + parentPaymentId + " has no pending installments");
        }

        log.info("Cancelled {} installments of recurring payment {}", cancelled.size(), parentPaymentId);
        return cancelled;
    }

    // ==================== Split & batch ====================

    /**
     * Fans {@code amount} out by percentages summing to exactly 100. Each share is
     * {@code floor(amount * pct / 100)} and is fee-skimmed on its own; the rounding remainder
     * stays with the sender.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment createSplitPayment(String sender, Long amount, @NotNull List<String> recipients,
                                      @NotNull List<Integer> percentages) throws SettlementException {
        CallerGuard.requireCaller(sender);
        CallerGuard.requirePositive(amount, "Payment amount");
        validateFanOut(sender, recipients, percentages.size());
        int sum = 0;
        for (Integer percentage : percentages) {
            if (percentage == null || percentage <= 0) {
                throw new ValidationException("Percentages must be positive, got " + percentage);
            }
            sum += percentage;
        }
        if (sum != 100) {
            throw new ValidationException("Percentages must sum to 100, got " + sum);
        }

        List<Long> shares = new ArrayList<>();
        for (Integer percentage : percentages) {
            long share = BigDecimal.valueOf(amount)
                    .multiply(BigDecimal.valueOf(percentage))
                    .divide(HUNDRED, 0, RoundingMode.DOWN)
                    .longValueExact();
            if (share == 0) {
                throw new ValidationException(String.format("Share of %d%% of %d is zero", percentage, amount));
            }
            shares.add(share);
        }

        Payment payment = newPayment(PaymentKind.SPLIT, sender, null, amount, null);
        long distributed = 0;
        for (int i = 0; i < recipients.size(); i++) {
            TransferResult result = accountLedgerService.transferWithFee(sender, recipients.get(i), shares.get(i),
                    payment.getFeeBps(), payment.getId(), "Split payment " + percentages.get(i) + "%");
            payment.getLegs().add(toLeg(recipients.get(i), result, percentages.get(i)));
            distributed += shares.get(i);
        }
        payment.setRefundedAmount(amount - distributed);
        complete(payment);
        payment = paymentRepository.save(payment);

        eventPublisher.publish(payment.getId(), SettlementEventKind.PAYMENT_COMPLETED);
        log.info("Split payment {}: {} split {} ways, distributed={}, remainder={}",
                payment.getId(), amount, recipients.size(), distributed, amount - distributed);
        return payment;
    }

    /**
     * Pays each recipient its own amount, fee-skimmed. The sender must hold {@code fundedAmount} and the
     * total may not exceed it; the difference never leaves the sender and is reported as refunded.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Payment createBatchPayment(String sender, Long fundedAmount, @NotNull List<String> recipients,
                                      @NotNull List<Long> amounts) throws SettlementException {
        CallerGuard.requireCaller(sender);
        CallerGuard.requirePositive(fundedAmount, "Funded amount");
        validateFanOut(sender, recipients, amounts.size());
        long total = 0;
        for (Long amount : amounts) {
            CallerGuard.requirePositive(amount, "Batch amount");
            try {
                total = Math.addExact(total, amount);
            } catch (ArithmeticException e) {
                throw new ValidationException("Batch total overflows", e);
            }
        }
        if (total > fundedAmount) {
            throw new ValidationException(
                    String.format("Batch total %d exceeds funded amount %d", total, fundedAmount));
        }
        long available = accountLedgerService.getBalance(sender, Assets.NATIVE);
        if (available < fundedAmount) {
            throw new InsufficientFundsException(String.format(
                    "Batch payment declares %d funded, %s holds %d", fundedAmount, sender, available));
        }

        Payment payment = newPayment(PaymentKind.BATCH, sender, null, fundedAmount, null);
        for (int i = 0; i < recipients.size(); i++) {
            TransferResult result = accountLedgerService.transferWithFee(sender, recipients.get(i), amounts.get(i),
                    payment.getFeeBps(), payment.getId(), "Batch payment");
            payment.getLegs().add(toLeg(recipients.get(i), result, null));
        }
        payment.setRefundedAmount(fundedAmount - total);
        complete(payment);
        payment = paymentRepository.save(payment);

        eventPublisher.publish(payment.getId(), SettlementEventKind.PAYMENT_COMPLETED);
        log.info("Batch payment {}: {} recipients, total={}, funded={}",
                payment.getId(), recipients.size(), total, fundedAmount);
        return payment;
    }

    // ==================== Queries ====================

    public Payment getPayment(@NotNull UUID paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new EntityNotFoundException("Payment not found: " + paymentId));
    }

    public List<Payment> getInstallments(@NotNull UUID parentPaymentId) {
        getPayment(parentPaymentId);
        return paymentRepository.findByParentPaymentIdOrderByInstallmentAsc(parentPaymentId);
    }

    /**
     * Ids of pending scheduled payments whose release time has passed.
     */
    public List<UUID> findDuePaymentIds() {
        return paymentRepository.findDueIds(PaymentKind.SCHEDULED, PaymentStatus.PENDING, clock.instant());
    }

    // ==================== Internals ====================

    private Payment newPayment(PaymentKind kind, String sender, String recipient, long amount, String description) {
        Payment payment = new Payment();
        payment.setId(idGenerator.nextId());
        payment.setKind(kind);
        payment.setStatus(PaymentStatus.PENDING);
        payment.setSender(sender);
        payment.setRecipient(recipient);
        payment.setAmount(amount);
        payment.setFeeBps(feePolicy.defaultBps());
        payment.setDescription(description);
        payment.setCreatedAt(clock.instant());
        return payment;
    }

    private void hold(Payment payment) throws SettlementException {
        accountLedgerService.transfer(payment.getSender(), SystemAccounts.PAYMENT, Assets.NATIVE, payment.getAmount(),
                payment.getId(), payment.getKind() + " payment hold");
    }

    private void refund(Payment payment, PaymentStatus status, String reason) throws SettlementException {
        accountLedgerService.transfer(SystemAccounts.PAYMENT, payment.getSender(), Assets.NATIVE, payment.getAmount(),
                payment.getId(), reason);
        payment.setStatus(status);
        payment.setCompletedAt(clock.instant());
    }

    private void complete(Payment payment) {
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setCompletedAt(clock.instant());
    }

    private PaymentLeg toLeg(String recipient, TransferResult result, Integer percentage) {
        return new PaymentLeg(recipient, result.amount(), result.fee(), result.netAmount(), percentage);
    }

    private void validateFanOut(String sender, List<String> recipients, int valueCount) throws ValidationException {
        if (recipients.isEmpty()) {
            throw new ValidationException("At least one recipient is required");
        }
        if (recipients.size() != valueCount) {
            throw new ValidationException(String.format(
                    "Recipients (%d) and values (%d) must have the same length", recipients.size(), valueCount));
        }
        for (String recipient : recipients) {
            CallerGuard.requireParticipant(recipient, "Recipient");
            if (recipient.equals(sender)) {
                throw new ValidationException("Sender may not pay itself: " + sender);
            }
        }
    }

    private Payment getForUpdate(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new EntityNotFoundException("Payment not found: " + paymentId));
    }

    private void requireKind(Payment payment, PaymentKind kind) throws InvalidStateException {
        if (payment.getKind() != kind) {
            throw new InvalidStateException(
                    String.format("Payment %s is %s, expected %s", payment.getId(), payment.getKind(), kind));
        }
    }

    private void requirePending(Payment payment) throws InvalidStateException {
        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new InvalidStateException(
                    String.format("Payment %s is already %s", payment.getId(), payment.getStatus()));
        }
    }

    private void requireSender(Payment payment, String caller) throws AuthorizationException {
        if (!payment.getSender().equals(caller)) {
            throw new AuthorizationException(
                    String.format("Only the sender may do this on payment %s, caller: %s", payment.getId(), caller));
        }
    }

    private void requireVerifier(Payment payment, String caller) throws AuthorizationException {
        if (!payment.getVerifier().equals(caller)) {
            throw new AuthorizationException(
                    String.format("Only the verifier may do this on payment %s, caller: %s", payment.getId(), caller));
        }
    }
}
