package com.nosota.msettle.controller;

import com.nosota.msettle.api.PaymentApi;
import com.nosota.msettle.api.request.*;
import com.nosota.msettle.api.response.PaymentResponse;
import com.nosota.msettle.mapper.PaymentMapper;
import com.nosota.msettle.model.Payment;
import com.nosota.msettle.service.PaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for payments.
 *
 * <p>Implements {@link PaymentApi} interface for:
 * <ul>
 *   <li>Creation of direct, scheduled, conditional, recurring, split and batch payments</li>
 *   <li>Lifecycle of pending payments (execute, cancel, fulfill, reject, refund)</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentController implements PaymentApi {

    private final PaymentService paymentService;

    // ==================== Creation ====================

    @Override
    public ResponseEntity<PaymentResponse> createDirectPayment(String caller, DirectPaymentRequest request)
            throws Exception {
        Payment payment = paymentService.createDirectPayment(caller, request.recipient(), request.amount(),
                request.description());
        return created(payment);
    }

    @Override
    public ResponseEntity<PaymentResponse> createScheduledPayment(String caller, ScheduledPaymentRequest request)
            throws Exception {
        Payment payment = paymentService.createScheduledPayment(caller, request.recipient(), request.amount(),
                request.releaseTime(), request.description());
        return created(payment);
    }

    @Override
    public ResponseEntity<PaymentResponse> createConditionalPayment(String caller, ConditionalPaymentRequest request)
            throws Exception {
        ConditionSpec condition = request.condition();
        Payment payment = paymentService.createConditionalPayment(caller, request.recipient(), request.amount(),
                request.verifier(), condition.type(), condition.notBefore(), condition.requiredSigners(),
                condition.threshold(), condition.target(), request.deadline());
        return created(payment);
    }

    @Override
    public ResponseEntity<PaymentResponse> createRecurringPayment(String caller, RecurringPaymentRequest request)
            throws Exception {
        Payment payment = paymentService.createRecurringPayment(caller, request.recipient(), request.amount(),
                request.intervalSeconds(), request.count());
        return created(payment);
    }

    @Override
    public ResponseEntity<PaymentResponse> createSplitPayment(String caller, SplitPaymentRequest request)
            throws Exception {
        Payment payment = paymentService.createSplitPayment(caller, request.amount(), request.recipients(),
                request.percentages());
        return created(payment);
    }

    @Override
    public ResponseEntity<PaymentResponse> createBatchPayment(String caller, BatchPaymentRequest request)
            throws Exception {
        Payment payment = paymentService.createBatchPayment(caller, request.fundedAmount(), request.recipients(),
                request.amounts());
        return created(payment);
    }

    // ==================== Lifecycle ====================

    @Override
    public ResponseEntity<PaymentResponse> executeScheduledPayment(String caller, UUID paymentId) throws Exception {
        return ok(paymentService.executeScheduledPayment(paymentId, caller));
    }

    @Override
    public ResponseEntity<PaymentResponse> cancelScheduledPayment(String caller, UUID paymentId) throws Exception {
        return ok(paymentService.cancelScheduledPayment(paymentId, caller));
    }

    @Override
    public ResponseEntity<PaymentResponse> fulfillConditionalPayment(String caller, UUID paymentId,
                                                                     FulfillConditionRequest request)
            throws Exception {
        List<String> signers = request == null ? null : request.signers();
        return ok(paymentService.fulfillConditionalPayment(paymentId, caller, signers));
    }

    @Override
    public ResponseEntity<PaymentResponse> rejectConditionalPayment(String caller, UUID paymentId) throws Exception {
        return ok(paymentService.rejectConditionalPayment(paymentId, caller));
    }

    @Override
    public ResponseEntity<PaymentResponse> refundExpiredPayment(String caller, UUID paymentId) throws Exception {
        return ok(paymentService.refundExpiredPayment(paymentId, caller));
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> cancelRecurringPayment(String caller, UUID paymentId)
            throws Exception {
        List<Payment> cancelled = paymentService.cancelRecurringPayment(paymentId, caller);
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponseList(cancelled));
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<PaymentResponse> getPayment(UUID paymentId) {
        return ok(paymentService.getPayment(paymentId));
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> getInstallments(UUID paymentId) {
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponseList(paymentService.getInstallments(paymentId)));
    }

    private static ResponseEntity<PaymentResponse> created(Payment payment) {
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentMapper.INSTANCE.toResponse(payment));
    }

    private static ResponseEntity<PaymentResponse> ok(Payment payment) {
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponse(payment));
    }
}
