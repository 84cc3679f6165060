package com.nosota.msettle.api;

import com.nosota.msettle.api.request.*;
import com.nosota.msettle.api.response.PaymentResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Payment API: direct, scheduled, conditional, recurring, split and batch payments.
 *
 * <p>The sender of every created payment is the caller. Pending payments are moved forward
 * only by explicit calls (execute, fulfill, cancel...); nothing is settled in the background
 * by the ledger itself.
 */
@RequestMapping("/api/v1/payments")
public interface PaymentApi {

    // ==================== Creation ====================

    @PostMapping("/direct")
    ResponseEntity<PaymentResponse> createDirectPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid DirectPaymentRequest request) throws Exception;

    @PostMapping("/scheduled")
    ResponseEntity<PaymentResponse> createScheduledPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid ScheduledPaymentRequest request) throws Exception;

    @PostMapping("/conditional")
    ResponseEntity<PaymentResponse> createConditionalPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid ConditionalPaymentRequest request) throws Exception;

    /**
     * Creates a recurring payment; returns the first (already settled) installment.
     */
    @PostMapping("/recurring")
    ResponseEntity<PaymentResponse> createRecurringPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid RecurringPaymentRequest request) throws Exception;

    @PostMapping("/split")
    ResponseEntity<PaymentResponse> createSplitPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid SplitPaymentRequest request) throws Exception;

    @PostMapping("/batch")
    ResponseEntity<PaymentResponse> createBatchPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid BatchPaymentRequest request) throws Exception;

    // ==================== Lifecycle ====================

    /**
     * Settles a scheduled payment whose release time has come. Anyone may trigger it.
     */
    @PostMapping("/{paymentId}/execute")
    ResponseEntity<PaymentResponse> executeScheduledPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("paymentId") UUID paymentId) throws Exception;

    @PostMapping("/{paymentId}/cancel")
    ResponseEntity<PaymentResponse> cancelScheduledPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("paymentId") UUID paymentId) throws Exception;

    @PostMapping("/{paymentId}/fulfill")
    ResponseEntity<PaymentResponse> fulfillConditionalPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody FulfillConditionRequest request) throws Exception;

    @PostMapping("/{paymentId}/reject")
    ResponseEntity<PaymentResponse> rejectConditionalPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("paymentId") UUID paymentId) throws Exception;

    @PostMapping("/{paymentId}/refund-expired")
    ResponseEntity<PaymentResponse> refundExpiredPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("paymentId") UUID paymentId) throws Exception;

    /**
     * Cancels every pending installment of a recurring payment and refunds the sender.
     */
    @PostMapping("/{paymentId}/cancel-recurring")
    ResponseEntity<List<PaymentResponse>> cancelRecurringPayment(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("paymentId") UUID paymentId) throws Exception;

    // ==================== Queries ====================

    @GetMapping("/{paymentId}")
    ResponseEntity<PaymentResponse> getPayment(
            @PathVariable("paymentId") UUID paymentId);

    @GetMapping("/{paymentId}/installments")
    ResponseEntity<List<PaymentResponse>> getInstallments(
            @PathVariable("paymentId") UUID paymentId);
}
