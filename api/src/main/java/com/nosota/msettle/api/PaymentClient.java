package com.nosota.msettle.api;

import com.nosota.msettle.api.request.*;
import com.nosota.msettle.api.response.PaymentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of PaymentApi.
 *
 * <p>Not a Spring @Component; see {@link LedgerClient} for registration.
 */
@RequiredArgsConstructor
@Slf4j
public class PaymentClient implements PaymentApi {

    private static final String BASE = "/api/v1/payments";

    private final WebClient webClient;

    @Override
    public ResponseEntity<PaymentResponse> createDirectPayment(String caller, DirectPaymentRequest request) {
        return create(caller, "direct", request);
    }

    @Override
    public ResponseEntity<PaymentResponse> createScheduledPayment(String caller, ScheduledPaymentRequest request) {
        return create(caller, "scheduled", request);
    }

    @Override
    public ResponseEntity<PaymentResponse> createConditionalPayment(String caller, ConditionalPaymentRequest request) {
        return create(caller, "conditional", request);
    }

    @Override
    public ResponseEntity<PaymentResponse> createRecurringPayment(String caller, RecurringPaymentRequest request) {
        return create(caller, "recurring", request);
    }

    @Override
    public ResponseEntity<PaymentResponse> createSplitPayment(String caller, SplitPaymentRequest request) {
        return create(caller, "split", request);
    }

    @Override
    public ResponseEntity<PaymentResponse> createBatchPayment(String caller, BatchPaymentRequest request) {
        return create(caller, "batch", request);
    }

    @Override
    public ResponseEntity<PaymentResponse> executeScheduledPayment(String caller, UUID paymentId) {
        return action(caller, paymentId, "execute");
    }

    @Override
    public ResponseEntity<PaymentResponse> cancelScheduledPayment(String caller, UUID paymentId) {
        return action(caller, paymentId, "cancel");
    }

    @Override
    public ResponseEntity<PaymentResponse> fulfillConditionalPayment(String caller, UUID paymentId,
                                                                     FulfillConditionRequest request) {
        log.debug("Calling fulfillConditionalPayment: paymentId={}, verifier={}", paymentId, caller);

        return webClient.post()
                .uri(BASE + "/{paymentId}/fulfill", paymentId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> rejectConditionalPayment(String caller, UUID paymentId) {
        return action(caller, paymentId, "reject");
    }

    @Override
    public ResponseEntity<PaymentResponse> refundExpiredPayment(String caller, UUID paymentId) {
        return action(caller, paymentId, "refund-expired");
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> cancelRecurringPayment(String caller, UUID paymentId) {
        log.debug("Calling cancelRecurringPayment: paymentId={}, caller={}", paymentId, caller);

        return webClient.post()
                .uri(BASE + "/{paymentId}/cancel-recurring", paymentId)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<PaymentResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> getPayment(UUID paymentId) {
        return webClient.get()
                .uri(BASE + "/{paymentId}", paymentId)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> getInstallments(UUID paymentId) {
        return webClient.get()
                .uri(BASE + "/{paymentId}/installments", paymentId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<PaymentResponse>>() {})
                .block();
    }

    private ResponseEntity<PaymentResponse> create(String caller, String kind, Object request) {
        log.debug("Calling create {} payment: sender={}", kind, caller);

        return webClient.post()
                .uri(BASE + "/{kind}", kind)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    private ResponseEntity<PaymentResponse> action(String caller, UUID paymentId, String action) {
        log.debug("Calling payment {}: paymentId={}, caller={}", action, paymentId, caller);

        return webClient.post()
                .uri(BASE + "/{paymentId}/{action}", paymentId, action)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }
}
