package com.nosota.msettle.tests;

import com.nosota.msettle.TestBase;
import com.nosota.msettle.api.ApiHeaders;
import com.nosota.msettle.api.model.ConditionType;
import com.nosota.msettle.api.model.PaymentKind;
import com.nosota.msettle.api.model.PaymentStatus;
import com.nosota.msettle.api.request.ConditionSpec;
import com.nosota.msettle.api.request.ConditionalPaymentRequest;
import com.nosota.msettle.api.request.FulfillConditionRequest;
import com.nosota.msettle.api.request.ScheduledPaymentRequest;
import com.nosota.msettle.api.request.SplitPaymentRequest;
import com.nosota.msettle.api.response.PaymentResponse;
import com.nosota.msettle.error.AuthorizationException;
import com.nosota.msettle.error.ExpiredException;
import com.nosota.msettle.error.InsufficientFundsException;
import com.nosota.msettle.error.InvalidStateException;
import com.nosota.msettle.error.ThresholdException;
import com.nosota.msettle.error.ValidationException;
import com.nosota.msettle.model.Payment;
import com.nosota.msettle.model.PaymentLeg;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.support.RecordingCallTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("6. Payment Tests")
public class PaymentTest extends TestBase {

    private Instant inSeconds(long seconds) {
        return clock.instant().plusSeconds(seconds);
    }

    @Nested
    @DisplayName("Direct, split and batch")
    class FanOut {

        @Test
        @DisplayName("PAY-001: Direct payment settles immediately, fee-skimmed")
        void direct() throws Exception {
            String sender = fundedPrincipal("sender", 1_000L);
            String recipient = newPrincipal("recipient");

            Payment payment = paymentService.createDirectPayment(sender, recipient, 1_000L, "invoice 7");

            assertThat(payment.getKind()).isEqualTo(PaymentKind.DIRECT);
            assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(balance(sender)).isZero();
            assertThat(balance(recipient)).isEqualTo(975L);
        }

        @Test
        @DisplayName("PAY-002: Split of 100.00 at 60/40 nets 58.50 and 39.00")
        void split() throws Exception {
            String sender = fundedPrincipal("sender", 10_000L);
            String first = newPrincipal("first");
            String second = newPrincipal("second");
            long platformBefore = platformBalance();

            Payment payment = paymentService.createSplitPayment(sender, 10_000L,
                    List.of(first, second), List.of(60, 40));

            assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(payment.getRefundedAmount()).isZero();
            assertThat(balance(first)).isEqualTo(5_850L);
            assertThat(balance(second)).isEqualTo(3_900L);
            assertThat(platformBalance() - platformBefore).isEqualTo(250L);
            assertThat(balance(sender)).isZero();
            assertThat(payment.getLegs()).extracting(PaymentLeg::getGrossAmount).containsExactly(6_000L, 4_000L);
            assertThat(payment.getLegs()).extracting(PaymentLeg::getFee).containsExactly(150L, 100L);
        }

        @Test
        @DisplayName("PAY-003: Split rounding dust stays with the sender")
        void splitDust() throws Exception {
            String sender = fundedPrincipal("sender", 1_000L);

            Payment payment = paymentService.createSplitPayment(sender, 1_000L,
                    List.of(newPrincipal("a"), newPrincipal("b"), newPrincipal("c")), List.of(33, 33, 34));
            assertThat(payment.getRefundedAmount()).isZero();

            String other = fundedPrincipal("sender", 101L);
            Payment uneven = paymentService.createSplitPayment(other, 101L,
                    List.of(newPrincipal("a"), newPrincipal("b")), List.of(50, 50));
            assertThat(uneven.getRefundedAmount()).isEqualTo(1L);
            assertThat(balance(other)).isEqualTo(1L);
        }

        @Test
        @DisplayName("PAY-004: Split percentages must be positive and sum to 100")
        void splitValidation() throws Exception {
            String sender = fundedPrincipal("sender", 1_000L);
            String a = newPrincipal("a");
            String b = newPrincipal("b");

            assertThatThrownBy(() -> paymentService.createSplitPayment(sender, 1_000L, List.of(a, b), List.of(60, 30)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createSplitPayment(sender, 1_000L, List.of(a, b), List.of(100, 0)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createSplitPayment(sender, 1_000L, List.of(a), List.of(60, 40)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createSplitPayment(sender, 1_000L, List.of(a, sender), List.of(50, 50)))
                    .isInstanceOf(ValidationException.class);
            assertThat(balance(sender)).isEqualTo(1_000L);
        }

        @Test
        @DisplayName("PAY-005: Batch pays each amount and reports the unspent excess")
        void batch() throws Exception {
            String sender = fundedPrincipal("sender", 5_000L);
            String a = newPrincipal("a");
            String b = newPrincipal("b");

            Payment payment = paymentService.createBatchPayment(sender, 5_000L, List.of(a, b), List.of(1_000L, 2_000L));

            assertThat(payment.getRefundedAmount()).isEqualTo(2_000L);
            assertThat(balance(sender)).isEqualTo(2_000L);
            assertThat(balance(a)).isEqualTo(975L);
            assertThat(balance(b)).isEqualTo(1_950L);

            assertThatThrownBy(() -> paymentService.createBatchPayment(sender, 100L, List.of(a), List.of(101L)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createBatchPayment(sender, 3_000L, List.of(a), List.of(3_000L)))
                    .isInstanceOf(InsufficientFundsException.class);
            assertThatThrownBy(() -> paymentService.createBatchPayment(sender, 1_000_000L, List.of(a), List.of(50L)))
                    .isInstanceOf(InsufficientFundsException.class);
            assertThat(balance(sender)).isEqualTo(2_000L);
            assertThat(balance(a)).isEqualTo(975L);
        }

        @Test
        @DisplayName("PAY-006: Split over REST returns the legs")
        void splitRest() throws Exception {
            String sender = fundedPrincipal("sender", 10_000L);

            mockMvc.perform(post("/api/v1/payments/split")
                            .header(ApiHeaders.CALLER_ID, sender)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new SplitPaymentRequest(10_000L,
                                    List.of(newPrincipal("a"), newPrincipal("b")), List.of(60, 40)))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.kind").value("SPLIT"))
                    .andExpect(jsonPath("$.legs.length()").value(2))
                    .andExpect(jsonPath("$.legs[0].netAmount").value(5850))
                    .andExpect(jsonPath("$.legs[1].percentage").value(40));
        }
    }

    @Nested
    @DisplayName("Scheduled and recurring")
    class Scheduled {

        @Test
        @DisplayName("PAY-101: A scheduled payment executes once, only after its release time")
        void executeOnceWhenDue() throws Exception {
            String sender = fundedPrincipal("sender", 1_000L);
            String recipient = newPrincipal("recipient");
            String keeper = newPrincipal("keeper");
            Payment payment = paymentService.createScheduledPayment(sender, recipient, 1_000L, inSeconds(3_600), null);

            assertThat(balance(sender)).isZero();
            assertThatThrownBy(() -> paymentService.executeScheduledPayment(payment.getId(), keeper))
                    .isInstanceOf(InvalidStateException.class)
                    .hasMessageContaining("not due");

            clock.advanceSeconds(3_600);
            Payment executed = paymentService.executeScheduledPayment(payment.getId(), keeper);

            assertThat(executed.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(balance(recipient)).isEqualTo(975L);

            assertThatThrownBy(() -> paymentService.executeScheduledPayment(payment.getId(), keeper))
                    .isInstanceOf(InvalidStateException.class)
                    .hasMessageContaining("already COMPLETED");
            assertThat(balance(recipient)).isEqualTo(975L);
        }

        @Test
        @DisplayName("PAY-102: The sender may cancel a pending scheduled payment")
        void cancel() throws Exception {
            String sender = fundedPrincipal("sender", 1_000L);
            String recipient = newPrincipal("recipient");
            Payment payment = paymentService.createScheduledPayment(sender, recipient, 400L, inSeconds(60), null);

            assertThatThrownBy(() -> paymentService.cancelScheduledPayment(payment.getId(), recipient))
                    .isInstanceOf(AuthorizationException.class);
            Payment cancelled = paymentService.cancelScheduledPayment(payment.getId(), sender);

            assertThat(cancelled.getStatus()).isEqualTo(PaymentStatus.CANCELLED);
            assertThat(balance(sender)).isEqualTo(1_000L);

            clock.advanceSeconds(60);
            assertThatThrownBy(() -> paymentService.executeScheduledPayment(payment.getId(), sender))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("PAY-103: Release times in the past and self payments are rejected")
        void validation() throws Exception {
            String sender = fundedPrincipal("sender", 1_000L);
            String recipient = newPrincipal("recipient");

            assertThatThrownBy(() -> paymentService.createScheduledPayment(sender, recipient, 100L,
                    clock.instant().minusSeconds(1), null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createScheduledPayment(sender, sender, 100L, inSeconds(60), null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createScheduledPayment(sender, recipient, 1_001L, inSeconds(60), null))
                    .isInstanceOf(InsufficientFundsException.class);
        }

        @Test
        @DisplayName("PAY-104: Recurring payment settles the first installment and schedules the rest")
        void recurring() throws Exception {
            String sender = fundedPrincipal("sender", 3_000L);
            String recipient = newPrincipal("recipient");

            Payment parent = paymentService.createRecurringPayment(sender, recipient, 1_000L, 86_400L, 3);

            assertThat(parent.getKind()).isEqualTo(PaymentKind.RECURRING);
            assertThat(parent.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(parent.getInstallment()).isEqualTo(1);
            assertThat(balance(recipient)).isEqualTo(975L);
            assertThat(balance(sender)).isZero();

            List<Payment> installments = paymentService.getInstallments(parent.getId());
            assertThat(installments).extracting(Payment::getInstallment).containsExactly(2, 3);
            assertThat(installments).extracting(Payment::getStatus).containsOnly(PaymentStatus.PENDING);
            assertThat(installments.get(1).getReleaseTime()).isEqualTo(parent.getReleaseTime().plusSeconds(2 * 86_400L));

            clock.advanceSeconds(86_400L);
            paymentService.executeScheduledPayment(installments.get(0).getId(), recipient);
            assertThat(balance(recipient)).isEqualTo(1_950L);

            List<Payment> cancelled = paymentService.cancelRecurringPayment(parent.getId(), sender);
            assertThat(cancelled).hasSize(1);
            assertThat(cancelled.get(0).getInstallment()).isEqualTo(3);
            assertThat(balance(sender)).isEqualTo(1_000L);

            assertThatThrownBy(() -> paymentService.cancelRecurringPayment(parent.getId(), sender))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("PAY-105: Recurring payment needs the full total up front")
        void recurringNeedsTotal() throws Exception {
            String sender = fundedPrincipal("sender", 2_999L);
            String recipient = newPrincipal("recipient");

            assertThatThrownBy(() -> paymentService.createRecurringPayment(sender, recipient, 1_000L, 60L, 3))
                    .isInstanceOf(InsufficientFundsException.class);
            assertThatThrownBy(() -> paymentService.createRecurringPayment(sender, recipient, 1_000L, 60L, 0))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createRecurringPayment(sender, recipient, 10L, Long.MAX_VALUE / 4, 3))
                    .isInstanceOf(ValidationException.class);
            assertThat(balance(sender)).isEqualTo(2_999L);
        }

        @Test
        @DisplayName("PAY-106: Scheduled payment over REST")
        void scheduledRest() throws Exception {
            String sender = fundedPrincipal("sender", 500L);
            String recipient = newPrincipal("recipient");

            MvcResult created = mockMvc.perform(post("/api/v1/payments/scheduled")
                            .header(ApiHeaders.CALLER_ID, sender)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    new ScheduledPaymentRequest(recipient, 500L, inSeconds(120), "rent"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("PENDING"))
                    .andReturn();
            UUID paymentId = objectMapper.readValue(created.getResponse().getContentAsString(), PaymentResponse.class).id();

            mockMvc.perform(post("/api/v1/payments/{paymentId}/execute", paymentId)
                            .header(ApiHeaders.CALLER_ID, recipient))
                    .andExpect(status().isConflict());

            clock.advanceSeconds(120);
            mockMvc.perform(post("/api/v1/payments/{paymentId}/execute", paymentId)
                            .header(ApiHeaders.CALLER_ID, recipient))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("COMPLETED"));

            mockMvc.perform(get("/api/v1/payments/{paymentId}", paymentId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.completedAt").exists());
        }
    }

    @Nested
    @DisplayName("Conditional")
    class Conditional {

        @Test
        @DisplayName("PAY-201: Signature condition releases once enough required signers are presented")
        void signatures() throws Exception {
            String sender = fundedPrincipal("sender", 2_000L);
            String recipient = newPrincipal("recipient");
            String verifier = newPrincipal("verifier");
            Payment payment = paymentService.createConditionalPayment(sender, recipient, 2_000L, verifier,
                    ConditionType.SIGNATURES, null, List.of("s1", "s2", "s3"), 2, null, inSeconds(3_600));

            assertThatThrownBy(() -> paymentService.fulfillConditionalPayment(payment.getId(), verifier,
                    List.of("s1", "intruder")))
                    .isInstanceOf(ThresholdException.class);
            assertThatThrownBy(() -> paymentService.fulfillConditionalPayment(payment.getId(), recipient,
                    List.of("s1", "s2")))
                    .isInstanceOf(AuthorizationException.class);

            Payment fulfilled = paymentService.fulfillConditionalPayment(payment.getId(), verifier, List.of("s1", "s3"));

            assertThat(fulfilled.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(balance(recipient)).isEqualTo(1_950L);
        }

        @Test
        @DisplayName("PAY-202: Time condition holds until notBefore")
        void time() throws Exception {
            String sender = fundedPrincipal("sender", 100L);
            String recipient = newPrincipal("recipient");
            String verifier = newPrincipal("verifier");
            Payment payment = paymentService.createConditionalPayment(sender, recipient, 100L, verifier,
                    ConditionType.TIME, inSeconds(600), null, null, null, inSeconds(3_600));

            assertThatThrownBy(() -> paymentService.fulfillConditionalPayment(payment.getId(), verifier, null))
                    .isInstanceOf(ThresholdException.class);

            clock.advanceSeconds(600);
            assertThat(paymentService.fulfillConditionalPayment(payment.getId(), verifier, null).getStatus())
                    .isEqualTo(PaymentStatus.COMPLETED);
        }

        @Test
        @DisplayName("PAY-203: Contract presence condition checks the target for code")
        void contractPresence() throws Exception {
            String sender = fundedPrincipal("sender", 200L);
            String verifier = newPrincipal("verifier");
            Payment missing = paymentService.createConditionalPayment(sender, newPrincipal("recipient"), 100L, verifier,
                    ConditionType.CONTRACT_PRESENCE, null, null, null, "contract:nowhere", inSeconds(3_600));
            Payment present = paymentService.createConditionalPayment(sender, newPrincipal("recipient"), 100L, verifier,
                    ConditionType.CONTRACT_PRESENCE, null, null, null, RecordingCallTarget.ADDRESS, inSeconds(3_600));

            assertThatThrownBy(() -> paymentService.fulfillConditionalPayment(missing.getId(), verifier, null))
                    .isInstanceOf(ThresholdException.class);
            assertThat(paymentService.fulfillConditionalPayment(present.getId(), verifier, null).getStatus())
                    .isEqualTo(PaymentStatus.COMPLETED);
        }

        @Test
        @DisplayName("PAY-204: Rejection refunds the sender")
        void reject() throws Exception {
            String sender = fundedPrincipal("sender", 300L);
            String verifier = newPrincipal("verifier");
            Payment payment = paymentService.createConditionalPayment(sender, newPrincipal("recipient"), 300L, verifier,
                    ConditionType.CUSTOM, null, null, null, null, inSeconds(3_600));

            assertThatThrownBy(() -> paymentService.rejectConditionalPayment(payment.getId(), sender))
                    .isInstanceOf(AuthorizationException.class);
            Payment rejected = paymentService.rejectConditionalPayment(payment.getId(), verifier);

            assertThat(rejected.getStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(balance(sender)).isEqualTo(300L);
            assertThatThrownBy(() -> paymentService.fulfillConditionalPayment(payment.getId(), verifier, null))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("PAY-205: After the deadline fulfilment fails and anyone may refund the sender")
        void deadline() throws Exception {
            String sender = fundedPrincipal("sender", 300L);
            String verifier = newPrincipal("verifier");
            String stranger = newPrincipal("stranger");
            long custodyBefore = balance(SystemAccounts.PAYMENT);
            Payment payment = paymentService.createConditionalPayment(sender, newPrincipal("recipient"), 300L, verifier,
                    ConditionType.CUSTOM, null, null, null, null, inSeconds(3_600));

            assertThatThrownBy(() -> paymentService.refundExpiredPayment(payment.getId(), stranger))
                    .isInstanceOf(InvalidStateException.class);

            clock.advanceSeconds(3_601);
            assertThatThrownBy(() -> paymentService.fulfillConditionalPayment(payment.getId(), verifier, null))
                    .isInstanceOf(ExpiredException.class);

            Payment refunded = paymentService.refundExpiredPayment(payment.getId(), stranger);
            assertThat(refunded.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(balance(sender)).isEqualTo(300L);
            assertThat(balance(SystemAccounts.PAYMENT)).isEqualTo(custodyBefore);
        }

        @Test
        @DisplayName("PAY-206: Incomplete conditions are rejected at creation")
        void validation() throws Exception {
            String sender = fundedPrincipal("sender", 300L);
            String recipient = newPrincipal("recipient");
            String verifier = newPrincipal("verifier");

            assertThatThrownBy(() -> paymentService.createConditionalPayment(sender, recipient, 100L, verifier,
                    ConditionType.SIGNATURES, null, List.of("s1"), 2, null, inSeconds(60)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createConditionalPayment(sender, recipient, 100L, verifier,
                    ConditionType.TIME, null, null, null, null, inSeconds(60)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> paymentService.createConditionalPayment(sender, recipient, 100L, verifier,
                    ConditionType.CUSTOM, null, null, null, null, clock.instant()))
                    .isInstanceOf(ValidationException.class);
            assertThat(balance(sender)).isEqualTo(300L);
        }

        @Test
        @DisplayName("PAY-207: Conditional payment over REST")
        void conditionalRest() throws Exception {
            String sender = fundedPrincipal("sender", 1_000L);
            String recipient = newPrincipal("recipient");
            String verifier = newPrincipal("verifier");
            ConditionSpec condition = new ConditionSpec(ConditionType.SIGNATURES, null, List.of("s1", "s2"), 1, null);

            MvcResult created = mockMvc.perform(post("/api/v1/payments/conditional")
                            .header(ApiHeaders.CALLER_ID, sender)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new ConditionalPaymentRequest(
                                    recipient, 1_000L, verifier, condition, inSeconds(600)))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.conditionType").value("SIGNATURES"))
                    .andReturn();
            UUID paymentId = objectMapper.readValue(created.getResponse().getContentAsString(), PaymentResponse.class).id();

            mockMvc.perform(post("/api/v1/payments/{paymentId}/fulfill", paymentId)
                            .header(ApiHeaders.CALLER_ID, verifier)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new FulfillConditionRequest(List.of("s9"), null))))
                    .andExpect(status().isUnprocessableEntity());

            mockMvc.perform(post("/api/v1/payments/{paymentId}/fulfill", paymentId)
                            .header(ApiHeaders.CALLER_ID, verifier)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new FulfillConditionRequest(List.of("s2"), "ok"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("COMPLETED"));

            assertThat(balance(recipient)).isEqualTo(975L);
        }
    }
}
