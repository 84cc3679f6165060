package com.nosota.msettle.tests;

import com.nosota.msettle.TestBase;
import com.nosota.msettle.api.ApiHeaders;
import com.nosota.msettle.api.model.DisputeWinner;
import com.nosota.msettle.api.model.EscrowStatus;
import com.nosota.msettle.api.request.CreateEscrowRequest;
import com.nosota.msettle.api.request.ResolveEscrowRequest;
import com.nosota.msettle.api.response.EscrowResponse;
import com.nosota.msettle.error.AuthorizationException;
import com.nosota.msettle.error.ExpiredException;
import com.nosota.msettle.error.InvalidStateException;
import com.nosota.msettle.error.ValidationException;
import com.nosota.msettle.model.Escrow;
import com.nosota.msettle.model.SystemAccounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for two-party escrow.
 *
 * <p>Every escrow reaches exactly one of RELEASED, REFUNDED or RESOLVED.
 */
@DisplayName("2. Escrow Tests")
public class EscrowTest extends TestBase {

    private static final long ONE_DAY = 24 * 3600L;

    private Escrow createEscrow(String buyer, String seller, long amount) throws Exception {
        return escrowService.createEscrow(buyer, seller, amount, ONE_DAY, null, null, "order");
    }

    @Test
    @DisplayName("ESC-001: Release of 100.00 at 2.5% pays seller 97.50 and platform 2.50")
    void releasePaysSellerMinusFee() throws Exception {
        String buyer = fundedPrincipal("buyer", 10_000L);
        String seller = newPrincipal("seller");
        long platformBefore = platformBalance();
        long custodyBefore = balance(SystemAccounts.ESCROW);

        MvcResult created = mockMvc.perform(post("/api/v1/escrows")
                        .header(ApiHeaders.CALLER_ID, buyer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CreateEscrowRequest(seller, 10_000L, ONE_DAY, null, 250, "order-1"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("FUNDED"))
                .andExpect(jsonPath("$.arbiter").value("test-arbiter"))
                .andReturn();
        UUID escrowId = objectMapper.readValue(
                created.getResponse().getContentAsString(), EscrowResponse.class).id();

        assertThat(balance(buyer)).isZero();
        assertThat(balance(SystemAccounts.ESCROW) - custodyBefore).isEqualTo(10_000L);

        mockMvc.perform(post("/api/v1/escrows/{escrowId}/release", escrowId)
                        .header(ApiHeaders.CALLER_ID, buyer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RELEASED"));

        assertThat(balance(seller)).isEqualTo(9_750L);
        assertThat(platformBalance() - platformBefore).isEqualTo(250L);
        assertThat(balance(SystemAccounts.ESCROW)).isEqualTo(custodyBefore);
    }

    @Test
    @DisplayName("ESC-002: A released escrow cannot be released or refunded again")
    void singleOutcome() throws Exception {
        String buyer = fundedPrincipal("buyer", 1_000L);
        String seller = newPrincipal("seller");
        Escrow escrow = createEscrow(buyer, seller, 1_000L);

        escrowService.releaseEscrow(escrow.getId(), buyer);

        assertThatThrownBy(() -> escrowService.releaseEscrow(escrow.getId(), buyer))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> escrowService.refundEscrow(escrow.getId(), seller))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> escrowService.disputeEscrow(escrow.getId(), buyer))
                .isInstanceOf(InvalidStateException.class);

        assertThat(escrowService.getEscrow(escrow.getId()).getStatus()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(balance(seller)).isEqualTo(975L);
    }

    @Test
    @DisplayName("ESC-003: Only the buyer releases, only the seller refunds")
    void callerChecks() throws Exception {
        String buyer = fundedPrincipal("buyer", 1_000L);
        String seller = newPrincipal("seller");
        Escrow escrow = createEscrow(buyer, seller, 1_000L);

        assertThatThrownBy(() -> escrowService.releaseEscrow(escrow.getId(), seller))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> escrowService.refundEscrow(escrow.getId(), buyer))
                .isInstanceOf(AuthorizationException.class);

        mockMvc.perform(post("/api/v1/escrows/{escrowId}/release", escrow.getId())
                        .header(ApiHeaders.CALLER_ID, newPrincipal("stranger")))
                .andExpect(status().isForbidden());

        Escrow refunded = escrowService.refundEscrow(escrow.getId(), seller);
        assertThat(refunded.getStatus()).isEqualTo(EscrowStatus.REFUNDED);
        assertThat(balance(buyer)).isEqualTo(1_000L);
        assertThat(balance(seller)).isZero();
    }

    @Test
    @DisplayName("ESC-004: Release is refused after expiry; the buyer claims the funds back instead")
    void expiry() throws Exception {
        String buyer = fundedPrincipal("buyer", 2_000L);
        String seller = newPrincipal("seller");
        Escrow escrow = createEscrow(buyer, seller, 2_000L);

        assertThatThrownBy(() -> escrowService.claimExpiredEscrow(escrow.getId(), buyer))
                .isInstanceOf(InvalidStateException.class);

        clock.advanceSeconds(ONE_DAY + 1);

        assertThatThrownBy(() -> escrowService.releaseEscrow(escrow.getId(), buyer))
                .isInstanceOf(ExpiredException.class);
        assertThatThrownBy(() -> escrowService.claimExpiredEscrow(escrow.getId(), seller))
                .isInstanceOf(AuthorizationException.class);

        mockMvc.perform(post("/api/v1/escrows/{escrowId}/claim-expired", escrow.getId())
                        .header(ApiHeaders.CALLER_ID, buyer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REFUNDED"));

        assertThat(balance(buyer)).isEqualTo(2_000L);
    }

    @Test
    @DisplayName("ESC-005: Release exactly at the expiry instant is still allowed")
    void releaseAtExpiryInstant() throws Exception {
        String buyer = fundedPrincipal("buyer", 500L);
        String seller = newPrincipal("seller");
        Escrow escrow = createEscrow(buyer, seller, 500L);

        clock.setInstant(escrow.getExpiresAt());

        assertThat(escrowService.releaseEscrow(escrow.getId(), buyer).getStatus()).isEqualTo(EscrowStatus.RELEASED);
    }

    @Test
    @DisplayName("ESC-006: Disputes are resolved by the arbiter only")
    void disputeResolvedForSeller() throws Exception {
        String buyer = fundedPrincipal("buyer", 4_000L);
        String seller = newPrincipal("seller");
        String arbiter = newPrincipal("arbiter");
        Escrow escrow = escrowService.createEscrow(buyer, seller, 4_000L, ONE_DAY, arbiter, 100, null);

        assertThatThrownBy(() -> escrowService.disputeEscrow(escrow.getId(), arbiter))
                .isInstanceOf(AuthorizationException.class);
        Escrow disputed = escrowService.disputeEscrow(escrow.getId(), seller);
        assertThat(disputed.getStatus()).isEqualTo(EscrowStatus.DISPUTED);
        assertThat(disputed.getDisputedBy()).isEqualTo(seller);

        assertThatThrownBy(() -> escrowService.releaseEscrow(escrow.getId(), buyer))
                .isInstanceOf(InvalidStateException.class);

        mockMvc.perform(post("/api/v1/escrows/{escrowId}/resolve", escrow.getId())
                        .header(ApiHeaders.CALLER_ID, buyer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ResolveEscrowRequest(DisputeWinner.BUYER))))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/escrows/{escrowId}/resolve", escrow.getId())
                        .header(ApiHeaders.CALLER_ID, arbiter)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ResolveEscrowRequest(DisputeWinner.SELLER))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.winner").value("SELLER"));

        // 1% fee on seller win
        assertThat(balance(seller)).isEqualTo(3_960L);
        assertThat(balance(buyer)).isZero();
    }

    @Test
    @DisplayName("ESC-007: Dispute resolved for the buyer refunds in full")
    void disputeResolvedForBuyer() throws Exception {
        String buyer = fundedPrincipal("buyer", 4_000L);
        String seller = newPrincipal("seller");
        Escrow escrow = createEscrow(buyer, seller, 4_000L);

        escrowService.disputeEscrow(escrow.getId(), buyer);
        Escrow resolved = escrowService.resolveEscrow(escrow.getId(), "test-arbiter", DisputeWinner.BUYER);

        assertThat(resolved.getStatus()).isEqualTo(EscrowStatus.RESOLVED);
        assertThat(resolved.getClosedAt()).isNotNull();
        assertThat(balance(buyer)).isEqualTo(4_000L);
    }

    @Test
    @DisplayName("ESC-008: Invalid escrows are rejected before any money moves")
    void validation() throws Exception {
        String buyer = fundedPrincipal("buyer", 100L);
        String seller = newPrincipal("seller");

        assertThatThrownBy(() -> escrowService.createEscrow(buyer, buyer, 50L, ONE_DAY, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> escrowService.createEscrow(buyer, seller, 50L, ONE_DAY, seller, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> escrowService.createEscrow(buyer, seller, 0L, ONE_DAY, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> escrowService.createEscrow(buyer, SystemAccounts.PLATFORM, 50L, ONE_DAY, null, null, null))
                .isInstanceOf(ValidationException.class);

        mockMvc.perform(post("/api/v1/escrows")
                        .header(ApiHeaders.CALLER_ID, buyer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CreateEscrowRequest(seller, 101L, ONE_DAY, null, null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Insufficient Funds"));

        assertThat(balance(buyer)).isEqualTo(100L);
        assertThat(escrowService.getEscrowsByParticipant(buyer)).isEmpty();
    }

    @Test
    @DisplayName("ESC-010: Out-of-range expiry and system arbiters are validation errors")
    void expiryRangeAndArbiter() throws Exception {
        String buyer = fundedPrincipal("buyer", 100L);
        String seller = newPrincipal("seller");

        assertThatThrownBy(() -> escrowService.createEscrow(buyer, seller, 50L, Long.MAX_VALUE, null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Escrow expiry");
        assertThatThrownBy(() -> escrowService.createEscrow(buyer, seller, 50L, ONE_DAY, SystemAccounts.PLATFORM, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Arbiter");

        mockMvc.perform(post("/api/v1/escrows")
                        .header(ApiHeaders.CALLER_ID, buyer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CreateEscrowRequest(seller, 50L, Long.MAX_VALUE, null, null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));

        assertThat(balance(buyer)).isEqualTo(100L);
        assertThat(escrowService.getEscrowsByParticipant(buyer)).isEmpty();
    }

    @Test
    @DisplayName("ESC-009: Escrows are listed per participant and unknown ids give 404")
    void queries() throws Exception {
        String buyer = fundedPrincipal("buyer", 300L);
        String seller = newPrincipal("seller");
        createEscrow(buyer, seller, 100L);
        createEscrow(buyer, seller, 200L);

        mockMvc.perform(get("/api/v1/escrows").param("participant", seller))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/v1/escrows/{escrowId}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }
}
