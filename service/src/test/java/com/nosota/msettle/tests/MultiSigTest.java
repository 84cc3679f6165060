package com.nosota.msettle.tests;

import com.nosota.msettle.TestBase;
import com.nosota.msettle.api.ApiHeaders;
import com.nosota.msettle.api.model.CommandType;
import com.nosota.msettle.api.request.AmountRequest;
import com.nosota.msettle.api.request.CreateWalletRequest;
import com.nosota.msettle.api.request.ProposeTransactionRequest;
import com.nosota.msettle.api.response.WalletResponse;
import com.nosota.msettle.error.AuthorizationException;
import com.nosota.msettle.error.ExternalCallFailedException;
import com.nosota.msettle.error.InsufficientFundsException;
import com.nosota.msettle.error.InvalidStateException;
import com.nosota.msettle.error.ThresholdException;
import com.nosota.msettle.error.ValidationException;
import com.nosota.msettle.model.MultiSigWallet;
import com.nosota.msettle.model.PendingTransaction;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.support.FailingCallTarget;
import com.nosota.msettle.support.RecordingCallTarget;
import com.nosota.msettle.support.ReentrantCallTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("3. Multi-Sig Wallet Tests")
public class MultiSigTest extends TestBase {

    @Autowired
    private RecordingCallTarget recordingCallTarget;

    @Autowired
    private ReentrantCallTarget reentrantCallTarget;

    private String admin;
    private String alice;
    private String bob;
    private String carol;

    @BeforeEach
    void setUpOwners() {
        admin = newPrincipal("admin");
        alice = newPrincipal("alice");
        bob = newPrincipal("bob");
        carol = newPrincipal("carol");
        reentrantCallTarget.reset();
    }

    private MultiSigWallet fundedWallet(long amount) throws Exception {
        MultiSigWallet wallet = multiSigWalletService.createWallet(admin, List.of(alice, bob, carol), 2);
        if (amount > 0) {
            String depositor = fundedPrincipal("depositor", amount);
            multiSigWalletService.depositToWallet(wallet.getId(), depositor, amount);
        }
        return wallet;
    }

    @Test
    @DisplayName("MSW-001: 2-of-3 transfer executes only after the second confirmation")
    void twoOfThreeTransfer() throws Exception {
        MultiSigWallet wallet = fundedWallet(5_000L);
        String destination = newPrincipal("dest");

        PendingTransaction tx = multiSigWalletService.proposeTransaction(wallet.getId(), alice,
                CommandType.TRANSFER, destination, 1_000L, null, null);
        assertThat(tx.getTxIndex()).isZero();
        assertThat(tx.getConfirmations()).containsExactly(alice);

        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice))
                .isInstanceOf(ThresholdException.class);
        assertThat(balance(destination)).isZero();

        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, bob);
        PendingTransaction executed = multiSigExecutionService.executeTransaction(wallet.getId(), 0L, carol);

        assertThat(executed.isExecuted()).isTrue();
        assertThat(executed.getExecutedAt()).isNotNull();
        assertThat(balance(destination)).isEqualTo(1_000L);
        assertThat(multiSigWalletService.getWalletBalance(wallet.getId())).isEqualTo(4_000L);

        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice))
                .isInstanceOf(InvalidStateException.class);
        assertThat(balance(destination)).isEqualTo(1_000L);
    }

    @Test
    @DisplayName("MSW-002: Confirmations are per owner and can be revoked before execution")
    void confirmAndRevoke() throws Exception {
        MultiSigWallet wallet = fundedWallet(1_000L);
        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.TRANSFER,
                newPrincipal("dest"), 500L, null, null);

        assertThatThrownBy(() -> multiSigWalletService.confirmTransaction(wallet.getId(), 0L, alice))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> multiSigWalletService.confirmTransaction(wallet.getId(), 0L, admin))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> multiSigWalletService.revokeConfirmation(wallet.getId(), 0L, bob))
                .isInstanceOf(InvalidStateException.class);

        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, bob);
        PendingTransaction revoked = multiSigWalletService.revokeConfirmation(wallet.getId(), 0L, alice);
        assertThat(revoked.getConfirmations()).containsExactly(bob);

        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 0L, bob))
                .isInstanceOf(ThresholdException.class);
        assertThat(multiSigWalletService.getWalletBalance(wallet.getId())).isEqualTo(1_000L);
    }

    @Test
    @DisplayName("MSW-003: A forwarded call that re-enters execute is rejected and the value moves once")
    void reentrantForwardIsRejected() throws Exception {
        MultiSigWallet wallet = fundedWallet(3_000L);
        byte[] payload = ReentrantCallTarget.payload(wallet.getId(), 0L, alice);
        long targetBefore = balance(ReentrantCallTarget.ADDRESS);

        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.FORWARD,
                ReentrantCallTarget.ADDRESS, 1_000L, payload, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, bob);

        multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice);

        assertThat(reentrantCallTarget.getReentrySuccesses()).isZero();
        assertThat(reentrantCallTarget.getReentryError()).isInstanceOf(InvalidStateException.class);
        assertThat(balance(ReentrantCallTarget.ADDRESS) - targetBefore).isEqualTo(1_000L);
        assertThat(multiSigWalletService.getWalletBalance(wallet.getId())).isEqualTo(2_000L);
    }

    @Test
    @DisplayName("MSW-004: A failing forwarded call reports an error but keeps the execution")
    void failingForwardKeepsDebit() throws Exception {
        MultiSigWallet wallet = fundedWallet(2_000L);
        long targetBefore = balance(FailingCallTarget.ADDRESS);

        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.FORWARD,
                FailingCallTarget.ADDRESS, 700L, new byte[]{1, 2, 3}, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, carol);

        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice))
                .isInstanceOf(ExternalCallFailedException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(multiSigWalletService.getTransaction(wallet.getId(), 0L).isExecuted()).isTrue();
        assertThat(balance(FailingCallTarget.ADDRESS) - targetBefore).isEqualTo(700L);
        assertThat(multiSigWalletService.getWalletBalance(wallet.getId())).isEqualTo(1_300L);
    }

    @Test
    @DisplayName("MSW-005: A forwarded call reaches the destination code with source, value and payload")
    void forwardCallIsDelivered() throws Exception {
        MultiSigWallet wallet = fundedWallet(1_000L);
        byte[] payload = "ping".getBytes(StandardCharsets.UTF_8);
        int callsBefore = recordingCallTarget.getCalls().size();

        multiSigWalletService.proposeTransaction(wallet.getId(), bob, CommandType.FORWARD,
                RecordingCallTarget.ADDRESS, 250L, payload, "ping call");
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, carol);
        multiSigExecutionService.executeTransaction(wallet.getId(), 0L, carol);

        List<RecordingCallTarget.Call> calls = recordingCallTarget.getCalls();
        assertThat(calls).hasSize(callsBefore + 1);
        RecordingCallTarget.Call call = calls.get(calls.size() - 1);
        assertThat(call.source()).isEqualTo(SystemAccounts.multiSig(wallet.getId()));
        assertThat(call.value()).isEqualTo(250L);
        assertThat(call.payload()).isEqualTo(payload);
    }

    @Test
    @DisplayName("MSW-006: Owner and threshold commands change the wallet once executed")
    void ownerCommands() throws Exception {
        MultiSigWallet wallet = fundedWallet(0L);
        String dave = newPrincipal("dave");

        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.ADD_OWNER, dave, null, null, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, bob);
        multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice);
        assertThat(multiSigWalletService.getWallet(wallet.getId()).getOwners()).containsExactly(alice, bob, carol, dave);

        multiSigWalletService.proposeTransaction(wallet.getId(), dave, CommandType.CHANGE_THRESHOLD, null, 3L, null, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 1L, alice);
        multiSigExecutionService.executeTransaction(wallet.getId(), 1L, dave);
        assertThat(multiSigWalletService.getWallet(wallet.getId()).getThreshold()).isEqualTo(3);

        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.REMOVE_OWNER, carol, null, null, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 2L, bob);
        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 2L, alice))
                .isInstanceOf(ThresholdException.class);
        multiSigWalletService.confirmTransaction(wallet.getId(), 2L, dave);
        multiSigExecutionService.executeTransaction(wallet.getId(), 2L, alice);

        MultiSigWallet updated = multiSigWalletService.getWallet(wallet.getId());
        assertThat(updated.getOwners()).containsExactly(alice, bob, dave);
        assertThat(updated.getTransactionCount()).isEqualTo(3L);

        assertThatThrownBy(() -> multiSigWalletService.proposeTransaction(wallet.getId(), alice,
                CommandType.REMOVE_OWNER, bob, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> multiSigWalletService.proposeTransaction(wallet.getId(), alice,
                CommandType.CHANGE_THRESHOLD, null, 4L, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("MSW-007: Confirmations of a removed owner no longer count")
    void removedOwnerConfirmationDoesNotCount() throws Exception {
        MultiSigWallet wallet = fundedWallet(1_000L);
        multiSigWalletService.proposeTransaction(wallet.getId(), carol, CommandType.TRANSFER,
                newPrincipal("dest"), 100L, null, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, alice);

        multiSigWalletService.removeOwner(wallet.getId(), admin, carol);

        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice))
                .isInstanceOf(ThresholdException.class);
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, bob);
        assertThat(multiSigExecutionService.executeTransaction(wallet.getId(), 0L, bob).isExecuted()).isTrue();
    }

    @Test
    @DisplayName("MSW-008: Cancel is limited to the creator or the admin")
    void cancel() throws Exception {
        MultiSigWallet wallet = fundedWallet(1_000L);
        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.TRANSFER,
                newPrincipal("dest"), 100L, null, null);
        multiSigWalletService.proposeTransaction(wallet.getId(), bob, CommandType.TRANSFER,
                newPrincipal("dest"), 100L, null, null);

        assertThatThrownBy(() -> multiSigWalletService.cancelTransaction(wallet.getId(), 0L, bob))
                .isInstanceOf(AuthorizationException.class);
        assertThat(multiSigWalletService.cancelTransaction(wallet.getId(), 0L, alice).isCancelled()).isTrue();
        assertThat(multiSigWalletService.cancelTransaction(wallet.getId(), 1L, admin).isCancelled()).isTrue();

        assertThatThrownBy(() -> multiSigWalletService.confirmTransaction(wallet.getId(), 0L, carol))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 1L, bob))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("MSW-009: Wallet creation and proposals are validated")
    void validation() throws Exception {
        assertThatThrownBy(() -> multiSigWalletService.createWallet(admin, List.of(alice, alice), 1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> multiSigWalletService.createWallet(admin, List.of(alice, bob), 3))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> multiSigWalletService.createWallet(admin, List.of(alice), 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> multiSigWalletService.createWallet(admin, List.of(SystemAccounts.PLATFORM), 1))
                .isInstanceOf(ValidationException.class);

        MultiSigWallet wallet = fundedWallet(100L);
        assertThatThrownBy(() -> multiSigWalletService.proposeTransaction(wallet.getId(), admin,
                CommandType.TRANSFER, newPrincipal("dest"), 10L, null, null))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> multiSigWalletService.proposeTransaction(wallet.getId(), alice,
                CommandType.TRANSFER, newPrincipal("dest"), 101L, null, null))
                .isInstanceOf(InsufficientFundsException.class);
        assertThatThrownBy(() -> multiSigWalletService.proposeTransaction(wallet.getId(), alice,
                CommandType.TRANSFER, SystemAccounts.ESCROW, 10L, null, null))
                .isInstanceOf(ValidationException.class);
        assertThat(multiSigWalletService.getWallet(wallet.getId()).getTransactionCount()).isZero();
    }

    @Test
    @DisplayName("MSW-010: Only an empty wallet can be deactivated, and only by its admin")
    void deactivate() throws Exception {
        MultiSigWallet wallet = fundedWallet(100L);

        assertThatThrownBy(() -> multiSigWalletService.deactivateWallet(wallet.getId(), alice))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> multiSigWalletService.deactivateWallet(wallet.getId(), admin))
                .isInstanceOf(InvalidStateException.class);

        String destination = newPrincipal("dest");
        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.TRANSFER, destination, 100L, null, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, bob);
        multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice);

        assertThat(multiSigWalletService.deactivateWallet(wallet.getId(), admin).getActive()).isFalse();
        String depositor = fundedPrincipal("depositor", 10L);
        assertThatThrownBy(() -> multiSigWalletService.depositToWallet(wallet.getId(), depositor, 10L))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("MSW-012: Owner set violations are validation errors whether proposed, applied or executed")
    void ownerViolationsAreValidationErrors() throws Exception {
        MultiSigWallet wallet = fundedWallet(0L);
        String dave = newPrincipal("dave");

        assertThatThrownBy(() -> multiSigWalletService.addOwner(wallet.getId(), admin, alice))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> multiSigWalletService.removeOwner(wallet.getId(), admin, dave))
                .isInstanceOf(ValidationException.class);

        multiSigWalletService.proposeTransaction(wallet.getId(), alice, CommandType.ADD_OWNER, dave, null, null, null);
        multiSigWalletService.proposeTransaction(wallet.getId(), bob, CommandType.ADD_OWNER, dave, null, null, null);
        multiSigWalletService.confirmTransaction(wallet.getId(), 0L, bob);
        multiSigWalletService.confirmTransaction(wallet.getId(), 1L, carol);
        multiSigExecutionService.executeTransaction(wallet.getId(), 0L, alice);

        assertThatThrownBy(() -> multiSigExecutionService.executeTransaction(wallet.getId(), 1L, bob))
                .isInstanceOf(ValidationException.class);
        assertThat(multiSigWalletService.getTransaction(wallet.getId(), 1L).isExecuted()).isFalse();
        assertThat(multiSigWalletService.getWallet(wallet.getId()).getOwners()).containsExactly(alice, bob, carol, dave);

        multiSigWalletService.removeOwner(wallet.getId(), admin, dave);
        multiSigWalletService.removeOwner(wallet.getId(), admin, carol);
        assertThatThrownBy(() -> multiSigWalletService.removeOwner(wallet.getId(), admin, bob))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("MSW-011: Wallet lifecycle over REST")
    void restFlow() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/v1/multisig/wallets")
                        .header(ApiHeaders.CALLER_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateWalletRequest(List.of(alice, bob), 2))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.threshold").value(2))
                .andExpect(jsonPath("$.balance").value(0))
                .andReturn();
        UUID walletId = objectMapper.readValue(created.getResponse().getContentAsString(), WalletResponse.class).id();

        String depositor = fundedPrincipal("depositor", 800L);
        mockMvc.perform(post("/api/v1/multisig/wallets/{walletId}/deposit", walletId)
                        .header(ApiHeaders.CALLER_ID, depositor)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AmountRequest(800L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(800));

        String destination = newPrincipal("dest");
        mockMvc.perform(post("/api/v1/multisig/wallets/{walletId}/transactions", walletId)
                        .header(ApiHeaders.CALLER_ID, alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new ProposeTransactionRequest(CommandType.TRANSFER, destination, 300L, null, null))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.txIndex").value(0));

        mockMvc.perform(post("/api/v1/multisig/wallets/{walletId}/transactions/{txIndex}/execute", walletId, 0)
                        .header(ApiHeaders.CALLER_ID, alice))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(post("/api/v1/multisig/wallets/{walletId}/transactions/{txIndex}/confirm", walletId, 0)
                        .header(ApiHeaders.CALLER_ID, bob))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmations.length()").value(2));

        mockMvc.perform(post("/api/v1/multisig/wallets/{walletId}/transactions/{txIndex}/execute", walletId, 0)
                        .header(ApiHeaders.CALLER_ID, bob))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executed").value(true));

        mockMvc.perform(get("/api/v1/multisig/wallets/{walletId}", walletId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(500));
        assertThat(balance(destination)).isEqualTo(300L);
    }
}
