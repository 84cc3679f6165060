package com.nosota.msettle.service;

import com.nosota.msettle.api.model.Assets;
import com.nosota.msettle.api.model.DisputeWinner;
import com.nosota.msettle.api.model.EscrowStatus;
import com.nosota.msettle.error.*;
import com.nosota.msettle.event.SettlementEventKind;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.Escrow;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.repository.EscrowRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Two-party escrow between a buyer and a seller, with an arbiter for disputes.
 *
 * <p>Workflow:
 * <pre>
 * 1. createEscrow:  BUYER → sys:escrow (amount), status FUNDED
 * 2. one of:
 *    a. releaseEscrow (buyer, before expiry): sys:escrow → SELLER (amount - fee) + PLATFORM (fee)
 *    b. refundEscrow (seller):                sys:escrow → BUYER (amount)
 *    c. claimExpiredEscrow (buyer, expired):  sys:escrow → BUYER (amount)
 *    d. disputeEscrow (buyer or seller), then resolveEscrow (arbiter) pays out as a or b
 * </pre>
 *
 * <p>Every check (state, caller, expiry) runs before any balance moves.
 */
@Service
@Validated
@Slf4j
public class EscrowService {

    private final EscrowRepository escrowRepository;
    private final AccountLedgerService accountLedgerService;
    private final EscrowStatusStateMachine stateMachine;
    private final FeePolicy feePolicy;
    private final IdGenerator idGenerator;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;
    private final String defaultArbiter;

    public EscrowService(EscrowRepository escrowRepository,
                         AccountLedgerService accountLedgerService,
                         EscrowStatusStateMachine stateMachine,
                         FeePolicy feePolicy,
                         IdGenerator idGenerator,
                         SettlementEventPublisher eventPublisher,
                         Clock clock,
                         @Value("${escrow.default-arbiter}") String defaultArbiter) {
        this.escrowRepository = escrowRepository;
        this.accountLedgerService = accountLedgerService;
        this.stateMachine = stateMachine;
        this.feePolicy = feePolicy;
        this.idGenerator = idGenerator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.defaultArbiter = defaultArbiter;
    }

    /**
     * Creates an escrow and moves the amount from the buyer into escrow custody.
     *
     * @param buyer            The caller
     * @param seller           Counterparty receiving the payout on release
     * @param amount           Positive amount
     * @param expiresInSeconds Seconds until the buyer may claim the funds back
     * @param arbiter          Dispute resolver; the configured default when null
     * @param feeBps           Fee rate captured now; the configured default when null
     * @return Funded escrow
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Escrow createEscrow(String buyer, String seller, Long amount, Long expiresInSeconds,
                               String arbiter, Integer feeBps, String description) throws SettlementException {
        CallerGuard.requireCaller(buyer);
        CallerGuard.requireParticipant(seller, "Seller");
        CallerGuard.requirePositive(amount, "Escrow amount");
        CallerGuard.requirePositive(expiresInSeconds, "Escrow expiry");
        if (buyer.equals(seller)) {
            throw new ValidationException("Buyer and seller must differ");
        }

        String effectiveArbiter = StringUtils.hasText(arbiter) ? arbiter : defaultArbiter;
        CallerGuard.requireParticipant(effectiveArbiter, "Arbiter");
        if (effectiveArbiter.equals(buyer) || effectiveArbiter.equals(seller)) {
            throw new ValidationException("Arbiter must not be a party of the escrow");
        }

        Instant now = clock.instant();
        Escrow escrow = new Escrow();
        escrow.setId(idGenerator.nextId());
        escrow.setBuyer(buyer);
        escrow.setSeller(seller);
        escrow.setArbiter(effectiveArbiter);
        escrow.setAmount(amount);
        escrow.setFeeBps(feePolicy.resolve(feeBps));
        escrow.setStatus(EscrowStatus.CREATED);
        escrow.setDescription(description);
        escrow.setCreatedAt(now);
        escrow.setExpiresAt(CallerGuard.offset(now, expiresInSeconds, "Escrow expiry"));

        stateMachine.validateTransition(escrow.getStatus(), EscrowStatus.FUNDED);
        accountLedgerService.transfer(buyer, SystemAccounts.ESCROW, Assets.NATIVE, amount,
                escrow.getId(), "Escrow funding");
        escrow.setStatus(EscrowStatus.FUNDED);
        escrow = escrowRepository.save(escrow);

        eventPublisher.publish(escrow.getId(), SettlementEventKind.ESCROW_CREATED);
        log.info("Created escrow {}: buyer={}, seller={}, amount={}, feeBps={}, expiresAt={}",
                escrow.getId(), buyer, seller, amount, escrow.getFeeBps(), escrow.getExpiresAt());
        return escrow;
    }

    /**
     * Pays the seller, minus the platform fee. Buyer only, not after expiry.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Escrow releaseEscrow(@NotNull UUID escrowId, String caller) throws SettlementException {
        Escrow escrow = getForUpdate(escrowId);
        stateMachine.validateTransition(escrow.getStatus(), EscrowStatus.RELEASED);
        requireCaller(escrow.getBuyer(), caller, "release");
        if (clock.instant().isAfter(escrow.getExpiresAt())) {
            throw new ExpiredException(String.format("Escrow %s expired at %s", escrowId, escrow.getExpiresAt()));
        }

        payOutToSeller(escrow);
        return close(escrow, EscrowStatus.RELEASED, SettlementEventKind.ESCROW_RELEASED);
    }

    /**
     * Returns the full amount to the buyer. Seller only.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Escrow refundEscrow(@NotNull UUID escrowId, String caller) throws SettlementException {
        Escrow escrow = getForUpdate(escrowId);
        stateMachine.validateTransition(escrow.getStatus(), EscrowStatus.REFUNDED);
        requireCaller(escrow.getSeller(), caller, "refund");

        refundToBuyer(escrow);
        return close(escrow, EscrowStatus.REFUNDED, SettlementEventKind.ESCROW_REFUNDED);
    }

    @Transactional(rollbackOn = SettlementException.class)
    public Escrow disputeEscrow(@NotNull UUID escrowId, String caller) throws SettlementException {
        Escrow escrow = getForUpdate(escrowId);
        stateMachine.validateTransition(escrow.getStatus(), EscrowStatus.DISPUTED);
        if (!escrow.getBuyer().equals(caller) && !escrow.getSeller().equals(caller)) {
            throw new AuthorizationException(
                    String.format("Only buyer or seller may dispute escrow %s, caller: %s", escrowId, caller));
        }

        escrow.setStatus(EscrowStatus.DISPUTED);
        escrow.setDisputedBy(caller);
        escrow = escrowRepository.save(escrow);

        eventPublisher.publish(escrow.getId(), SettlementEventKind.ESCROW_DISPUTED);
        log.info("Escrow {} disputed by {}", escrowId, caller);
        return escrow;
    }

    /**
     * Settles a dispute. A seller win pays out like a release (fee skimmed), a buyer win like a refund.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Escrow resolveEscrow(@NotNull UUID escrowId, String caller, @NotNull DisputeWinner winner)
            throws SettlementException {
        Escrow escrow = getForUpdate(escrowId);
        stateMachine.validateTransition(escrow.getStatus(), EscrowStatus.RESOLVED);
        requireCaller(escrow.getArbiter(), caller, "resolve");

        if (winner == DisputeWinner.SELLER) {
            payOutToSeller(escrow);
        } else {
            refundToBuyer(escrow);
        }
        escrow.setWinner(winner);
        return close(escrow, EscrowStatus.RESOLVED, SettlementEventKind.ESCROW_RESOLVED);
    }

    /**
     * Refunds the buyer once the escrow has expired without release. Buyer only.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Escrow claimExpiredEscrow(@NotNull UUID escrowId, String caller) throws SettlementException {
        Escrow escrow = getForUpdate(escrowId);
        stateMachine.validateTransition(escrow.getStatus(), EscrowStatus.REFUNDED);
        requireCaller(escrow.getBuyer(), caller, "claim expired");
        if (!clock.instant().isAfter(escrow.getExpiresAt())) {
            throw new InvalidStateException(
                    String.format("Escrow %s has not expired yet (expires at %s)", escrowId, escrow.getExpiresAt()));
        }

        refundToBuyer(escrow);
        return close(escrow, EscrowStatus.REFUNDED, SettlementEventKind.ESCROW_REFUNDED);
    }

    public Escrow getEscrow(@NotNull UUID escrowId) {
        return escrowRepository.findById(escrowId)
                .orElseThrow(() -> new EntityNotFoundException("Escrow not found: " + escrowId));
    }

    public List<Escrow> getEscrowsByParticipant(@NotNull String participant) {
        return escrowRepository.findByParticipant(participant);
    }

    private Escrow getForUpdate(UUID escrowId) {
        return escrowRepository.findByIdForUpdate(escrowId)
                .orElseThrow(() -> new EntityNotFoundException("Escrow not found: " + escrowId));
    }

    private void requireCaller(String expected, String caller, String action) throws AuthorizationException {
        if (!expected.equals(caller)) {
            throw new AuthorizationException(
                    String.format("Caller %s is not allowed to %s this escrow", caller, action));
        }
    }

    private void payOutToSeller(Escrow escrow) throws SettlementException {
        accountLedgerService.transferWithFee(SystemAccounts.ESCROW, escrow.getSeller(), escrow.getAmount(),
                escrow.getFeeBps(), escrow.getId(), "Escrow payout");
    }

    private void refundToBuyer(Escrow escrow) throws SettlementException {
        accountLedgerService.transfer(SystemAccounts.ESCROW, escrow.getBuyer(), Assets.NATIVE, escrow.getAmount(),
                escrow.getId(), "Escrow refund");
    }

    private Escrow close(Escrow escrow, EscrowStatus status, SettlementEventKind kind) {
        escrow.setStatus(status);
        escrow.setClosedAt(clock.instant());
        escrow = escrowRepository.save(escrow);

        eventPublisher.publish(escrow.getId(), kind);
        log.info("Escrow {} closed with status {}", escrow.getId(), status);
        return escrow;
    }
}
