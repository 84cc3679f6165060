package com.nosota.msettle.service;

import com.nosota.msettle.api.model.AuctionStatus;
import com.nosota.msettle.error.*;
import com.nosota.msettle.event.SettlementEventKind;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.DutchAuction;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.repository.DutchAuctionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Dutch (descending-price) auctions. The first purchase at or above the effective price wins.
 *
 * <p>The buyer is charged exactly the effective price; whatever they were willing to pay
 * beyond it never leaves their account.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DutchAuctionService {

    private final DutchAuctionRepository dutchAuctionRepository;
    private final AccountLedgerService accountLedgerService;
    private final DutchPriceCalculator priceCalculator;
    private final FeePolicy feePolicy;
    private final IdGenerator idGenerator;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Opens a Dutch auction. Requires {@code 0 < reserve < starting} and that the price can
     * reach the reserve within the duration.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public DutchAuction createDutchAuction(String seller, @NotNull String itemRef, String itemToken, Long itemQuantity,
                                           Long startingPrice, Long reservePrice, Long decrementAmount,
                                           Long decrementIntervalSeconds, Long durationSeconds)
            throws SettlementException {
        CallerGuard.requireCaller(seller);
        CallerGuard.requirePositive(startingPrice, "Starting price");
        CallerGuard.requirePositive(reservePrice, "Reserve price");
        CallerGuard.requirePositive(decrementAmount, "Decrement amount");
        CallerGuard.requirePositive(decrementIntervalSeconds, "Decrement interval");
        CallerGuard.requirePositive(durationSeconds, "Duration");
        if (reservePrice >= startingPrice) {
            throw new ValidationException(
                    String.format("Reserve price %d must be below starting price %d", reservePrice, startingPrice));
        }
        if (!priceCalculator.reachesReserveWithin(startingPrice, reservePrice, decrementAmount,
                decrementIntervalSeconds, durationSeconds)) {
            throw new ValidationException(String.format(
                    "Price cannot reach reserve %d within %d seconds (decrement %d every %d seconds)",
                    reservePrice, durationSeconds, decrementAmount, decrementIntervalSeconds));
        }
        AuctionService.validateTokenItem(itemToken, itemQuantity);

        Instant now = clock.instant();
        DutchAuction auction = new DutchAuction();
        auction.setId(idGenerator.nextId());
        auction.setItemRef(itemRef);
        auction.setItemToken(itemToken);
        auction.setItemQuantity(itemToken == null ? null : itemQuantity);
        auction.setSeller(seller);
        auction.setStartingPrice(startingPrice);
        auction.setReservePrice(reservePrice);
        auction.setDecrementAmount(decrementAmount);
        auction.setDecrementIntervalSeconds(decrementIntervalSeconds);
        auction.setLastPrice(startingPrice);
        auction.setLastPriceUpdate(now);
        auction.setFeeBps(feePolicy.defaultBps());
        auction.setStatus(AuctionStatus.ACTIVE);
        auction.setStartTime(now);
        auction.setEndTime(CallerGuard.offset(now, durationSeconds, "Auction end"));

        if (auction.hasTokenItem()) {
            accountLedgerService.transfer(seller, SystemAccounts.AUCTION, itemToken, itemQuantity,
                    auction.getId(), "Dutch auction item custody");
        }
        auction = dutchAuctionRepository.save(auction);

        eventPublisher.publish(auction.getId(), SettlementEventKind.DUTCH_AUCTION_CREATED);
        log.info("Created Dutch auction {}: seller={}, item={}, {} → {} by {} every {}s",
                auction.getId(), seller, itemRef, startingPrice, reservePrice, decrementAmount, decrementIntervalSeconds);
        return auction;
    }

    /**
     * Buys the item at the current effective price.
     *
     * @param maxPayment The most the buyer is willing to pay
     * @throws ThresholdException if {@code maxPayment} is below the effective price
     */
    @Transactional(rollbackOn = SettlementException.class)
    public DutchAuction purchaseDutchAuctionItem(@NotNull UUID auctionId, String buyer, Long maxPayment)
            throws SettlementException {
        CallerGuard.requireCaller(buyer);
        CallerGuard.requirePositive(maxPayment, "Payment");
        DutchAuction auction = getForUpdate(auctionId);
        requireActive(auction);
        Instant now = clock.instant();
        if (!now.isBefore(auction.getEndTime())) {
            throw new ExpiredException(String.format("Dutch auction %s ended at %s", auctionId, auction.getEndTime()));
        }
        if (auction.getSeller().equals(buyer)) {
            throw new AuthorizationException("Seller may not buy from own auction " + auctionId);
        }
        long price = currentPrice(auction, now);
        if (maxPayment < price) {
            throw new ThresholdException(
                    String.format("Payment %d is below the current price %d of auction %s", maxPayment, price, auctionId));
        }

        accountLedgerService.transferWithFee(buyer, auction.getSeller(), price, auction.getFeeBps(),
                auctionId, "Dutch auction purchase");
        if (auction.hasTokenItem()) {
            accountLedgerService.transfer(SystemAccounts.AUCTION, buyer, auction.getItemToken(),
                    auction.getItemQuantity(), auctionId, "Dutch auction item delivery");
        }

        auction.setLastPrice(price);
        auction.setLastPriceUpdate(now);
        auction.setBuyer(buyer);
        auction.setFinalPrice(price);
        auction.setStatus(AuctionStatus.COMPLETED);
        auction.setSettledAt(now);
        auction = dutchAuctionRepository.save(auction);

        eventPublisher.publish(auctionId, SettlementEventKind.DUTCH_AUCTION_PURCHASED);
        log.info("Dutch auction {} sold to {} at {}", auctionId, buyer, price);
        return auction;
    }

    /**
     * Ends an unsold auction. Seller at any time, anyone after the end time.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public DutchAuction endDutchAuction(@NotNull UUID auctionId, String caller) throws SettlementException {
        DutchAuction auction = getForUpdate(auctionId);
        requireActive(auction);
        Instant now = clock.instant();
        if (!auction.getSeller().equals(caller) && now.isBefore(auction.getEndTime())) {
            throw new AuthorizationException(
                    String.format("Only the seller may end Dutch auction %s before %s", auctionId, auction.getEndTime()));
        }

        if (auction.hasTokenItem()) {
            accountLedgerService.transfer(SystemAccounts.AUCTION, auction.getSeller(), auction.getItemToken(),
                    auction.getItemQuantity(), auctionId, "Dutch auction item return");
        }
        auction.setStatus(AuctionStatus.ENDED);
        auction.setSettledAt(now);
        auction = dutchAuctionRepository.save(auction);

        eventPublisher.publish(auctionId, SettlementEventKind.DUTCH_AUCTION_ENDED);
        log.info("Dutch auction {} ended unsold", auctionId);
        return auction;
    }

    public DutchAuction getDutchAuction(@NotNull UUID auctionId) {
        return dutchAuctionRepository.findById(auctionId)
                .orElseThrow(() -> new EntityNotFoundException("Dutch auction not found: " + auctionId));
    }

    /**
     * Effective price now; the final price once sold.
     */
    public long getCurrentPrice(DutchAuction auction) {
        if (auction.getStatus() != AuctionStatus.ACTIVE) {
            return auction.getFinalPrice() != null ? auction.getFinalPrice() : auction.getLastPrice();
        }
        return currentPrice(auction, clock.instant());
    }

    private long currentPrice(DutchAuction auction, Instant now) {
        return priceCalculator.currentPrice(auction.getLastPrice(), auction.getReservePrice(),
                auction.getDecrementAmount(), auction.getDecrementIntervalSeconds(),
                auction.getLastPriceUpdate(), now);
    }

    private DutchAuction getForUpdate(UUID auctionId) {
        return dutchAuctionRepository.findByIdForUpdate(auctionId)
                .orElseThrow(() -> new EntityNotFoundException("Dutch auction not found: " + auctionId));
    }

    private void requireActive(DutchAuction auction) throws InvalidStateException {
        if (auction.getStatus() != AuctionStatus.ACTIVE) {
            throw new InvalidStateException(
                    String.format("Dutch auction %s is %s", auction.getId(), auction.getStatus()));
        }
    }
}
