package com.nosota.msettle.service;

import com.nosota.msettle.api.model.Assets;
import com.nosota.msettle.api.model.AuctionStatus;
import com.nosota.msettle.error.*;
import com.nosota.msettle.event.SettlementEventKind;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.Auction;
import com.nosota.msettle.model.Bid;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.repository.AuctionRepository;
import com.nosota.msettle.repository.BidRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * English (ascending-bid) auctions.
 *
 * <p>The highest bid is always held in {@code sys:auction}; a new high bid refunds the previous
 * one in the same transaction. A token item offered by the seller is held there too until the
 * auction ends.
 *
 * <p>Outcomes of {@link #endAuction}:
 * <ul>
 *   <li>bids and reserve met (or no reserve): seller paid fee-skimmed, item to winner, COMPLETED</li>
 *   <li>bids but reserve unmet: highest bidder refunded, item back to seller, FAILED</li>
 *   <li>no bids: item back to seller, FAILED</li>
 * </ul>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class AuctionService {

    private final AuctionRepository auctionRepository;
    private final BidRepository bidRepository;
    private final AccountLedgerService accountLedgerService;
    private final FeePolicy feePolicy;
    private final IdGenerator idGenerator;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Opens an auction.
     *
     * @param itemToken    Token sold as the item, or null for an off-ledger item identified by {@code itemRef}
     * @param itemQuantity Token quantity; required with {@code itemToken}
     * @param reservePrice Minimum winning price, or null for none
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Auction createAuction(String seller, @NotNull String itemRef, String itemToken, Long itemQuantity,
                                 Long startingPrice, Long durationSeconds, Long minIncrement, Long reservePrice)
            throws SettlementException {
        CallerGuard.requireCaller(seller);
        CallerGuard.requirePositive(startingPrice, "Starting price");
        CallerGuard.requirePositive(durationSeconds, "Duration");
        CallerGuard.requirePositive(minIncrement, "Minimum increment");
        if (reservePrice != null && reservePrice <= 0) {
            throw new ValidationException("Reserve price must be positive");
        }
        if (startingPrice > Long.MAX_VALUE - minIncrement) {
            throw new ValidationException(String.format(
                    "Starting price %d plus minimum increment %d leaves no valid bid", startingPrice, minIncrement));
        }
        validateTokenItem(itemToken, itemQuantity);

        Instant now = clock.instant();
        Auction auction = new Auction();
        auction.setId(idGenerator.nextId());
        auction.setItemRef(itemRef);
        auction.setItemToken(itemToken);
        auction.setItemQuantity(itemToken == null ? null : itemQuantity);
        auction.setSeller(seller);
        auction.setStartingPrice(startingPrice);
        auction.setCurrentPrice(startingPrice);
        auction.setMinIncrement(minIncrement);
        auction.setReservePrice(reservePrice);
        auction.setBidCount(0);
        auction.setFeeBps(feePolicy.defaultBps());
        auction.setStatus(AuctionStatus.ACTIVE);
        auction.setStartTime(now);
        auction.setEndTime(CallerGuard.offset(now, durationSeconds, "Auction end"));

        if (auction.hasTokenItem()) {
            accountLedgerService.transfer(seller, SystemAccounts.AUCTION, itemToken, itemQuantity,
                    auction.getId(), "Auction item custody");
        }
        auction = auctionRepository.save(auction);

        eventPublisher.publish(auction.getId(), SettlementEventKind.AUCTION_CREATED);
        log.info("Created auction {}: seller={}, item={}, startingPrice={}, endTime={}",
                auction.getId(), seller, itemRef, startingPrice, auction.getEndTime());
        return auction;
    }

    /**
     * Places a bid of at least {@code currentPrice + minIncrement}, the first bid included.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Auction placeBid(@NotNull UUID auctionId, String bidder, Long amount) throws SettlementException {
        CallerGuard.requireCaller(bidder);
        CallerGuard.requirePositive(amount, "Bid amount");
        Auction auction = getForUpdate(auctionId);
        requireActive(auction);
        Instant now = clock.instant();
        if (!now.isBefore(auction.getEndTime())) {
            throw new ExpiredException(String.format("Auction %s ended at %s", auctionId, auction.getEndTime()));
        }
        if (auction.getSeller().equals(bidder)) {
            throw new AuthorizationException("Seller may not bid on own auction " + auctionId);
        }
        if (auction.getCurrentPrice() > Long.MAX_VALUE - auction.getMinIncrement()) {
            throw new ValidationException(String.format(
                    "Auction %s is at %d and cannot be outbid", auctionId, auction.getCurrentPrice()));
        }
        long minimumBid = auction.getCurrentPrice() + auction.getMinIncrement();
        if (amount < minimumBid) {
            throw new ValidationException(
                    String.format("Bid %d is below the minimum %d for auction %s", amount, minimumBid, auctionId));
        }

        accountLedgerService.transfer(bidder, SystemAccounts.AUCTION, Assets.NATIVE, amount, auctionId, "Bid");
        if (auction.getHighestBidder() != null) {
            accountLedgerService.transfer(SystemAccounts.AUCTION, auction.getHighestBidder(), Assets.NATIVE,
                    auction.getCurrentPrice(), auctionId, "Outbid refund");
        }

        auction.setCurrentPrice(amount);
        auction.setHighestBidder(bidder);
        auction.setBidCount(auction.getBidCount() + 1);
        auction = auctionRepository.save(auction);

        Bid bid = new Bid();
        bid.setId(idGenerator.nextId());
        bid.setAuctionId(auctionId);
        bid.setBidder(bidder);
        bid.setAmount(amount);
        bid.setPlacedAt(now);
        bidRepository.save(bid);

        eventPublisher.publish(auctionId, SettlementEventKind.BID_PLACED);
        log.info("Bid {} on auction {} by {} (bid #{})", amount, auctionId, bidder, auction.getBidCount());
        return auction;
    }

    /**
     * Ends the auction. The seller may end it at any time; anyone may once the end time has passed.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Auction endAuction(@NotNull UUID auctionId, String caller) throws SettlementException {
        Auction auction = getForUpdate(auctionId);
        requireActive(auction);
        Instant now = clock.instant();
        if (!auction.getSeller().equals(caller) && now.isBefore(auction.getEndTime())) {
            throw new AuthorizationException(
                    String.format("Only the seller may end auction %s before %s", auctionId, auction.getEndTime()));
        }

        String highestBidder = auction.getHighestBidder();
        boolean reserveMet = auction.getReservePrice() == null
                || auction.getCurrentPrice() >= auction.getReservePrice();

        if (highestBidder != null && reserveMet) {
            accountLedgerService.transferWithFee(SystemAccounts.AUCTION, auction.getSeller(), auction.getCurrentPrice(),
                    auction.getFeeBps(), auctionId, "Auction settlement");
            if (auction.hasTokenItem()) {
                accountLedgerService.transfer(SystemAccounts.AUCTION, highestBidder, auction.getItemToken(),
                        auction.getItemQuantity(), auctionId, "Auction item delivery");
            }
            auction.setWinner(highestBidder);
            auction.setStatus(AuctionStatus.COMPLETED);
            log.info("Auction {} completed: winner={}, price={}", auctionId, highestBidder, auction.getCurrentPrice());
        } else {
            if (highestBidder != null) {
                accountLedgerService.transfer(SystemAccounts.AUCTION, highestBidder, Assets.NATIVE,
                        auction.getCurrentPrice(), auctionId, "Reserve not met refund");
                log.info("Auction {} failed: highest bid {} below reserve {}",
                        auctionId, auction.getCurrentPrice(), auction.getReservePrice());
            } else {
                log.info("Auction {} failed: no bids", auctionId);
            }
            returnItem(auction);
            auction.setStatus(AuctionStatus.FAILED);
        }

        auction.setSettledAt(now);
        auction = auctionRepository.save(auction);
        eventPublisher.publish(auctionId, SettlementEventKind.AUCTION_ENDED);
        return auction;
    }

    /**
     * Cancels an auction without bids. Seller only.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public Auction cancelAuction(@NotNull UUID auctionId, String caller) throws SettlementException {
        Auction auction = getForUpdate(auctionId);
        requireActive(auction);
        if (!auction.getSeller().equals(caller)) {
            throw new AuthorizationException("Only the seller may cancel auction " + auctionId);
        }
        if (auction.getBidCount() > 0) {
            throw new InvalidStateException(
                    String.format("Auction %s has %d bids and cannot be cancelled", auctionId, auction.getBidCount()));
        }

        returnItem(auction);
        auction.setStatus(AuctionStatus.CANCELLED);
        auction.setSettledAt(clock.instant());
        auction = auctionRepository.save(auction);

        eventPublisher.publish(auctionId, SettlementEventKind.AUCTION_CANCELLED);
        log.info("Auction {} cancelled by seller", auctionId);
        return auction;
    }

    public Auction getAuction(@NotNull UUID auctionId) {
        return auctionRepository.findById(auctionId)
                .orElseThrow(() -> new EntityNotFoundException("Auction not found: " + auctionId));
    }

    public List<Bid> getBids(@NotNull UUID auctionId) {
        getAuction(auctionId);
        return bidRepository.findByAuctionIdOrderByPlacedAtAscAmountAsc(auctionId);
    }

    static void validateTokenItem(String itemToken, Long itemQuantity) throws ValidationException {
        if (itemToken == null) {
            return;
        }
        if (itemToken.isBlank() || Assets.NATIVE.equals(itemToken)) {
            throw new ValidationException("Item token must be a token id, got '" + itemToken + "'");
        }
        CallerGuard.requirePositive(itemQuantity, "Item quantity");
    }

    private void returnItem(Auction auction) throws SettlementException {
        if (auction.hasTokenItem()) {
            accountLedgerService.transfer(SystemAccounts.AUCTION, auction.getSeller(), auction.getItemToken(),
                    auction.getItemQuantity(), auction.getId(), "Auction item return");
        }
    }

    private Auction getForUpdate(UUID auctionId) {
        return auctionRepository.findByIdForUpdate(auctionId)
                .orElseThrow(() -> new EntityNotFoundException("Auction not found: " + auctionId));
    }

    private void requireActive(Auction auction) throws InvalidStateException {
        if (auction.getStatus() != AuctionStatus.ACTIVE) {
            throw new InvalidStateException(
                    String.format("Auction %s is %s", auction.getId(), auction.getStatus()));
        }
    }
}
