package com.nosota.msettle.model;

import com.nosota.msettle.api.model.AuctionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * English (ascending-bid) auction. The highest bid is held in {@code sys:auction},
 * together with the token item if there is one.
 */
@Entity
@Table(name = "auction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Auction {
    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "item_ref", nullable = false)
    private String itemRef;

    @Column(name = "item_token", length = 128)
    private String itemToken;

    @Column(name = "item_quantity")
    private Long itemQuantity;

    @Column(nullable = false, length = 128)
    private String seller;

    @Column(name = "starting_price", nullable = false)
    private Long startingPrice;

    @Column(name = "current_price", nullable = false)
    private Long currentPrice;

    @Column(name = "highest_bidder", length = 128)
    private String highestBidder;

    @Column(name = "min_increment", nullable = false)
    private Long minIncrement;

    @Column(name = "reserve_price")
    private Long reservePrice;

    @Column(name = "bid_count", nullable = false)
    private Integer bidCount;

    @Column(name = "fee_bps", nullable = false)
    private Integer feeBps;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuctionStatus status;

    @Column(length = 128)
    private String winner;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "settled_at")
    private Instant settledAt;

    public boolean hasTokenItem() {
        return itemToken != null;
    }
}
