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
 * Descending-price auction. The stored {@code lastPrice} only changes on purchase; the
 * effective price is derived from it on every read.
 */
@Entity
@Table(name = "dutch_auction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class DutchAuction {
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

    @Column(name = "reserve_price", nullable = false)
    private Long reservePrice;

    @Column(name = "decrement_amount", nullable = false)
    private Long decrementAmount;

    @Column(name = "decrement_interval_seconds", nullable = false)
    private Long decrementIntervalSeconds;

    @Column(name = "last_price", nullable = false)
    private Long lastPrice;

    @Column(name = "last_price_update", nullable = false)
    private Instant lastPriceUpdate;

    @Column(name = "fee_bps", nullable = false)
    private Integer feeBps;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuctionStatus status;

    @Column(length = 128)
    private String buyer;

    @Column(name = "final_price")
    private Long finalPrice;

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
