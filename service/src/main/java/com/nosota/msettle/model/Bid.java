package com.nosota.msettle.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "bid")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Bid {
    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "auction_id", nullable = false)
    private UUID auctionId;

    @Column(nullable = false, length = 128)
    private String bidder;

    @Column(nullable = false)
    private Long amount;

    @Column(name = "placed_at", nullable = false)
    private Instant placedAt;
}
