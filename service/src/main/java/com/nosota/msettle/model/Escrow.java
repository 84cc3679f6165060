package com.nosota.msettle.model;

import com.nosota.msettle.api.model.DisputeWinner;
import com.nosota.msettle.api.model.EscrowStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Two-party conditional hold. The amount sits in {@code sys:escrow} while FUNDED or DISPUTED.
 */
@Entity
@Table(name = "escrow")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Escrow {
    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false, length = 128)
    private String buyer;

    @Column(nullable = false, length = 128)
    private String seller;

    @Column(nullable = false, length = 128)
    private String arbiter;

    @Column(nullable = false)
    private Long amount;

    /**
     * Platform fee rate captured at creation, so later config changes do not affect it.
     */
    @Column(name = "fee_bps", nullable = false)
    private Integer feeBps;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowStatus status;

    @Column(name = "disputed_by", length = 128)
    private String disputedBy;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private DisputeWinner winner;

    private String description;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "closed_at")
    private Instant closedAt;
}
