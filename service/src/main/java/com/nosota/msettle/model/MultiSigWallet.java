package com.nosota.msettle.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Shared-custody wallet. Its funds are the ledger balance of {@code sys:multisig:<id>}.
 *
 * <p>Invariant: {@code 1 <= threshold <= owners.size()}.
 */
@Entity
@Table(name = "multisig_wallet")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class MultiSigWallet {
    @Id
    private UUID id;

    @Version
    private Long version;

    /**
     * The creator. Manages owners and threshold.
     */
    @Column(nullable = false, length = 128)
    private String admin;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "multisig_wallet_owner", joinColumns = @JoinColumn(name = "wallet_id"))
    @OrderColumn(name = "owner_order")
    @Column(name = "owner", nullable = false, length = 128)
    private List<String> owners = new ArrayList<>();

    @Column(nullable = false)
    private Integer threshold;

    @Column(nullable = false)
    private Boolean active;

    /**
     * Number of transactions proposed so far; the next proposal gets this value as index.
     */
    @Column(name = "transaction_count", nullable = false)
    private Long transactionCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
