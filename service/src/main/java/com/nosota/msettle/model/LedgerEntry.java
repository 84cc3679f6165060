package com.nosota.msettle.model;

import com.nosota.msettle.api.model.TransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Journal row written for every balance mutation. Append-only.
 *
 * <p>The sum of all entries of an asset equals the sum of all balances of that asset;
 * {@code reconcile} checks exactly this.
 */
@Entity
@Table(name = "ledger_entry")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Escrow, wallet, auction or payment id, or a fresh id for a plain transfer.
     */
    @Column(name = "reference_id")
    private UUID referenceId;

    @Column(nullable = false, length = 128)
    private String principal;

    @Column(nullable = false, length = 128)
    private String asset;

    /**
     * Signed: positive for CREDIT, negative for DEBIT.
     */
    @Column(nullable = false)
    private Long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TransactionType type;

    private String description;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
