package com.nosota.msettle.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Current balance of one principal in one asset.
 *
 * <p>Rows are created lazily on the first credit and are the only lock boundary of the
 * ledger: every mutation reads the row with a pessimistic write lock. The balance never
 * goes below zero.
 */
@Entity
@Table(name = "account_balance",
        uniqueConstraints = @UniqueConstraint(name = "uk_account_balance_principal_asset",
                columnNames = {"principal", "asset"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AccountBalance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String principal;

    /**
     * {@code NATIVE} for the native currency, otherwise the token id.
     */
    @Column(nullable = false, length = 128)
    private String asset;

    @Column(nullable = false)
    private Long balance;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
