package com.nosota.msettle.model;

import com.nosota.msettle.api.model.CommandType;
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
 * A multi-sig command waiting for confirmations.
 *
 * <p>{@code executed} and {@code cancelled} are mutually exclusive and final.
 */
@Entity
@Table(name = "pending_transaction",
        uniqueConstraints = @UniqueConstraint(name = "uk_pending_transaction_wallet_index",
                columnNames = {"wallet_id", "tx_index"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PendingTransaction {
    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "wallet_id", nullable = false)
    private UUID walletId;

    @Column(name = "tx_index", nullable = false)
    private Long txIndex;

    @Column(nullable = false, length = 128)
    private String creator;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CommandType command;

    /**
     * Value recipient for TRANSFER/FORWARD, the owner for ADD_OWNER/REMOVE_OWNER.
     */
    @Column(length = 128)
    private String destination;

    @Column(name = "tx_value", nullable = false)
    private Long value;

    /**
     * Opaque bytes handed to the destination on FORWARD.
     */
    @Column(length = 10000)
    private byte[] payload;

    private String argument;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pending_transaction_confirmation",
            joinColumns = @JoinColumn(name = "transaction_id"))
    @OrderColumn(name = "confirmation_order")
    @Column(name = "owner", nullable = false, length = 128)
    private List<String> confirmations = new ArrayList<>();

    @Column(nullable = false)
    private boolean executed;

    @Column(nullable = false)
    private boolean cancelled;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "executed_at")
    private Instant executedAt;
}
