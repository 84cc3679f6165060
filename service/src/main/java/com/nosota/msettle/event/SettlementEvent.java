package com.nosota.msettle.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after every successful state change.
 *
 * @param entityId  Escrow, wallet, auction, payment or transfer reference id
 * @param kind      What happened
 * @param timestamp Clock time of the change
 */
public record SettlementEvent(
        UUID entityId,
        SettlementEventKind kind,
        Instant timestamp
) {
}
