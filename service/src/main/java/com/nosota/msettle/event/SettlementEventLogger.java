package com.nosota.msettle.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes every settlement event to the log. Observational only.
 */
@Component
@Slf4j
public class SettlementEventLogger {

    @EventListener
    public void onSettlementEvent(SettlementEvent event) {
        log.info("Settlement event: kind={}, entityId={}, at={}", event.kind(), event.entityId(), event.timestamp());
    }
}
