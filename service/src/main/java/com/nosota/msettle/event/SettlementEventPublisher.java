package com.nosota.msettle.event;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class SettlementEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void publish(UUID entityId, SettlementEventKind kind) {
        applicationEventPublisher.publishEvent(new SettlementEvent(entityId, kind, clock.instant()));
    }
}
