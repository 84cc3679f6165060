package com.nosota.msettle.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ExternalCallGateway} over the {@link CallTarget} beans of the application context.
 */
@Component
@Slf4j
public class RegistryExternalCallGateway implements ExternalCallGateway {

    private final Map<String, CallTarget> targets = new LinkedHashMap<>();

    public RegistryExternalCallGateway(ObjectProvider<CallTarget> callTargets) {
        callTargets.orderedStream().forEach(target -> {
            CallTarget previous = targets.putIfAbsent(target.address(), target);
            if (previous != null) {
                throw new IllegalStateException("Duplicate call target address: " + target.address());
            }
        });
        log.info("Registered {} call targets", targets.size());
    }

    @Override
    public boolean hasCode(String destination) {
        return destination != null && targets.containsKey(destination);
    }

    @Override
    public void invoke(String source, String destination, long value, byte[] payload) throws Exception {
        CallTarget target = targets.get(destination);
        if (target == null) {
            log.debug("No code at {}, forwarded call is a no-op", destination);
            return;
        }

        log.info("Invoking {} from {} with value {}", destination, source, value);
        target.onCall(source, value, payload);
    }
}
