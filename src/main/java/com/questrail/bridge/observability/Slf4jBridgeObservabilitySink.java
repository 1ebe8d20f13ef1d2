package com.questrail.bridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onLinkTransition(LinkTransitionEvent event) {
        if (event.isAvailabilityChange()) {
            log.info("Serial link {}: {} -> {}",
                event.portName(),
                event.oldState(),
                event.newState());
        } else {
            log.debug("Serial link {}: {} -> {}",
                event.portName(),
                event.oldState(),
                event.newState());
        }
    }

    @Override
    public void onClientEvent(ClientRegistryEvent event) {
        switch (event.kind()) {
            case ACCEPTED -> log.info("Client {} connected. Total connections: {}",
                event.clientId(), event.clientCount());
            case REJECTED -> log.warn("Client {} rejected: connection limit reached ({})",
                event.clientId(), event.clientCount());
            case REMOVED -> log.info("Client {} disconnected. Total connections: {}",
                event.clientId(), event.clientCount());
            case PRUNED -> log.warn("Client {} pruned after failed send. Total connections: {}",
                event.clientId(), event.clientCount());
        }
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge error: {}", event.message(), event.cause());
    }
}
