package com.questrail.network.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NetworkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jNetworkObservabilitySink implements NetworkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNetworkObservabilitySink.class);

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {
        if (event.isConnectivityChange()) {
            log.info("{}: {} -> {}", event.connectionId(), event.oldState(), event.newState());
        } else {
            log.debug("{}: {} -> {}", event.connectionId(), event.oldState(), event.newState());
        }
    }

    @Override
    public void onMessageDropped(MessageDropEvent event) {
        if (event.reason() == MessageDropEvent.Reason.RELIABLE_LANE_FULL
                || event.reason() == MessageDropEvent.Reason.TRANSPORT_FAILED) {
            log.warn("{}: {} {} message(s) dropped ({})",
                event.connectionId(), event.count(), event.reliability(), event.reason());
        } else {
            log.debug("{}: {} {} message(s) dropped ({})",
                event.connectionId(), event.count(), event.reliability(), event.reason());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        switch (event.kind()) {
            case UP -> log.info("{}: transport up", event.connectionId());
            case DOWN -> {
                if (event.cause() != null) {
                    log.info("{}: transport down: {}", event.connectionId(), event.cause().toString());
                } else {
                    log.info("{}: transport down", event.connectionId());
                }
            }
            case BACKPRESSURE -> log.debug("{}: transport backpressure", event.connectionId());
        }
    }

    @Override
    public void onError(NetworkErrorEvent event) {
        log.error("{}: {}", event.connectionId(), event.message(), event.cause());
    }
}
