package com.questrail.network.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements NetworkObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ConnectionStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onMessageDropped(MessageDropEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(NetworkErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ConnectionStateTransitionEvent> getStateTransitions() {
        return ofType(ConnectionStateTransitionEvent.class);
    }

    public synchronized List<MessageDropEvent> getDrops() {
        return ofType(MessageDropEvent.class);
    }

    public synchronized List<NetworkErrorEvent> getErrors() {
        return ofType(NetworkErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
