package com.questrail.network.observability;

/**
 * Main interface for receiving connection-layer observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on any thread (transport threads, the service
 * driver, the pump thread). Implementations must be thread-safe and must not
 * block.</p>
 */
public interface NetworkObservabilitySink {
    /**
     * Called when a connection changes lifecycle state.
     * @param event the transition details
     */
    void onStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called when an outbound message is dropped, discarded or abandoned.
     * @param event the drop details
     */
    void onMessageDropped(MessageDropEvent event);

    /**
     * Called when a transport-level event occurs (up, down, backpressure).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when a failure is contained (a throwing handler, a failing
     * service tick).
     * @param event the error event
     */
    void onError(NetworkErrorEvent event);
}
