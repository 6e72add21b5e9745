package com.questrail.network.observability;

/**
 * No-op implementation of NetworkObservabilitySink.
 */
public final class NullObservabilitySink implements NetworkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {}

    @Override
    public void onMessageDropped(MessageDropEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(NetworkErrorEvent event) {}
}
