package com.questrail.network.transport;

/**
 * Callback sink for {@link TransportAcceptor}.
 */
@FunctionalInterface
public interface TransportAcceptorListener
{
    /**
     * A new inbound session was accepted. The binding has no listener yet and
     * has not been started; the receiver takes ownership of it.
     */
    void onAccepted(TransportBinding binding);
}
