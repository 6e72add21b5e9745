package com.questrail.network.transport;

import java.net.SocketAddress;

/**
 * TransportAcceptor
 * -----------------------------------------------------------------------------
 * Server-side listener port. Accepts inbound sessions and hands each one out
 * as a fresh {@link TransportBinding}.
 */
public interface TransportAcceptor
{
    /**
     * Register the listener for accepted sessions. Must be called before
     * {@link #start()}.
     */
    void setListener(TransportAcceptorListener listener);

    /**
     * Bind and begin accepting. Returns once the listen socket is bound.
     *
     * @throws IllegalStateException if no listener has been registered
     * @throws TransportException    if the listen address cannot be bound
     */
    void start();

    /**
     * Stop accepting and release the listen socket. Already accepted bindings
     * are not closed by this call.
     */
    void stop();

    /**
     * Release resources shared by the accepted bindings (event loops, for
     * example). Sessions still open are closed. Call after {@link #stop()}
     * once the accepted connections have been flushed.
     */
    void close();

    /**
     * The bound local address, or {@code null} when not started.
     */
    SocketAddress localAddress();
}
