package com.questrail.network.transport;

import java.net.SocketAddress;

/**
 * Client-side dial port.
 */
public interface TransportConnector
{
    /**
     * Create an unstarted binding for a session to {@code remote}. The handshake
     * begins when the binding is started.
     */
    TransportBinding open(SocketAddress remote);

    /**
     * Release resources shared by the bindings this connector created.
     */
    void close();
}
