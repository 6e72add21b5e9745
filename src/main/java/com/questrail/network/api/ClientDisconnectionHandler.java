package com.questrail.network.api;

/**
 * Server-side notification that a client disconnected.
 *
 * <p>Invoked only from the pump thread. The connection id stays reserved
 * until this and every earlier event of the connection has been delivered.</p>
 */
@FunctionalInterface
public interface ClientDisconnectionHandler
{
    void onClientDisconnected(ConnectionId connectionId);
}
