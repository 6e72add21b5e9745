package com.questrail.network.api;

/**
 * Server-side notification that an accepted client became connected.
 *
 * <p>Typical uses are setting up session state or sending a welcome or
 * authentication challenge. Invoked only from the pump thread.</p>
 */
@FunctionalInterface
public interface ClientConnectionHandler
{
    void onClientConnected(ConnectionId connectionId);
}
