package com.questrail.network.api;

/**
 * Receives connection status changes.
 *
 * <p>Invoked only from the pump thread. A connection reports {@code true}
 * at most once (when it becomes connected) and {@code false} at most once
 * (when it disconnects, for any reason).</p>
 */
@FunctionalInterface
public interface ConnectionStatusHandler
{
    void onStatusChanged(ConnectionId connectionId, boolean connected);
}
