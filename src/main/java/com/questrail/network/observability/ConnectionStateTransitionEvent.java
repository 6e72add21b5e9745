package com.questrail.network.observability;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.core.ConnectionState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of one connection.
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    ConnectionId connectionId,
    ConnectionState oldState,
    ConnectionState newState
) {
    /**
     * Whether the transition changed what {@code isConnected()} reports.
     */
    public boolean isConnectivityChange() {
        return (oldState == ConnectionState.CONNECTED) != (newState == ConnectionState.CONNECTED);
    }
}
