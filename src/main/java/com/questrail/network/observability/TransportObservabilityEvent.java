package com.questrail.network.observability;

import com.questrail.network.api.ConnectionId;

import java.time.Instant;

/**
 * Record representing a transport-level event of one connection.
 *
 * @param cause diagnostic cause for {@link Kind#DOWN}; may be {@code null}
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    ConnectionId connectionId,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        UP,
        DOWN,
        BACKPRESSURE
    }
}
