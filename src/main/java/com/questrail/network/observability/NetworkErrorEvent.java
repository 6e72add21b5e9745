package com.questrail.network.observability;

import com.questrail.network.api.ConnectionId;

import java.time.Instant;

/**
 * Record representing a contained failure in the connection layer.
 *
 * @param connectionId affected connection, or {@link ConnectionId#INVALID}
 *                     when the failure is not tied to one
 */
public record NetworkErrorEvent(
    Instant timestamp,
    ConnectionId connectionId,
    String message,
    Throwable cause
) {
}
