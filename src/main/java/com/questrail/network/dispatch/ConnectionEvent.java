package com.questrail.network.dispatch;

import com.questrail.network.api.ConnectionId;

import java.time.Instant;
import java.util.Objects;

/**
 * ConnectionEvent
 * -----------------------------------------------------------------------------
 * An event produced on a transport thread and waiting in the
 * {@link DispatchBridge} for the main-thread pump.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events are immutable</li>
 *   <li>Events carry only what the handler needs</li>
 *   <li>Every event belongs to exactly one connection</li>
 * </ul>
 */
public sealed interface ConnectionEvent
        permits ConnectionEvent.MessageReceived, ConnectionEvent.StatusChanged
{
    /** Connection that produced the event. */
    ConnectionId connectionId();

    /** Wall-clock time the event was produced; diagnostics only. */
    Instant timestamp();

    /** An inbound message. */
    record MessageReceived(ConnectionId connectionId, Instant timestamp, String payload)
            implements ConnectionEvent {
        public MessageReceived {
            Objects.requireNonNull(connectionId, "connectionId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(payload, "payload");
        }
    }

    /** The connection became connected ({@code true}) or disconnected ({@code false}). */
    record StatusChanged(ConnectionId connectionId, Instant timestamp, boolean connected)
            implements ConnectionEvent {
        public StatusChanged {
            Objects.requireNonNull(connectionId, "connectionId");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
