package com.questrail.network.api;

import java.time.Duration;
import java.util.Objects;

/**
 * ConnectionStats
 * -----------------------------------------------------------------------------
 * Immutable, consistently-read snapshot of a connection's statistics.
 *
 * <h2>Counters</h2>
 * Cumulative since the connection was created and never decreasing:
 * <ul>
 *   <li>{@code reliableMessagesSent}, {@code unreliableMessagesSent}: messages
 *       handed to the transport binding and accepted by it</li>
 *   <li>{@code messagesReceived}: inbound messages while connected</li>
 *   <li>{@code sendsDroppedWhileDisconnected}: sends attempted when the
 *       connection was not connected</li>
 *   <li>{@code unreliableMessagesDiscarded}: unreliable messages dropped by
 *       lane overflow or staleness</li>
 *   <li>{@code reliableMessagesRejected}: reliable sends refused because the
 *       reliable lane was at capacity</li>
 *   <li>{@code transportSendFailures}: messages the binding refused outright</li>
 *   <li>{@code messagesAbandonedOnClose}: queued messages given up when the
 *       connection closed</li>
 *   <li>{@code backpressureEvents}: drain passes cut short by binding
 *       backpressure</li>
 *   <li>{@code bytesSent}, {@code bytesReceived}: raw transport byte counts</li>
 * </ul>
 *
 * <h2>Gauges</h2>
 * {@code pingMs}, {@code qualityPercent} (0 to 100) and {@code uptime} follow
 * the transport and may move in either direction.
 */
public record ConnectionStats(
        long reliableMessagesSent,
        long unreliableMessagesSent,
        long messagesReceived,
        long sendsDroppedWhileDisconnected,
        long unreliableMessagesDiscarded,
        long reliableMessagesRejected,
        long transportSendFailures,
        long messagesAbandonedOnClose,
        long backpressureEvents,
        long bytesSent,
        long bytesReceived,
        long pingMs,
        double qualityPercent,
        Duration uptime
) {
    /** Snapshot of a connection that has done nothing yet. */
    public static final ConnectionStats EMPTY =
            new ConnectionStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 100.0, Duration.ZERO);

    public ConnectionStats {
        Objects.requireNonNull(uptime, "uptime");
        if (qualityPercent < 0.0 || qualityPercent > 100.0) {
            throw new IllegalArgumentException("qualityPercent must be within [0, 100]: " + qualityPercent);
        }
    }

    /**
     * Total of every outbound message this layer or the binding gave up on.
     */
    public long messagesDropped() {
        return sendsDroppedWhileDisconnected
                + unreliableMessagesDiscarded
                + reliableMessagesRejected
                + transportSendFailures
                + messagesAbandonedOnClose;
    }

    /**
     * Total messages accepted by the transport binding.
     */
    public long messagesSent() {
        return reliableMessagesSent + unreliableMessagesSent;
    }
}
