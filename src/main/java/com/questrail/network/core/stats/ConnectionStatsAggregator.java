package com.questrail.network.core.stats;

import com.questrail.network.api.ConnectionStats;
import com.questrail.network.transport.TransportMetrics;

import java.time.Duration;

/**
 * ConnectionStatsAggregator
 * =============================================================================
 * Mutable statistics owner for exactly one connection.
 *
 * <h2>Update rules</h2>
 * <ul>
 *   <li>Counters only ever increase. Byte counts folded in from the transport
 *       keep the highest value seen, so a binding that resets its counters
 *       cannot make them go backwards.</li>
 *   <li>Round-trip time and quality are replaced by the latest transport
 *       reading.</li>
 *   <li>Uptime runs from {@link #markConnected} to {@link #markDisconnected}
 *       and is frozen afterwards.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods synchronize on the aggregator, so {@link #snapshot(long)}
 * never observes a half-applied update. Only the owning connection calls the
 * {@code record*} methods.</p>
 */
public final class ConnectionStatsAggregator {

    private static final long NOT_SET = Long.MIN_VALUE;

    private long reliableMessagesSent;
    private long unreliableMessagesSent;
    private long messagesReceived;
    private long sendsDroppedWhileDisconnected;
    private long unreliableMessagesDiscarded;
    private long reliableMessagesRejected;
    private long transportSendFailures;
    private long messagesAbandonedOnClose;
    private long backpressureEvents;
    private long bytesSent;
    private long bytesReceived;

    private long pingMs;
    private double qualityPercent = 100.0;

    private long connectedAtNanos = NOT_SET;
    private long disconnectedAtNanos = NOT_SET;

    public synchronized void markConnected(long nowNanos) {
        if (connectedAtNanos == NOT_SET) {
            connectedAtNanos = nowNanos;
        }
    }

    public synchronized void markDisconnected(long nowNanos) {
        if (connectedAtNanos != NOT_SET && disconnectedAtNanos == NOT_SET) {
            disconnectedAtNanos = nowNanos;
        }
    }

    public synchronized void recordReliableSent() {
        reliableMessagesSent++;
    }

    public synchronized void recordUnreliableSent() {
        unreliableMessagesSent++;
    }

    public synchronized void recordReceived() {
        messagesReceived++;
    }

    public synchronized void recordDroppedWhileDisconnected() {
        sendsDroppedWhileDisconnected++;
    }

    public synchronized void recordUnreliableDiscarded(int count) {
        requireNonNegative(count);
        unreliableMessagesDiscarded += count;
    }

    public synchronized void recordReliableRejected() {
        reliableMessagesRejected++;
    }

    public synchronized void recordTransportFailure() {
        transportSendFailures++;
    }

    public synchronized void recordAbandonedOnClose(int count) {
        requireNonNegative(count);
        messagesAbandonedOnClose += count;
    }

    public synchronized void recordBackpressure() {
        backpressureEvents++;
    }

    /**
     * Fold the binding's latest raw metrics into the gauges and byte counters.
     */
    public synchronized void updateFromTransport(TransportMetrics metrics) {
        pingMs = metrics.rttMillis();
        qualityPercent = metrics.qualityPercent();
        bytesSent = Math.max(bytesSent, metrics.bytesSent());
        bytesReceived = Math.max(bytesReceived, metrics.bytesReceived());
    }

    /**
     * Consistent copy of every counter and gauge.
     *
     * @param nowNanos current monotonic time, used for uptime of a live connection
     */
    public synchronized ConnectionStats snapshot(long nowNanos) {
        return new ConnectionStats(
                reliableMessagesSent,
                unreliableMessagesSent,
                messagesReceived,
                sendsDroppedWhileDisconnected,
                unreliableMessagesDiscarded,
                reliableMessagesRejected,
                transportSendFailures,
                messagesAbandonedOnClose,
                backpressureEvents,
                bytesSent,
                bytesReceived,
                pingMs,
                qualityPercent,
                uptime(nowNanos)
        );
    }

    private Duration uptime(long nowNanos) {
        if (connectedAtNanos == NOT_SET) {
            return Duration.ZERO;
        }
        long end = disconnectedAtNanos != NOT_SET ? disconnectedAtNanos : nowNanos;
        return Duration.ofNanos(Math.max(0, end - connectedAtNanos));
    }

    private static void requireNonNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
    }
}
