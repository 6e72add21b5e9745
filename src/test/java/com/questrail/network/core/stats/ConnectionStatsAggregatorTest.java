package com.questrail.network.core.stats;

import com.questrail.network.api.ConnectionStats;
import com.questrail.network.transport.TransportMetrics;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionStatsAggregatorTest {

    @Test
    void freshAggregatorMatchesEmptySnapshot() {
        assertEquals(ConnectionStats.EMPTY, new ConnectionStatsAggregator().snapshot(12345L));
    }

    @Test
    void countersAccumulateIndependently() {
        ConnectionStatsAggregator agg = new ConnectionStatsAggregator();

        agg.recordReliableSent();
        agg.recordReliableSent();
        agg.recordUnreliableSent();
        agg.recordReceived();
        agg.recordDroppedWhileDisconnected();
        agg.recordUnreliableDiscarded(3);
        agg.recordReliableRejected();
        agg.recordTransportFailure();
        agg.recordAbandonedOnClose(2);
        agg.recordBackpressure();

        ConnectionStats s = agg.snapshot(0);
        assertEquals(2, s.reliableMessagesSent());
        assertEquals(1, s.unreliableMessagesSent());
        assertEquals(3, s.messagesSent());
        assertEquals(1, s.messagesReceived());
        assertEquals(1, s.sendsDroppedWhileDisconnected());
        assertEquals(3, s.unreliableMessagesDiscarded());
        assertEquals(1, s.reliableMessagesRejected());
        assertEquals(1, s.transportSendFailures());
        assertEquals(2, s.messagesAbandonedOnClose());
        assertEquals(1, s.backpressureEvents());
        assertEquals(1 + 3 + 1 + 1 + 2, s.messagesDropped());
    }

    @Test
    void byteCountersNeverDecreaseWhenTransportResets() {
        ConnectionStatsAggregator agg = new ConnectionStatsAggregator();

        agg.updateFromTransport(new TransportMetrics(20, 90.0, 1000, 500));
        agg.updateFromTransport(new TransportMetrics(35, 80.0, 10, 5));

        ConnectionStats s = agg.snapshot(0);
        assertEquals(1000, s.bytesSent());
        assertEquals(500, s.bytesReceived());
        assertEquals(35, s.pingMs());
        assertEquals(80.0, s.qualityPercent());
    }

    @Test
    void uptimeRunsWhileConnectedAndFreezesAfterDisconnect() {
        ConnectionStatsAggregator agg = new ConnectionStatsAggregator();

        assertEquals(Duration.ZERO, agg.snapshot(5_000_000_000L).uptime());

        agg.markConnected(1_000_000_000L);
        assertEquals(Duration.ofSeconds(2), agg.snapshot(3_000_000_000L).uptime());

        agg.markDisconnected(4_000_000_000L);
        assertEquals(Duration.ofSeconds(3), agg.snapshot(9_000_000_000L).uptime());

        agg.markConnected(10_000_000_000L);
        agg.markDisconnected(11_000_000_000L);
        assertEquals(Duration.ofSeconds(3), agg.snapshot(12_000_000_000L).uptime());
    }

    @Test
    void negativeCountsAreRejected() {
        ConnectionStatsAggregator agg = new ConnectionStatsAggregator();
        assertThrows(IllegalArgumentException.class, () -> agg.recordUnreliableDiscarded(-1));
        assertThrows(IllegalArgumentException.class, () -> agg.recordAbandonedOnClose(-1));
    }
}
