package com.questrail.network.transport.netty;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatMonitorTest {

    private static final long MS = 1_000_000L;

    @Test
    void qualityIsFullBeforeAnyPingCompletes() {
        HeartbeatMonitor monitor = new HeartbeatMonitor();
        assertEquals(100.0, monitor.qualityPercent());
        assertEquals(0, monitor.rttMillis());

        monitor.pingSent(0);
        assertEquals(100.0, monitor.qualityPercent());
    }

    @Test
    void matchingPongSetsRoundTripTime() {
        HeartbeatMonitor monitor = new HeartbeatMonitor();

        monitor.pingSent(1_000 * MS);
        assertTrue(monitor.pongReceived(1_000 * MS, 1_045 * MS));

        assertEquals(45, monitor.rttMillis());
        assertEquals(100.0, monitor.qualityPercent());
    }

    @Test
    void unansweredPingCountsAsLostWhenNextPingGoesOut() {
        HeartbeatMonitor monitor = new HeartbeatMonitor();

        monitor.pingSent(1);
        monitor.pingSent(2);
        assertTrue(monitor.pongReceived(2, 2 + 10 * MS));

        assertEquals(50.0, monitor.qualityPercent());
    }

    @Test
    void stalePongIsIgnored() {
        HeartbeatMonitor monitor = new HeartbeatMonitor();

        monitor.pingSent(1);
        monitor.pingSent(2);

        assertFalse(monitor.pongReceived(1, 50 * MS));
        assertEquals(0, monitor.rttMillis());
    }

    @Test
    void qualityCoversOnlyTheRecentWindow() {
        HeartbeatMonitor monitor = new HeartbeatMonitor();

        for (int i = 0; i < HeartbeatMonitor.WINDOW; i++) {
            monitor.pingSent(i);
        }
        monitor.pingSent(100);
        monitor.pongReceived(100, 100);
        assertEquals(100.0 / HeartbeatMonitor.WINDOW, monitor.qualityPercent(), 1e-9);

        for (long t = 200; t < 200 + HeartbeatMonitor.WINDOW; t++) {
            monitor.pingSent(t);
            monitor.pongReceived(t, t);
        }
        assertEquals(100.0, monitor.qualityPercent());
    }
}
