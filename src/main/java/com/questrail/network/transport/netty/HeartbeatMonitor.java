package com.questrail.network.transport.netty;

/**
 * Round-trip time and link quality derived from ping/pong frames.
 *
 * <p>At most one ping is outstanding. A ping that is still unanswered when the
 * next one goes out counts as lost; a pong for anything but the outstanding
 * token is ignored. Quality is the answered share of the last
 * {@value #WINDOW} completed pings, {@code 100} before any has completed.</p>
 */
final class HeartbeatMonitor
{
    static final int WINDOW = 10;

    private final boolean[] outcomes = new boolean[WINDOW];
    private int recorded;
    private int next;

    private boolean awaiting;
    private long outstandingToken;

    private long rttMillis;

    synchronized void pingSent(long token) {
        if (awaiting) {
            record(false);
        }
        awaiting = true;
        outstandingToken = token;
    }

    /**
     * @return {@code true} if the pong matched the outstanding ping
     */
    synchronized boolean pongReceived(long token, long nowNanos) {
        if (!awaiting || token != outstandingToken) {
            return false;
        }
        awaiting = false;
        rttMillis = Math.max(0L, (nowNanos - token) / 1_000_000L);
        record(true);
        return true;
    }

    synchronized long rttMillis() {
        return rttMillis;
    }

    synchronized double qualityPercent() {
        if (recorded == 0) {
            return 100.0;
        }
        int answered = 0;
        for (int i = 0; i < recorded; i++) {
            if (outcomes[i]) {
                answered++;
            }
        }
        return answered * 100.0 / recorded;
    }

    private void record(boolean answered) {
        outcomes[next] = answered;
        next = (next + 1) % WINDOW;
        if (recorded < WINDOW) {
            recorded++;
        }
    }
}
