package com.questrail.network.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for everything that measures elapsed time inside a connection:
 * uptime, message age in the unreliable lane, heartbeat round trips and
 * service tick spacing.
 *
 * <p>Wall-clock time ({@link WallClock}) is only used to stamp observability
 * events.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
