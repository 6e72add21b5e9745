package com.questrail.network.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp dispatch and observability events.
 *
 * <p>It may jump (NTP, manual changes), so it MUST NOT drive uptime,
 * staleness or scheduling; use {@link MonotonicClock} for those.</p>
 */
public interface WallClock
{
    Instant now();
}
