package com.questrail.network.config;

import java.time.Duration;
import java.util.Objects;

/**
 * OutboundQueuePolicy
 * -----------------------------------------------------------------------------
 * Capacity and staleness limits for a connection's outbound queue.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>reliableCapacity</b>: Maximum number of reliable messages waiting
 *       for the transport. Reliable messages are never discarded once queued;
 *       a send that finds the lane full is rejected and counted.</li>
 *   <li><b>unreliableCapacity</b>: Maximum number of unreliable messages
 *       waiting for the transport. On overflow the oldest queued message is
 *       discarded so the newest data always gets through.</li>
 *   <li><b>unreliableMaxAge</b>: Unreliable messages older than this when the
 *       drain reaches them are discarded. {@link Duration#ZERO} disables the
 *       check.</li>
 * </ul>
 */
public record OutboundQueuePolicy(
        int reliableCapacity,
        int unreliableCapacity,
        Duration unreliableMaxAge
) {
    public OutboundQueuePolicy {
        Objects.requireNonNull(unreliableMaxAge, "unreliableMaxAge");

        if (reliableCapacity <= 0) {
            throw new IllegalArgumentException("reliableCapacity must be positive");
        }
        if (unreliableCapacity <= 0) {
            throw new IllegalArgumentException("unreliableCapacity must be positive");
        }
        if (unreliableMaxAge.isNegative()) {
            throw new IllegalArgumentException("unreliableMaxAge must be non-negative");
        }
    }

    /**
     * Whether unreliable messages are subject to a maximum age.
     */
    public boolean hasUnreliableMaxAge() {
        return !unreliableMaxAge.isZero();
    }

    /**
     * Default limits:
     * <ul>
     *   <li>reliableCapacity: 1024</li>
     *   <li>unreliableCapacity: 256</li>
     *   <li>unreliableMaxAge: none</li>
     * </ul>
     */
    public static OutboundQueuePolicy defaults() {
        return new OutboundQueuePolicy(1024, 256, Duration.ZERO);
    }
}
