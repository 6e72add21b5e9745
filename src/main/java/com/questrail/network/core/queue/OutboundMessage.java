package com.questrail.network.core.queue;

import com.questrail.network.api.Reliability;

import java.util.Objects;

/**
 * One queued outbound message.
 *
 * @param enqueuedAtNanos monotonic enqueue time, used by the unreliable
 *                        staleness limit
 */
public record OutboundMessage(
        String payload,
        Reliability reliability,
        long enqueuedAtNanos
) {
    public OutboundMessage {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(reliability, "reliability");
    }

    /**
     * Age of the message relative to {@code nowNanos}.
     */
    public long ageNanos(long nowNanos) {
        return nowNanos - enqueuedAtNanos;
    }
}
