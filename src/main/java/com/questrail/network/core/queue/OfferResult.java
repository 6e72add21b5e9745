package com.questrail.network.core.queue;

/**
 * Result of {@link OutboundQueue#offer(OutboundMessage)}.
 */
public enum OfferResult
{
    /** Queued. */
    ACCEPTED,

    /** Queued; the oldest unreliable message was discarded to make room. */
    ACCEPTED_DISPLACED_OLDEST,

    /** Not queued; the reliable lane is at capacity. */
    REJECTED_FULL
}
