package com.questrail.network.observability;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.api.Reliability;

import java.time.Instant;

/**
 * Record representing one or more outbound messages that will not be sent.
 *
 * @param count number of messages covered by this event (1 except for
 *              {@link Reason#ABANDONED_ON_CLOSE})
 */
public record MessageDropEvent(
    Instant timestamp,
    ConnectionId connectionId,
    Reliability reliability,
    Reason reason,
    int count
) {
    public enum Reason {
        /** Sent while the connection was not connected. */
        NOT_CONNECTED,
        /** Oldest unreliable message displaced by a newer one. */
        UNRELIABLE_OVERFLOW,
        /** Unreliable message exceeded the maximum queue age. */
        UNRELIABLE_STALE,
        /** Reliable lane at capacity. */
        RELIABLE_LANE_FULL,
        /** Transport binding refused the message. */
        TRANSPORT_FAILED,
        /** Still queued when the connection closed. */
        ABANDONED_ON_CLOSE
    }
}
