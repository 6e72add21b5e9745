package com.questrail.network.transport;

/**
 * Result of {@link TransportBinding#send}.
 */
public enum SendOutcome
{
    /** The transport accepted the message. */
    SENT,

    /** The transport is momentarily unable to accept more; retry later. */
    BACKPRESSURE,

    /** The transport refused the message for good (closed session, oversize payload). */
    FAILED
}
