package com.questrail.network.core;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Lifecycle of a {@link DefaultNetworkConnection}.
 *
 * <pre>
 *   INITIAL ──up──▶ CONNECTED ──disconnect()──▶ DISCONNECTING ──tick──▶ DISCONNECTED
 *      │                │                             │
 *      └──────down──────┴─────────────down────────────┴──────────────▶ DISCONNECTED
 * </pre>
 *
 * <p>{@link #DISCONNECTING} and {@link #DISCONNECTED} are both "disconnected"
 * from the caller's point of view: sends are dropped and the status handler
 * has already been told. No transition leaves {@link #DISCONNECTED}.</p>
 */
public enum ConnectionState
{
    /** Handshake in progress or not yet observed. */
    INITIAL,

    /** Bidirectional communication permitted. */
    CONNECTED,

    /** Close requested; queued reliable messages get one last flush on the next tick. */
    DISCONNECTING,

    /** Terminal. */
    DISCONNECTED;

    /**
     * Whether this state has been left for good (close requested or done).
     */
    public boolean isClosing() {
        return this == DISCONNECTING || this == DISCONNECTED;
    }
}
