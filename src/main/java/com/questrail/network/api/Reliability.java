package com.questrail.network.api;

/**
 * Reliability
 * -----------------------------------------------------------------------------
 * Per-message delivery class, fixed at enqueue time.
 *
 * <p>These two values are the only reliability control offered to callers.
 * There is no partial reliability and no custom retry count.</p>
 */
public enum Reliability
{
    /**
     * No delivery or ordering guarantee, lowest overhead. Suited to
     * high-frequency state where the latest value matters more than every
     * value (positions, animation). May be discarded under backpressure.
     */
    UNRELIABLE,

    /**
     * Exactly-once delivery, ordered relative to the other reliable messages
     * of the same connection. Suited to commands, authentication and chat.
     */
    RELIABLE
}
