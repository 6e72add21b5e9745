package com.questrail.network.transport;

/**
 * TransportBindingListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link TransportBinding}.
 *
 * <p>Callbacks arrive on transport-owned threads. Implementations must hand
 * work off (to a queue) rather than running application code inline. A given
 * binding delivers its callbacks serially; Netty bindings deliver them on the
 * channel's event loop.</p>
 */
public interface TransportBindingListener
{
    /**
     * The handshake completed and bidirectional traffic is permitted.
     */
    void onTransportUp();

    /**
     * The session became unusable.
     *
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * A complete message arrived.
     *
     * @param payload decoded message text
     */
    void onMessage(String payload);
}
