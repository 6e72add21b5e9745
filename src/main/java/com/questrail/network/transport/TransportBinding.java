package com.questrail.network.transport;

import com.questrail.network.api.Reliability;

/**
 * TransportBinding
 * -----------------------------------------------------------------------------
 * Port for one concrete transport-library session (a game-networking socket,
 * a WebSocket, a TCP channel, a test double).
 *
 * <p>Exactly one connection owns a binding for the binding's whole life;
 * bindings are never shared. Higher layers are responsible for:</p>
 * <ul>
 *   <li>queueing outbound messages and deciding when to call {@link #send}</li>
 *   <li>marshalling listener callbacks onto the application thread</li>
 *   <li>folding {@link #metrics()} into connection statistics</li>
 * </ul>
 */
public interface TransportBinding
{
    /**
     * Register the listener that receives lifecycle and inbound message events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(TransportBindingListener listener);

    /**
     * Begin the handshake (client side) or activate an already accepted
     * session (server side).
     *
     * <p>On success the binding MUST call
     * {@link TransportBindingListener#onTransportUp()} exactly once. On failure
     * it calls {@link TransportBindingListener#onTransportDown(Throwable)}.</p>
     *
     * @throws IllegalStateException if no listener has been registered
     */
    void start();

    /**
     * Close the session and release transport resources.
     *
     * <p>The listener receives {@link TransportBindingListener#onTransportDown(Throwable)}
     * at most once per session. Calling {@code stop()} again is a no-op.</p>
     */
    void stop();

    /**
     * Attempt to hand one message to the transport. Never blocks on I/O.
     *
     * @param payload     message text
     * @param reliability delivery class requested for this message
     * @return the outcome; {@link SendOutcome#BACKPRESSURE} asks the caller to
     *         keep the message and retry on a later tick
     */
    SendOutcome send(String payload, Reliability reliability);

    /**
     * Current raw metrics as maintained by the transport library.
     */
    TransportMetrics metrics();
}
