package com.questrail.network.api;

/**
 * NetworkConnection
 * -----------------------------------------------------------------------------
 * {@code NetworkConnection} is one point-to-point, bidirectional session
 * between two endpoints. Clients hold one (to their server); servers hold one
 * per accepted client.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Lifecycle: Initial, Connected, Disconnected (terminal)</li>
 *   <li>Non-blocking, fire-and-forget message sending with a per-message
 *       {@link Reliability}</li>
 *   <li>Delivery of inbound messages and status changes to registered handlers</li>
 *   <li>Live statistics</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Payload serialization (payloads are opaque text)</li>
 *   <li>Framing, congestion control, encryption or NAT traversal</li>
 *   <li>Sessions or authentication</li>
 * </ul>
 *
 * <h2>Threading and Concurrency</h2>
 * Every method of this interface may be called from any thread without
 * external synchronization.
 * <p>
 * Handlers never run on the caller's thread or on a transport thread. They run
 * only inside the dispatch bridge's pump, which the application calls once per
 * tick on its main thread. Handler bodies may therefore touch application
 * state without locking.
 *
 * <h2>Failure Model</h2>
 * No method of this interface throws because of network conditions. Loss of
 * connectivity is observed only through the status handler and
 * {@link #isConnected()}; dropped sends are observed only through
 * {@link #stats()}.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>The connection is created by a client connect or a server accept</li>
 *   <li>Handlers are registered</li>
 *   <li>Messages flow while connected</li>
 *   <li>{@link #disconnect()} or transport loss ends the session for good; a
 *       new session needs a new connection with a new id</li>
 * </ol>
 */
public interface NetworkConnection
{
    /**
     * Returns this connection's identifier. Never {@link ConnectionId#INVALID}.
     */
    ConnectionId id();

    /**
     * Returns {@code true} iff the connection is currently connected.
     * <p>
     * Non-blocking. Reflects the most recently observed transport state, so it
     * may lag a transport-thread transition briefly.
     */
    boolean isConnected();

    /**
     * Requests a graceful close.
     * <p>
     * Reliable messages queued before this call get one best-effort send
     * attempt before teardown; queued unreliable messages may be discarded.
     * Sends made after this call are dropped.
     * <p>
     * Idempotent: further calls are no-ops and do not report the
     * disconnection again.
     */
    void disconnect();

    /**
     * Returns an immutable snapshot of the statistics. Never blocks on I/O.
     */
    ConnectionStats stats();

    /**
     * Queues a message for asynchronous transmission and returns immediately.
     * <p>
     * If the connection is not connected the message is dropped silently and
     * counted in {@link ConnectionStats#sendsDroppedWhileDisconnected()}. Size
     * limits are enforced by the transport binding, not here.
     *
     * @param message     payload text (must not be {@code null})
     * @param reliability delivery class (must not be {@code null})
     */
    void sendMessage(String message, Reliability reliability);

    /**
     * Registers the inbound message handler, replacing any previous one.
     * {@code null} clears the slot; messages arriving without a handler are
     * delivered to nobody.
     */
    void setMessageHandler(MessageHandler handler);

    /**
     * Registers the status handler, replacing any previous one.
     * {@code null} clears the slot.
     */
    void setStatusHandler(ConnectionStatusHandler handler);
}
