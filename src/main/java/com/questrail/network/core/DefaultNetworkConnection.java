package com.questrail.network.core;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.api.ConnectionStats;
import com.questrail.network.api.ConnectionStatusHandler;
import com.questrail.network.api.MessageHandler;
import com.questrail.network.api.NetworkConnection;
import com.questrail.network.api.Reliability;
import com.questrail.network.config.OutboundQueuePolicy;
import com.questrail.network.core.queue.OfferResult;
import com.questrail.network.core.queue.OutboundMessage;
import com.questrail.network.core.queue.OutboundQueue;
import com.questrail.network.core.stats.ConnectionStatsAggregator;
import com.questrail.network.dispatch.ConnectionEvent;
import com.questrail.network.dispatch.DispatchBridge;
import com.questrail.network.internal.time.MonotonicClock;
import com.questrail.network.internal.time.WallClock;
import com.questrail.network.observability.ConnectionStateTransitionEvent;
import com.questrail.network.observability.MessageDropEvent;
import com.questrail.network.observability.NetworkErrorEvent;
import com.questrail.network.observability.NetworkObservabilitySink;
import com.questrail.network.observability.TransportObservabilityEvent;
import com.questrail.network.transport.SendOutcome;
import com.questrail.network.transport.TransportBinding;
import com.questrail.network.transport.TransportBindingListener;

import java.util.Objects;

/**
 * DefaultNetworkConnection
 * =============================================================================
 * The per-connection state machine. Owns one {@link OutboundQueue}, one
 * {@link ConnectionStatsAggregator} and one {@link TransportBinding}, and
 * publishes events through the endpoint's {@link DispatchBridge}.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li><b>Application threads</b> call {@link #sendMessage}, {@link #disconnect},
 *       {@link #isConnected} and {@link #stats}.</li>
 *   <li><b>Transport threads</b> call the binding listener (up, down, message).</li>
 *   <li><b>The service thread</b> calls {@link #service()} once per tick to
 *       drain the outbound queue into the binding and to finish a requested
 *       close.</li>
 *   <li><b>The pump thread</b> runs the registered handlers.</li>
 * </ul>
 *
 * <p>State changes and the status events they produce happen under one lock,
 * so a connection's {@code connected=true} event is always queued before its
 * {@code connected=false} event, and each is queued at most once. Sends take
 * the same lock only long enough to check the state and enqueue.</p>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   sendMessage() → OutboundQueue → service() → TransportBinding.send()
 * </pre>
 * The reliable lane is drained before the unreliable lane. A
 * {@link SendOutcome#BACKPRESSURE} result puts the message back at the head
 * of its lane and ends the tick.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   TransportBindingListener → DispatchBridge.post() → pump() → handlers
 * </pre>
 */
public final class DefaultNetworkConnection implements NetworkConnection {

    private final ConnectionId id;
    private final TransportBinding binding;
    private final OutboundQueuePolicy queuePolicy;
    private final OutboundQueue queue;
    private final ConnectionStatsAggregator stats = new ConnectionStatsAggregator();

    private final DispatchBridge dispatchBridge;
    private final NetworkObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ConnectionLifecycleListener lifecycleListener;

    private final Object stateLock = new Object();
    private volatile ConnectionState state = ConnectionState.INITIAL;

    private volatile MessageHandler messageHandler;
    private volatile ConnectionStatusHandler statusHandler;

    public DefaultNetworkConnection(ConnectionId id,
                                    TransportBinding binding,
                                    ConnectionContext context,
                                    ConnectionLifecycleListener lifecycleListener)
    {
        this.id = Objects.requireNonNull(id, "id");
        if (!id.isValid()) {
            throw new IllegalArgumentException("connection id must not be INVALID");
        }
        this.binding = Objects.requireNonNull(binding, "binding");
        Objects.requireNonNull(context, "context");

        this.queuePolicy = context.queuePolicy();
        this.queue = new OutboundQueue(queuePolicy);
        this.dispatchBridge = context.dispatchBridge();
        this.observabilitySink = context.observabilitySink();
        this.clock = context.clock();
        this.wallClock = context.wallClock();
        this.lifecycleListener = Objects.requireNonNullElse(lifecycleListener, ConnectionLifecycleListener.NONE);

        this.binding.setListener(new BindingListener());
    }

    public DefaultNetworkConnection(ConnectionId id, TransportBinding binding, ConnectionContext context) {
        this(id, binding, context, ConnectionLifecycleListener.NONE);
    }

    /**
     * Start the transport binding. The connection becomes connected when the
     * binding reports the handshake as complete.
     */
    public void open() {
        binding.start();
    }

    // -------------------------------------------------------------------------
    // NetworkConnection
    // -------------------------------------------------------------------------

    @Override
    public ConnectionId id() {
        return id;
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Current lifecycle state.
     */
    public ConnectionState state() {
        return state;
    }

    @Override
    public void disconnect() {
        synchronized (stateLock) {
            ConnectionState current = state;
            if (current.isClosing()) {
                return;
            }
            stats.markDisconnected(clock.nowNanos());
            postStatus(false);
            moveTo(current, ConnectionState.DISCONNECTING);
        }
    }

    @Override
    public ConnectionStats stats() {
        return stats.snapshot(clock.nowNanos());
    }

    @Override
    public void sendMessage(String message, Reliability reliability) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(reliability, "reliability");

        OfferResult result;
        synchronized (stateLock) {
            if (state != ConnectionState.CONNECTED) {
                stats.recordDroppedWhileDisconnected();
                reportDrop(reliability, MessageDropEvent.Reason.NOT_CONNECTED, 1);
                return;
            }
            result = queue.offer(new OutboundMessage(message, reliability, clock.nowNanos()));
        }

        switch (result) {
            case ACCEPTED -> { }
            case ACCEPTED_DISPLACED_OLDEST -> {
                stats.recordUnreliableDiscarded(1);
                reportDrop(Reliability.UNRELIABLE, MessageDropEvent.Reason.UNRELIABLE_OVERFLOW, 1);
            }
            case REJECTED_FULL -> {
                stats.recordReliableRejected();
                reportDrop(Reliability.RELIABLE, MessageDropEvent.Reason.RELIABLE_LANE_FULL, 1);
            }
        }
    }

    @Override
    public void setMessageHandler(MessageHandler handler) {
        this.messageHandler = handler;
    }

    @Override
    public void setStatusHandler(ConnectionStatusHandler handler) {
        this.statusHandler = handler;
    }

    // -------------------------------------------------------------------------
    // Service tick (single service thread)
    // -------------------------------------------------------------------------

    /**
     * Advance the outbound side by one tick.
     *
     * <ul>
     *   <li>{@code CONNECTED}: fold transport metrics into the stats, drain the
     *       reliable lane, then the unreliable lane.</li>
     *   <li>{@code DISCONNECTING}: give queued reliable messages one send
     *       attempt, abandon the rest, stop the binding, become
     *       {@code DISCONNECTED}.</li>
     *   <li>{@code DISCONNECTED}: abandon anything that raced into the queue.</li>
     * </ul>
     */
    public void service() {
        switch (state) {
            case INITIAL -> { }
            case CONNECTED -> {
                refreshMetrics();
                if (drainReliable()) {
                    drainUnreliable();
                }
            }
            case DISCONNECTING -> {
                refreshMetrics();
                drainReliable();
                abandonQueued();
                stopBinding();
                finishClose();
            }
            case DISCONNECTED -> abandonQueued();
        }
    }

    /**
     * Whether messages are still waiting in either lane.
     */
    public boolean hasQueuedMessages() {
        return !queue.isEmpty();
    }

    /**
     * @return {@code false} if the pass stopped on backpressure
     */
    private boolean drainReliable() {
        int budget = queue.reliableSize();
        for (int i = 0; i < budget; i++) {
            OutboundMessage message = queue.pollReliable();
            if (message == null) {
                return true;
            }
            if (!deliver(message)) {
                return false;
            }
        }
        return true;
    }

    private void drainUnreliable() {
        int budget = queue.unreliableSize();
        for (int i = 0; i < budget; i++) {
            OutboundMessage message = queue.pollUnreliable();
            if (message == null) {
                return;
            }
            if (isStale(message)) {
                stats.recordUnreliableDiscarded(1);
                reportDrop(Reliability.UNRELIABLE, MessageDropEvent.Reason.UNRELIABLE_STALE, 1);
                continue;
            }
            if (!deliver(message)) {
                return;
            }
        }
    }

    private boolean isStale(OutboundMessage message) {
        return queuePolicy.hasUnreliableMaxAge()
                && message.ageNanos(clock.nowNanos()) > queuePolicy.unreliableMaxAge().toNanos();
    }

    /**
     * Hand one message to the binding.
     *
     * @return {@code false} if the binding pushed back
     */
    private boolean deliver(OutboundMessage message) {
        SendOutcome outcome;
        try {
            outcome = binding.send(message.payload(), message.reliability());
        } catch (RuntimeException e) {
            observabilitySink.onError(new NetworkErrorEvent(wallClock.now(), id, "Transport send threw", e));
            outcome = SendOutcome.FAILED;
        }

        switch (outcome) {
            case SENT -> {
                if (message.reliability() == Reliability.RELIABLE) {
                    stats.recordReliableSent();
                } else {
                    stats.recordUnreliableSent();
                }
                return true;
            }
            case BACKPRESSURE -> {
                stats.recordBackpressure();
                observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                        wallClock.now(), id, TransportObservabilityEvent.Kind.BACKPRESSURE, null));
                if (!queue.restore(message)) {
                    stats.recordUnreliableDiscarded(1);
                    reportDrop(Reliability.UNRELIABLE, MessageDropEvent.Reason.UNRELIABLE_OVERFLOW, 1);
                }
                return false;
            }
            default -> {
                stats.recordTransportFailure();
                reportDrop(message.reliability(), MessageDropEvent.Reason.TRANSPORT_FAILED, 1);
                return true;
            }
        }
    }

    /**
     * A failing metrics source is reported and skipped; the drain and any
     * pending close still run.
     */
    private void refreshMetrics() {
        try {
            stats.updateFromTransport(binding.metrics());
        } catch (RuntimeException e) {
            observabilitySink.onError(new NetworkErrorEvent(wallClock.now(), id, "Transport metrics failed", e));
        }
    }

    private void abandonQueued() {
        int reliable = queue.clearReliable();
        int unreliable = queue.clearUnreliable();
        if (reliable > 0) {
            stats.recordAbandonedOnClose(reliable);
            reportDrop(Reliability.RELIABLE, MessageDropEvent.Reason.ABANDONED_ON_CLOSE, reliable);
        }
        if (unreliable > 0) {
            stats.recordAbandonedOnClose(unreliable);
            reportDrop(Reliability.UNRELIABLE, MessageDropEvent.Reason.ABANDONED_ON_CLOSE, unreliable);
        }
    }

    private void stopBinding() {
        try {
            binding.stop();
        } catch (RuntimeException e) {
            observabilitySink.onError(new NetworkErrorEvent(wallClock.now(), id, "Transport stop failed", e));
        }
    }

    private void finishClose() {
        synchronized (stateLock) {
            if (state == ConnectionState.DISCONNECTING) {
                moveTo(ConnectionState.DISCONNECTING, ConnectionState.DISCONNECTED);
            }
        }
    }

    // -------------------------------------------------------------------------
    // State and dispatch helpers (callers hold stateLock)
    // -------------------------------------------------------------------------

    /**
     * Publish a transition. Any status event for the transition must already
     * be posted, so lifecycle listeners see it counted as pending.
     */
    private void moveTo(ConnectionState from, ConnectionState to) {
        state = to;
        observabilitySink.onStateTransition(new ConnectionStateTransitionEvent(wallClock.now(), id, from, to));
        lifecycleListener.onStateChanged(this, from, to);
    }

    private void postStatus(boolean connected) {
        dispatchBridge.post(new ConnectionEvent.StatusChanged(id, wallClock.now(), connected), this::dispatch);
    }

    /**
     * Pump-thread delivery into the registered handlers. A missing handler is
     * not an error; the event is simply consumed.
     */
    private void dispatch(ConnectionEvent event) {
        if (event instanceof ConnectionEvent.MessageReceived received) {
            MessageHandler handler = messageHandler;
            if (handler != null) {
                handler.onMessage(id, received.payload());
            }
        } else if (event instanceof ConnectionEvent.StatusChanged changed) {
            ConnectionStatusHandler handler = statusHandler;
            if (handler != null) {
                handler.onStatusChanged(id, changed.connected());
            }
        }
    }

    private void reportDrop(Reliability reliability, MessageDropEvent.Reason reason, int count) {
        observabilitySink.onMessageDropped(new MessageDropEvent(wallClock.now(), id, reliability, reason, count));
    }

    @Override
    public String toString() {
        return "DefaultNetworkConnection{" + id + ", " + state + "}";
    }

    // -------------------------------------------------------------------------
    // Transport listener (transport threads)
    // -------------------------------------------------------------------------

    private final class BindingListener implements TransportBindingListener {
        @Override
        public void onTransportUp() {
            synchronized (stateLock) {
                if (state != ConnectionState.INITIAL) {
                    // Close was requested during the handshake; the service tick tears it down.
                    return;
                }
                stats.markConnected(clock.nowNanos());
                postStatus(true);
                moveTo(ConnectionState.INITIAL, ConnectionState.CONNECTED);
            }
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                    wallClock.now(), id, TransportObservabilityEvent.Kind.UP, null));
        }

        @Override
        public void onTransportDown(Throwable cause) {
            synchronized (stateLock) {
                ConnectionState current = state;
                if (current == ConnectionState.DISCONNECTED) {
                    return;
                }
                stats.markDisconnected(clock.nowNanos());
                if (current != ConnectionState.DISCONNECTING) {
                    postStatus(false);
                }
                moveTo(current, ConnectionState.DISCONNECTED);
            }
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                    wallClock.now(), id, TransportObservabilityEvent.Kind.DOWN, cause));
            abandonQueued();
        }

        @Override
        public void onMessage(String payload) {
            Objects.requireNonNull(payload, "payload");
            synchronized (stateLock) {
                if (state != ConnectionState.CONNECTED) {
                    return;
                }
                stats.recordReceived();
                dispatchBridge.post(
                        new ConnectionEvent.MessageReceived(id, wallClock.now(), payload),
                        DefaultNetworkConnection.this::dispatch);
            }
        }
    }
}
