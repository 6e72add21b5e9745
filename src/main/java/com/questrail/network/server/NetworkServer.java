package com.questrail.network.server;

import com.questrail.network.api.ClientConnectionHandler;
import com.questrail.network.api.ClientDisconnectionHandler;
import com.questrail.network.api.ConnectionId;
import com.questrail.network.api.ConnectionStatusHandler;
import com.questrail.network.api.MessageHandler;
import com.questrail.network.api.NetworkConnection;
import com.questrail.network.api.Reliability;
import com.questrail.network.config.NetworkRuntimeConfig;
import com.questrail.network.core.ConnectionContext;
import com.questrail.network.core.ConnectionServiceDriver;
import com.questrail.network.core.ConnectionState;
import com.questrail.network.core.DefaultNetworkConnection;
import com.questrail.network.dispatch.ConnectionEvent;
import com.questrail.network.dispatch.DispatchBridge;
import com.questrail.network.internal.time.MonotonicClock;
import com.questrail.network.internal.time.MonotonicScheduler;
import com.questrail.network.internal.time.ScheduledExecutorScheduler;
import com.questrail.network.internal.time.SystemMonotonicClock;
import com.questrail.network.internal.time.SystemWallClock;
import com.questrail.network.internal.time.WallClock;
import com.questrail.network.observability.NetworkObservabilitySink;
import com.questrail.network.observability.NullObservabilitySink;
import com.questrail.network.transport.TransportAcceptor;
import com.questrail.network.transport.TransportBinding;
import com.questrail.network.transport.netty.NettyTransportAcceptor;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NetworkServer
 * =============================================================================
 * Composition root and lifecycle owner for the server side: one listener, many
 * inbound connections.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   TransportAcceptor ──accepted──▶ ConnectionRegistry.accept()
 *                                      └─▶ ConnectionServiceDriver (outbound ticks)
 *                                      └─▶ DispatchBridge (inbound events)
 * </pre>
 *
 * <h2>Main-thread contract</h2>
 * The application calls {@link #pumpEvents()} once per tick. Every handler
 * registered here (per-connection message/status handlers and the
 * client connected/disconnected handlers) runs inside that call.
 *
 * <p>Handlers registered with {@link #setMessageHandler} and
 * {@link #setStatusHandler} apply to every current and future connection.
 * A single connection can override them through {@link #connection}.</p>
 */
public final class NetworkServer {

    private final TransportAcceptor acceptor;
    private final ConnectionRegistry registry;
    private final DispatchBridge dispatchBridge;
    private final ConnectionServiceDriver serviceDriver;
    private final ScheduledExecutorService ownedExecutor;
    private final WallClock wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile MessageHandler messageHandler;
    private volatile ConnectionStatusHandler statusHandler;
    private volatile ClientConnectionHandler clientConnectionHandler;
    private volatile ClientDisconnectionHandler clientDisconnectionHandler;

    private NetworkServer(TransportAcceptor acceptor,
                          ConnectionContext context,
                          ConnectionServiceDriver serviceDriver,
                          ScheduledExecutorService ownedExecutor)
    {
        this.acceptor = acceptor;
        this.dispatchBridge = context.dispatchBridge();
        this.serviceDriver = serviceDriver;
        this.ownedExecutor = ownedExecutor;
        this.wallClock = context.wallClock();
        this.registry = new ConnectionRegistry(context, this::onConnectionStateChanged);

        this.acceptor.setListener(this::onAccepted);
    }

    /**
     * Bind the listener and start servicing connections. Idempotent while
     * running. A server is single-use: {@link #stop()} releases the transport,
     * so it cannot be started again.
     *
     * <p>If the bind fails the service driver is stopped again and the server
     * is left not running, so {@code start()} may be retried.</p>
     *
     * @throws IllegalStateException if the server has been stopped
     * @throws com.questrail.network.transport.TransportException if the listener cannot bind
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("NetworkServer cannot be restarted after stop()");
        }
        if (running.compareAndSet(false, true)) {
            serviceDriver.start();
            try {
                acceptor.start();
            } catch (RuntimeException e) {
                serviceDriver.stop();
                running.set(false);
                throw e;
            }
        }
    }

    /**
     * Stop accepting, close every connection (with one final flush of their
     * reliable lanes) and release the service thread. Events already posted
     * remain available to {@link #pumpEvents()}.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            stopped.set(true);
            acceptor.stop();
            registry.disconnectAll();
            serviceDriver.stop();
            awaitServiceThread();

            // Final tick on the caller's thread now that no scheduled tick can overlap it.
            serviceDriver.runOnce();
            acceptor.close();
        }
    }

    private void awaitServiceThread() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * The bound listen address, or {@code null} when not started.
     */
    public SocketAddress localAddress() {
        return acceptor.localAddress();
    }

    /**
     * Deliver pending connection events on the calling thread.
     *
     * @return number of events delivered
     */
    public int pumpEvents() {
        return dispatchBridge.pump();
    }

    public Optional<NetworkConnection> connection(ConnectionId id) {
        return registry.get(id).map(c -> c);
    }

    public int connectionCount() {
        return registry.size();
    }

    /**
     * Fire-and-forget send to one client. Unknown identifiers are ignored.
     */
    public void send(ConnectionId id, String message, Reliability reliability) {
        registry.get(id).ifPresent(c -> c.sendMessage(message, reliability));
    }

    /**
     * Fire-and-forget send to every connected client.
     */
    public void broadcast(String message, Reliability reliability) {
        for (DefaultNetworkConnection connection : registry.connections()) {
            if (connection.isConnected()) {
                connection.sendMessage(message, reliability);
            }
        }
    }

    /**
     * Gracefully close one client connection. Unknown identifiers are ignored.
     */
    public void disconnect(ConnectionId id) {
        registry.remove(id);
    }

    public void setMessageHandler(MessageHandler handler) {
        this.messageHandler = handler;
        for (DefaultNetworkConnection connection : registry.connections()) {
            connection.setMessageHandler(handler);
        }
    }

    public void setStatusHandler(ConnectionStatusHandler handler) {
        this.statusHandler = handler;
        for (DefaultNetworkConnection connection : registry.connections()) {
            connection.setStatusHandler(handler);
        }
    }

    public void setClientConnectionHandler(ClientConnectionHandler handler) {
        this.clientConnectionHandler = handler;
    }

    public void setClientDisconnectionHandler(ClientDisconnectionHandler handler) {
        this.clientDisconnectionHandler = handler;
    }

    // -------------------------------------------------------------------------
    // Acceptor and lifecycle wiring (transport threads)
    // -------------------------------------------------------------------------

    private void onAccepted(TransportBinding binding) {
        if (!running.get()) {
            binding.stop();
            return;
        }

        DefaultNetworkConnection connection = registry.accept(binding);
        connection.setMessageHandler(messageHandler);
        connection.setStatusHandler(statusHandler);
        serviceDriver.register(connection);
        connection.open();
    }

    private void onConnectionStateChanged(DefaultNetworkConnection connection,
                                          ConnectionState oldState,
                                          ConnectionState newState)
    {
        if (newState == ConnectionState.CONNECTED) {
            postClientEvent(connection.id(), true);
        } else if (oldState == ConnectionState.CONNECTED && newState.isClosing()) {
            postClientEvent(connection.id(), false);
        }
    }

    private void postClientEvent(ConnectionId id, boolean connected) {
        dispatchBridge.post(new ConnectionEvent.StatusChanged(id, wallClock.now(), connected), this::dispatchClientEvent);
    }

    private void dispatchClientEvent(ConnectionEvent event) {
        if (!(event instanceof ConnectionEvent.StatusChanged changed)) {
            return;
        }
        if (changed.connected()) {
            ClientConnectionHandler handler = clientConnectionHandler;
            if (handler != null) {
                handler.onClientConnected(changed.connectionId());
            }
        } else {
            ClientDisconnectionHandler handler = clientDisconnectionHandler;
            if (handler != null) {
                handler.onClientDisconnected(changed.connectionId());
            }
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NetworkRuntimeConfig config = NetworkRuntimeConfig.defaults();
        private NetworkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private TransportAcceptor acceptor;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(NetworkRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(NetworkObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Use a specific acceptor instead of the Netty TCP acceptor built from
         * the configuration.
         */
        public Builder withAcceptor(TransportAcceptor acceptor) {
            this.acceptor = acceptor;
            return this;
        }

        /**
         * Drive service ticks from the given scheduler and clock instead of an
         * owned single-thread executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock) {
            this.scheduler = scheduler;
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public NetworkServer build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");

            NetworkObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            DispatchBridge bridge = new DispatchBridge(sink, wallClock);
            ConnectionContext context = new ConnectionContext(config.queuePolicy(), bridge, sink, clock, wallClock);

            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "network-server-service");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
            }

            ConnectionServiceDriver driver =
                    new ConnectionServiceDriver(effectiveScheduler, clock, config.serviceInterval(), sink);

            TransportAcceptor effectiveAcceptor = acceptor != null ? acceptor : new NettyTransportAcceptor(config);

            return new NetworkServer(effectiveAcceptor, context, driver, ownedExecutor);
        }
    }
}
