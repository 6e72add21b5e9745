package com.questrail.network.client;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.api.ConnectionStats;
import com.questrail.network.api.ConnectionStatusHandler;
import com.questrail.network.api.MessageHandler;
import com.questrail.network.api.NetworkConnection;
import com.questrail.network.api.Reliability;
import com.questrail.network.config.NetworkRuntimeConfig;
import com.questrail.network.core.ConnectionContext;
import com.questrail.network.core.ConnectionServiceDriver;
import com.questrail.network.core.DefaultNetworkConnection;
import com.questrail.network.dispatch.DispatchBridge;
import com.questrail.network.internal.time.MonotonicClock;
import com.questrail.network.internal.time.MonotonicScheduler;
import com.questrail.network.internal.time.ScheduledExecutorScheduler;
import com.questrail.network.internal.time.SystemMonotonicClock;
import com.questrail.network.internal.time.SystemWallClock;
import com.questrail.network.internal.time.WallClock;
import com.questrail.network.observability.NetworkObservabilitySink;
import com.questrail.network.observability.NullObservabilitySink;
import com.questrail.network.transport.TransportBinding;
import com.questrail.network.transport.TransportConnector;
import com.questrail.network.transport.netty.NettyTransportConnector;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * NetworkClient
 * =============================================================================
 * Composition root for the client side: at most one live connection to a
 * server at a time.
 *
 * <p>The application owns the client instance and passes it where it is
 * needed; there is no global accessor.</p>
 *
 * <h2>Reconnecting</h2>
 * A disconnected connection never comes back. Calling {@link #connect} again
 * after a disconnection creates a new connection with a new identifier.
 * Identifiers are never reused within one client.
 *
 * <h2>Main-thread contract</h2>
 * The application calls {@link #pumpEvents()} once per tick; the message and
 * status handlers run only inside that call.
 */
public final class NetworkClient implements AutoCloseable {

    private final TransportConnector connector;
    private final ConnectionContext context;
    private final ConnectionServiceDriver serviceDriver;
    private final ScheduledExecutorService ownedExecutor;

    private final Object connectLock = new Object();
    private long nextId = 1;
    private volatile DefaultNetworkConnection connection;
    private volatile boolean closed;

    private volatile MessageHandler messageHandler;
    private volatile ConnectionStatusHandler statusHandler;

    private NetworkClient(TransportConnector connector,
                          ConnectionContext context,
                          ConnectionServiceDriver serviceDriver,
                          ScheduledExecutorService ownedExecutor)
    {
        this.connector = connector;
        this.context = context;
        this.serviceDriver = serviceDriver;
        this.ownedExecutor = ownedExecutor;
    }

    /**
     * Begin connecting to {@code remote}. Returns immediately; the status
     * handler reports the outcome.
     *
     * @return identifier of the new connection
     * @throws IllegalStateException if a connection is already open or
     *                               connecting, or the client is closed
     */
    public ConnectionId connect(SocketAddress remote) {
        Objects.requireNonNull(remote, "remote");

        DefaultNetworkConnection created;
        synchronized (connectLock) {
            if (closed) {
                throw new IllegalStateException("NetworkClient is closed");
            }
            DefaultNetworkConnection current = connection;
            if (current != null && !current.state().isClosing()) {
                throw new IllegalStateException("Already connected or connecting: " + current.id());
            }

            TransportBinding binding = connector.open(remote);
            created = new DefaultNetworkConnection(ConnectionId.of(nextId++), binding, context);
            created.setMessageHandler(messageHandler);
            created.setStatusHandler(statusHandler);
            connection = created;
        }

        serviceDriver.register(created);
        serviceDriver.start();
        created.open();
        return created.id();
    }

    /**
     * Gracefully close the current connection, if any. Idempotent.
     */
    public void disconnect() {
        DefaultNetworkConnection current = connection;
        if (current != null) {
            current.disconnect();
        }
    }

    public boolean isConnected() {
        DefaultNetworkConnection current = connection;
        return current != null && current.isConnected();
    }

    /**
     * Fire-and-forget send on the current connection. Without a connection the
     * message is dropped.
     */
    public void send(String message, Reliability reliability) {
        DefaultNetworkConnection current = connection;
        if (current != null) {
            current.sendMessage(message, reliability);
        }
    }

    /**
     * Statistics of the current connection, or {@link ConnectionStats#EMPTY}
     * before the first connect.
     */
    public ConnectionStats stats() {
        DefaultNetworkConnection current = connection;
        return current != null ? current.stats() : ConnectionStats.EMPTY;
    }

    /**
     * The current (possibly already disconnected) connection.
     */
    public Optional<NetworkConnection> connection() {
        return Optional.ofNullable(connection);
    }

    /**
     * Deliver pending connection events on the calling thread.
     *
     * @return number of events delivered
     */
    public int pumpEvents() {
        return context.dispatchBridge().pump();
    }

    public void setMessageHandler(MessageHandler handler) {
        this.messageHandler = handler;
        DefaultNetworkConnection current = connection;
        if (current != null) {
            current.setMessageHandler(handler);
        }
    }

    public void setStatusHandler(ConnectionStatusHandler handler) {
        this.statusHandler = handler;
        DefaultNetworkConnection current = connection;
        if (current != null) {
            current.setStatusHandler(handler);
        }
    }

    /**
     * Disconnect, flush once, stop the service thread and release the
     * connector. Pending events stay available to {@link #pumpEvents()}.
     */
    @Override
    public void close() {
        synchronized (connectLock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        disconnect();
        serviceDriver.stop();
        if (ownedExecutor != null) {
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
        serviceDriver.runOnce();
        connector.close();
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
        private TransportConnector connector;
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
         * Use a specific connector instead of the Netty TCP connector built
         * from the configuration.
         */
        public Builder withConnector(TransportConnector connector) {
            this.connector = connector;
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

        public NetworkClient build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");

            NetworkObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            DispatchBridge bridge = new DispatchBridge(sink, wallClock);
            ConnectionContext context = new ConnectionContext(config.queuePolicy(), bridge, sink, clock, wallClock);

            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "network-client-service");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
            }

            ConnectionServiceDriver driver =
                    new ConnectionServiceDriver(effectiveScheduler, clock, config.serviceInterval(), sink);

            TransportConnector effectiveConnector = connector != null ? connector : new NettyTransportConnector(config);

            return new NetworkClient(effectiveConnector, context, driver, ownedExecutor);
        }
    }
}
