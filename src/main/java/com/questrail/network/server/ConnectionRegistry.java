package com.questrail.network.server;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.core.ConnectionContext;
import com.questrail.network.core.ConnectionLifecycleListener;
import com.questrail.network.core.ConnectionState;
import com.questrail.network.core.DefaultNetworkConnection;
import com.questrail.network.transport.TransportBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ConnectionRegistry
 * =============================================================================
 * Server-side map from {@link ConnectionId} to connection.
 *
 * <h2>Identifier minting</h2>
 * Identifiers are minted sequentially from 1, wrap at 2^32 - 1 back to 1 and
 * skip any identifier still present in the registry. {@code 0} is never
 * minted.
 *
 * <h2>Deferred removal</h2>
 * A connection leaves the registry only once it is {@code DISCONNECTED}
 * <em>and</em> the dispatch bridge has delivered every event it posted. Until
 * then its identifier stays reserved, so a stale event is never delivered
 * under an identifier that already belongs to a new client.
 *
 * <h2>Thread Safety</h2>
 * Lookups are lock-free. Minting and insertion happen under one lock.
 */
public final class ConnectionRegistry {

    private final ConnectionContext context;
    private final ConnectionLifecycleListener lifecycleListener;

    private final ConcurrentMap<ConnectionId, DefaultNetworkConnection> connections = new ConcurrentHashMap<>();
    private final Set<ConnectionId> removalScheduled = ConcurrentHashMap.newKeySet();

    private final Object mintLock = new Object();
    private long nextId = 1;

    /**
     * @param lifecycleListener notified of every transition of every
     *                          registered connection, before the registry
     *                          reacts to it; may be {@code null}
     */
    public ConnectionRegistry(ConnectionContext context, ConnectionLifecycleListener lifecycleListener) {
        this.context = Objects.requireNonNull(context, "context");
        this.lifecycleListener = Objects.requireNonNullElse(lifecycleListener, ConnectionLifecycleListener.NONE);
    }

    public ConnectionRegistry(ConnectionContext context) {
        this(context, ConnectionLifecycleListener.NONE);
    }

    /**
     * Create and register a connection for an accepted binding. The binding is
     * not started; call {@link DefaultNetworkConnection#open()} once handlers
     * are in place.
     *
     * @throws IllegalStateException if every identifier is in use
     */
    public DefaultNetworkConnection accept(TransportBinding binding) {
        Objects.requireNonNull(binding, "binding");

        synchronized (mintLock) {
            ConnectionId id = mintId();
            DefaultNetworkConnection connection =
                    new DefaultNetworkConnection(id, binding, context, this::onStateChanged);
            connections.put(id, connection);
            return connection;
        }
    }

    public Optional<DefaultNetworkConnection> get(ConnectionId id) {
        return Optional.ofNullable(connections.get(id));
    }

    public boolean contains(ConnectionId id) {
        return connections.containsKey(id);
    }

    /**
     * Disconnect a connection (if it is not already closing) and remove it
     * once it is fully disconnected and drained.
     *
     * @return {@code false} if the identifier is not registered
     */
    public boolean remove(ConnectionId id) {
        DefaultNetworkConnection connection = connections.get(id);
        if (connection == null) {
            return false;
        }

        connection.disconnect();
        if (connection.state() == ConnectionState.DISCONNECTED) {
            scheduleRemoval(id);
        }
        return true;
    }

    /**
     * Request a graceful close of every registered connection.
     */
    public void disconnectAll() {
        for (DefaultNetworkConnection connection : connections.values()) {
            connection.disconnect();
        }
    }

    public int size() {
        return connections.size();
    }

    /**
     * Snapshot of the registered identifiers, in ascending order.
     */
    public List<ConnectionId> ids() {
        List<ConnectionId> ids = new ArrayList<>(connections.keySet());
        Collections.sort(ids);
        return ids;
    }

    /**
     * Snapshot of the registered connections.
     */
    public List<DefaultNetworkConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    private void onStateChanged(DefaultNetworkConnection connection,
                                ConnectionState oldState,
                                ConnectionState newState)
    {
        lifecycleListener.onStateChanged(connection, oldState, newState);

        if (newState == ConnectionState.DISCONNECTED) {
            scheduleRemoval(connection.id());
        }
    }

    private void scheduleRemoval(ConnectionId id) {
        if (removalScheduled.add(id)) {
            context.dispatchBridge().whenDrained(id, () -> {
                connections.remove(id);
                removalScheduled.remove(id);
            });
        }
    }

    private ConnectionId mintId() {
        for (long attempts = 0; attempts < ConnectionId.MAX_VALUE; attempts++) {
            long candidate = nextId;
            nextId = candidate == ConnectionId.MAX_VALUE ? 1 : candidate + 1;

            ConnectionId id = ConnectionId.of(candidate);
            if (!connections.containsKey(id)) {
                return id;
            }
        }
        throw new IllegalStateException("No free connection identifiers");
    }
}
