package com.questrail.network.server;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.config.OutboundQueuePolicy;
import com.questrail.network.core.ConnectionContext;
import com.questrail.network.core.ConnectionState;
import com.questrail.network.core.DefaultNetworkConnection;
import com.questrail.network.dispatch.DispatchBridge;
import com.questrail.network.transport.FakeTransportBinding;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRegistryTest {

    private final DispatchBridge bridge = new DispatchBridge();
    private final ConnectionContext context = ConnectionContext.of(OutboundQueuePolicy.defaults(), bridge);

    @Test
    void twoAcceptsGetDistinctNonZeroIdsAndRemovingOneKeepsTheOther() {
        ConnectionRegistry registry = new ConnectionRegistry(context);

        DefaultNetworkConnection first = registry.accept(new FakeTransportBinding(true));
        DefaultNetworkConnection second = registry.accept(new FakeTransportBinding(true));

        assertTrue(first.id().isValid());
        assertTrue(second.id().isValid());
        assertNotEquals(first.id(), second.id());
        assertEquals(List.of(first.id(), second.id()), registry.ids());

        assertTrue(registry.remove(first.id()));
        first.service();
        bridge.pump();

        assertFalse(registry.contains(first.id()));
        assertSame(second, registry.get(second.id()).orElseThrow());
        assertEquals(1, registry.size());
    }

    @Test
    void idsAreMintedSequentiallyFromOneAndNeverZero() {
        ConnectionRegistry registry = new ConnectionRegistry(context);

        assertEquals(ConnectionId.of(1), registry.accept(new FakeTransportBinding()).id());
        assertEquals(ConnectionId.of(2), registry.accept(new FakeTransportBinding()).id());
        assertEquals(ConnectionId.of(3), registry.accept(new FakeTransportBinding()).id());
    }

    @Test
    void disconnectedConnectionStaysRegisteredUntilItsEventsAreDelivered() {
        ConnectionRegistry registry = new ConnectionRegistry(context);
        FakeTransportBinding binding = new FakeTransportBinding();
        DefaultNetworkConnection connection = registry.accept(binding);
        connection.open();
        binding.up();

        binding.down(null);
        assertEquals(ConnectionState.DISCONNECTED, connection.state());
        assertTrue(registry.contains(connection.id()), "events for the id are still pending");

        bridge.pump();
        assertFalse(registry.contains(connection.id()));
    }

    @Test
    void removingAnAlreadyDisconnectedConnectionWithNoEventsRemovesItImmediately() {
        ConnectionRegistry registry = new ConnectionRegistry(context);
        FakeTransportBinding binding = new FakeTransportBinding();
        DefaultNetworkConnection connection = registry.accept(binding);
        connection.open();
        binding.down(null);
        bridge.pump();

        assertFalse(registry.contains(connection.id()));
        assertFalse(registry.remove(connection.id()));
    }

    @Test
    void removeUnknownIdReturnsFalse() {
        ConnectionRegistry registry = new ConnectionRegistry(context);
        assertFalse(registry.remove(ConnectionId.of(42)));
        assertTrue(registry.get(ConnectionId.of(42)).isEmpty());
    }

    @Test
    void disconnectAllRequestsCloseOfEveryConnection() {
        ConnectionRegistry registry = new ConnectionRegistry(context);
        DefaultNetworkConnection a = registry.accept(new FakeTransportBinding(true));
        DefaultNetworkConnection b = registry.accept(new FakeTransportBinding(true));
        a.open();
        b.open();

        registry.disconnectAll();

        assertEquals(ConnectionState.DISCONNECTING, a.state());
        assertEquals(ConnectionState.DISCONNECTING, b.state());
    }

    @Test
    void lifecycleListenerSeesEveryTransition() {
        List<String> seen = new ArrayList<>();
        ConnectionRegistry registry = new ConnectionRegistry(context,
                (connection, from, to) -> seen.add(connection.id() + ":" + from + "->" + to));

        FakeTransportBinding binding = new FakeTransportBinding(true);
        DefaultNetworkConnection connection = registry.accept(binding);
        connection.open();
        connection.disconnect();
        connection.service();

        assertEquals(List.of(
                "conn#1:INITIAL->CONNECTED",
                "conn#1:CONNECTED->DISCONNECTING",
                "conn#1:DISCONNECTING->DISCONNECTED"), seen);
    }
}
