package com.questrail.network.client;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.api.ConnectionStats;
import com.questrail.network.api.Reliability;
import com.questrail.network.config.NetworkRuntimeConfig;
import com.questrail.network.time.DeterministicScheduler;
import com.questrail.network.time.ManualMonotonicClock;
import com.questrail.network.transport.FakeTransportBinding;
import com.questrail.network.transport.FakeTransportConnector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetworkClientTest {

    private static final SocketAddress SERVER = InetSocketAddress.createUnresolved("game.example", 4000);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FakeTransportConnector connector = new FakeTransportConnector();

    private final List<String> log = new ArrayList<>();

    private NetworkClient client;

    @BeforeEach
    void setUp() {
        client = NetworkClient.builder()
                .withConfig(NetworkRuntimeConfig.builder()
                        .withServiceInterval(Duration.ofMillis(10))
                        .build())
                .withConnector(connector)
                .withScheduler(scheduler, clock)
                .build();

        client.setStatusHandler((id, connected) -> log.add("status " + id + " " + connected));
        client.setMessageHandler((id, payload) -> log.add("message " + payload));
    }

    private void tick() {
        clock.advanceMillis(10);
        scheduler.runDueTasks();
    }

    @Test
    void statsAreEmptyBeforeFirstConnect() {
        assertFalse(client.isConnected());
        assertEquals(ConnectionStats.EMPTY, client.stats());
        assertTrue(client.connection().isEmpty());
    }

    @Test
    void connectOpensBindingAndReportsStatusOnPump() {
        ConnectionId id = client.connect(SERVER);

        FakeTransportBinding binding = connector.lastBinding();
        assertEquals(SERVER, connector.opened().get(0).remote());
        assertTrue(binding.isStarted());
        assertFalse(client.isConnected());

        binding.up();
        assertTrue(client.isConnected());
        client.pumpEvents();

        assertEquals(List.of("status " + id + " true"), log);
    }

    @Test
    void connectWhileConnectedOrConnectingIsRejected() {
        client.connect(SERVER);
        assertThrows(IllegalStateException.class, () -> client.connect(SERVER));

        connector.lastBinding().up();
        assertThrows(IllegalStateException.class, () -> client.connect(SERVER));
        assertEquals(1, connector.opened().size());
    }

    @Test
    void sendGoesOutOnNextTick() {
        client.connect(SERVER);
        FakeTransportBinding binding = connector.lastBinding();
        binding.up();

        client.send("move", Reliability.UNRELIABLE);
        client.send("chat", Reliability.RELIABLE);
        tick();

        assertEquals(List.of("chat", "move"), binding.sentPayloads());
        assertEquals(1, client.stats().reliableMessagesSent());
        assertEquals(1, client.stats().unreliableMessagesSent());
    }

    @Test
    void sendWithoutConnectionIsIgnored() {
        assertDoesNotThrow(() -> client.send("nobody", Reliability.RELIABLE));
        assertDoesNotThrow(client::disconnect);
    }

    @Test
    void inboundMessageIsDeliveredOnPump() {
        client.connect(SERVER);
        FakeTransportBinding binding = connector.lastBinding();
        binding.up();
        binding.inject("welcome");

        client.pumpEvents();

        assertTrue(log.contains("message welcome"));
        assertEquals(1, client.stats().messagesReceived());
    }

    @Test
    void reconnectAfterDisconnectUsesNewId() {
        ConnectionId first = client.connect(SERVER);
        connector.lastBinding().up();
        client.disconnect();
        client.disconnect();
        tick();

        assertFalse(client.isConnected());
        assertTrue(connector.lastBinding().isStopped());

        ConnectionId second = client.connect(SERVER);
        assertNotEquals(first, second);
        connector.lastBinding().up();
        client.pumpEvents();

        assertEquals(List.of(
                "status " + first + " true",
                "status " + first + " false",
                "status " + second + " true"), log);
    }

    @Test
    void lostConnectionAllowsReconnect() {
        client.connect(SERVER);
        connector.lastBinding().up();
        connector.lastBinding().down(new IOException("server went away"));

        assertFalse(client.isConnected());
        assertDoesNotThrow(() -> client.connect(SERVER));
        assertEquals(2, connector.opened().size());
    }

    @Test
    void closeDisconnectsFlushesAndReleasesConnector() {
        client.connect(SERVER);
        FakeTransportBinding binding = connector.lastBinding();
        binding.up();
        client.send("goodbye", Reliability.RELIABLE);

        client.close();
        client.close();

        assertEquals(List.of("goodbye"), binding.sentPayloads());
        assertTrue(binding.isStopped());
        assertTrue(connector.isClosed());
        assertThrows(IllegalStateException.class, () -> client.connect(SERVER));

        client.pumpEvents();
        assertEquals("status conn#1 false", log.get(log.size() - 1));
    }
}
