package com.questrail.network.dispatch;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.internal.time.SystemWallClock;
import com.questrail.network.observability.NetworkErrorEvent;
import com.questrail.network.observability.RecordingObservabilitySink;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DispatchBridgeTest {

    private static final ConnectionId A = ConnectionId.of(1);
    private static final ConnectionId B = ConnectionId.of(2);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final DispatchBridge bridge = new DispatchBridge(sink, SystemWallClock.INSTANCE);

    private static ConnectionEvent message(ConnectionId id, String payload) {
        return new ConnectionEvent.MessageReceived(id, Instant.EPOCH, payload);
    }

    private static String payloadOf(ConnectionEvent event) {
        return ((ConnectionEvent.MessageReceived) event).payload();
    }

    @Test
    void pumpWithNothingPendingIsNoOp() {
        assertEquals(0, bridge.pump());
        assertEquals(0, bridge.pump());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void eventsAreDeliveredInPostOrderOnlyWhenPumped() {
        List<String> delivered = new ArrayList<>();

        bridge.post(message(A, "1"), e -> delivered.add(payloadOf(e)));
        bridge.post(message(B, "2"), e -> delivered.add(payloadOf(e)));
        bridge.post(message(A, "3"), e -> delivered.add(payloadOf(e)));

        assertTrue(delivered.isEmpty());
        assertEquals(3, bridge.pendingCount());
        assertEquals(2, bridge.pendingCount(A));

        assertEquals(3, bridge.pump());
        assertEquals(List.of("1", "2", "3"), delivered);
        assertEquals(0, bridge.pendingCount());
        assertEquals(0, bridge.pendingCount(A));
    }

    @Test
    void throwingTargetIsReportedAndPumpContinues() {
        List<String> delivered = new ArrayList<>();

        bridge.post(message(A, "bad"), e -> { throw new IllegalStateException("handler bug"); });
        bridge.post(message(A, "good"), e -> delivered.add(payloadOf(e)));

        assertEquals(2, bridge.pump());
        assertEquals(List.of("good"), delivered);

        List<NetworkErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals(A, errors.get(0).connectionId());
        assertInstanceOf(IllegalStateException.class, errors.get(0).cause());
        assertEquals(0, bridge.pendingCount(A));
    }

    @Test
    void eventsPostedDuringPumpWaitForNextPump() {
        List<String> delivered = new ArrayList<>();

        bridge.post(message(A, "first"), e -> {
            delivered.add(payloadOf(e));
            bridge.post(message(A, "second"), e2 -> delivered.add(payloadOf(e2)));
        });

        assertEquals(1, bridge.pump());
        assertEquals(List.of("first"), delivered);

        assertEquals(1, bridge.pump());
        assertEquals(List.of("first", "second"), delivered);
    }

    @Test
    void whenDrainedRunsImmediatelyWithNothingPending() {
        AtomicInteger runs = new AtomicInteger();
        bridge.whenDrained(A, runs::incrementAndGet);
        assertEquals(1, runs.get());
    }

    @Test
    void whenDrainedRunsAfterLastPendingEventOfThatConnection() {
        List<String> order = new ArrayList<>();

        bridge.post(message(A, "a1"), e -> order.add(payloadOf(e)));
        bridge.post(message(B, "b1"), e -> order.add(payloadOf(e)));
        bridge.post(message(A, "a2"), e -> order.add(payloadOf(e)));
        bridge.whenDrained(A, () -> order.add("drained-A"));

        assertTrue(order.isEmpty());
        bridge.pump();

        assertEquals(List.of("a1", "b1", "a2", "drained-A"), order);
    }

    @Test
    void concurrentProducersKeepPerConnectionOrder() throws InterruptedException {
        int perProducer = 500;
        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        ExecutorService producers = Executors.newFixedThreadPool(2);
        CountDownLatch done = new CountDownLatch(2);

        for (ConnectionId id : List.of(A, B)) {
            producers.execute(() -> {
                for (int i = 0; i < perProducer; i++) {
                    bridge.post(message(id, id.value() + ":" + i), e -> delivered.add(payloadOf(e)));
                }
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        producers.shutdownNow();

        while (bridge.pump() > 0) {
            // drain
        }

        assertEquals(2 * perProducer, delivered.size());
        for (ConnectionId id : List.of(A, B)) {
            String prefix = id.value() + ":";
            int expected = 0;
            for (String s : delivered) {
                if (s.startsWith(prefix)) {
                    assertEquals(prefix + expected, s);
                    expected++;
                }
            }
            assertEquals(perProducer, expected);
        }
    }
}
