package com.questrail.network.core;

import com.questrail.network.internal.time.Cancellable;
import com.questrail.network.internal.time.MonotonicClock;
import com.questrail.network.internal.time.MonotonicScheduler;
import com.questrail.network.internal.time.SystemWallClock;
import com.questrail.network.observability.NetworkErrorEvent;
import com.questrail.network.observability.NetworkObservabilitySink;
import com.questrail.network.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ConnectionServiceDriver
 * =============================================================================
 * Background tick that moves queued outbound messages into the transport.
 *
 * <h2>Threading Model</h2>
 * Every tick runs on the scheduler's thread and calls
 * {@link DefaultNetworkConnection#service()} on each registered connection in
 * turn. Ticks never overlap: the next one is scheduled only when the current
 * one has finished.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.register(connection)  → connection is serviced from the next tick
 *   driver.start()               → first tick after one interval
 *   driver.stop()                → cancels the pending tick
 * </pre>
 * Connections that are {@code DISCONNECTED} with an empty queue are dropped
 * from the driver automatically.
 *
 * <h2>Failure isolation</h2>
 * A connection whose tick throws is reported to the observability sink; the
 * remaining connections are still serviced.
 */
public final class ConnectionServiceDriver {

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final NetworkObservabilitySink observabilitySink;

    private final List<DefaultNetworkConnection> connections = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Cancellable nextTick;

    public ConnectionServiceDriver(MonotonicScheduler scheduler,
                                   MonotonicClock clock,
                                   Duration interval,
                                   NetworkObservabilitySink observabilitySink)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public void register(DefaultNetworkConnection connection) {
        Objects.requireNonNull(connection, "connection");
        if (!connections.contains(connection)) {
            connections.add(connection);
        }
    }

    public void unregister(DefaultNetworkConnection connection) {
        connections.remove(connection);
    }

    public int connectionCount() {
        return connections.size();
    }

    /**
     * Starts ticking. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduleNext();
        }
    }

    /**
     * Stops ticking. A tick already in progress completes. Idempotent.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Cancellable pending = nextTick;
            if (pending != null) {
                pending.cancel();
                nextTick = null;
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Service every registered connection once, on the calling thread.
     */
    public void runOnce() {
        for (DefaultNetworkConnection connection : connections) {
            try {
                connection.service();
            } catch (Exception e) {
                observabilitySink.onError(new NetworkErrorEvent(
                        SystemWallClock.INSTANCE.now(),
                        connection.id(),
                        "Service tick failed",
                        e
                ));
            }

            if (connection.state() == ConnectionState.DISCONNECTED && !connection.hasQueuedMessages()) {
                connections.remove(connection);
            }
        }
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        try {
            runOnce();
        } finally {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (running.get()) {
            nextTick = scheduler.scheduleAfter(interval, clock, this::tick);
        }
    }
}
