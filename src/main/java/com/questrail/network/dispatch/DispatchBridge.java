package com.questrail.network.dispatch;

import com.questrail.network.api.ConnectionId;
import com.questrail.network.internal.time.SystemWallClock;
import com.questrail.network.internal.time.WallClock;
import com.questrail.network.observability.NetworkErrorEvent;
import com.questrail.network.observability.NetworkObservabilitySink;
import com.questrail.network.observability.NullObservabilitySink;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * DispatchBridge
 * =============================================================================
 * Moves connection events from transport threads to the application's main
 * thread.
 *
 * <h2>Execution model</h2>
 * <pre>
 *   transport thread(s) ──post()──▶ FIFO ──pump()──▶ target.deliver() on the pump thread
 * </pre>
 * <ul>
 *   <li>{@link #post} may be called from any thread and never blocks.</li>
 *   <li>{@link #pump()} is called once per application tick. It delivers the
 *       events that were queued when it started, synchronously and in
 *       production order, and returns immediately when nothing is pending.</li>
 *   <li>Events of one connection are delivered in the order they were posted.
 *       No order is promised across connections.</li>
 * </ul>
 *
 * <h2>Failure isolation</h2>
 * A target that throws is reported to the observability sink and the pump
 * moves on to the next event. The queue and the pending counts are updated
 * before the next delivery either way.
 *
 * <h2>Drain notification</h2>
 * The bridge counts undelivered events per connection.
 * {@link #whenDrained(ConnectionId, Runnable)} runs an action once a
 * connection has nothing left in flight; the server registry uses it to keep
 * an identifier reserved until stale events for it have been delivered.
 */
public final class DispatchBridge {

    private final BlockingQueue<Pending> queue = new LinkedBlockingQueue<>();

    private final Object countLock = new Object();
    private final Map<ConnectionId, Integer> pendingCounts = new HashMap<>();
    private final Map<ConnectionId, List<Runnable>> drainActions = new HashMap<>();

    private final NetworkObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public DispatchBridge() {
        this(NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public DispatchBridge(NetworkObservabilitySink observabilitySink, WallClock wallClock) {
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Queue an event for delivery to {@code target} on the next pump.
     */
    public void post(ConnectionEvent event, ConnectionEventTarget target) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(target, "target");

        synchronized (countLock) {
            pendingCounts.merge(event.connectionId(), 1, Integer::sum);
            queue.add(new Pending(event, target));
        }
    }

    /**
     * Deliver every event queued before this call.
     *
     * <p>Events posted by targets during this pump are left for the next one,
     * so a handler that keeps producing events cannot starve the caller.</p>
     *
     * @return number of events delivered (including those whose target failed)
     */
    public int pump() {
        if (queue.isEmpty()) {
            return 0;
        }

        List<Pending> batch = new ArrayList<>();
        queue.drainTo(batch);

        for (Pending pending : batch) {
            try {
                pending.target().deliver(pending.event());
            } catch (Exception e) {
                observabilitySink.onError(new NetworkErrorEvent(
                        wallClock.now(),
                        pending.event().connectionId(),
                        "Handler failed while dispatching " + pending.event().getClass().getSimpleName(),
                        e
                ));
            } finally {
                complete(pending.event().connectionId());
            }
        }
        return batch.size();
    }

    /**
     * Run {@code action} once {@code connectionId} has no undelivered events.
     *
     * <p>If nothing is pending the action runs immediately on the calling
     * thread; otherwise it runs on the pump thread right after the last
     * pending event of that connection.</p>
     */
    public void whenDrained(ConnectionId connectionId, Runnable action) {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(action, "action");

        synchronized (countLock) {
            if (pendingCounts.containsKey(connectionId)) {
                drainActions.computeIfAbsent(connectionId, id -> new ArrayList<>()).add(action);
                return;
            }
        }
        runDrainAction(connectionId, action);
    }

    /**
     * Number of undelivered events of one connection.
     */
    public int pendingCount(ConnectionId connectionId) {
        synchronized (countLock) {
            return pendingCounts.getOrDefault(connectionId, 0);
        }
    }

    /**
     * Number of undelivered events across all connections.
     */
    public int pendingCount() {
        return queue.size();
    }

    private void complete(ConnectionId connectionId) {
        List<Runnable> actions = null;

        synchronized (countLock) {
            int remaining = pendingCounts.getOrDefault(connectionId, 1) - 1;
            if (remaining <= 0) {
                pendingCounts.remove(connectionId);
                actions = drainActions.remove(connectionId);
            } else {
                pendingCounts.put(connectionId, remaining);
            }
        }

        if (actions != null) {
            for (Runnable action : actions) {
                runDrainAction(connectionId, action);
            }
        }
    }

    private void runDrainAction(ConnectionId connectionId, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            observabilitySink.onError(new NetworkErrorEvent(
                    wallClock.now(),
                    connectionId,
                    "Drain action failed",
                    e
            ));
        }
    }

    private record Pending(ConnectionEvent event, ConnectionEventTarget target) {}
}
