package com.questrail.network.time;

import com.questrail.network.internal.time.Cancellable;
import com.questrail.network.internal.time.MonotonicClock;
import com.questrail.network.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called. Tasks scheduled
 * by a running task with a deadline already due run in the same call.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     *
     * @return number of tasks run
     */
    public int runDueTasks() {
        int ran = 0;
        while (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
            Scheduled next = queue.poll();
            if (next.ran.compareAndSet(false, true)) {
                next.task.run();
                ran++;
            }
        }
        return ran;
    }

    /**
     * Number of tasks waiting (cancelled ones excluded).
     */
    public long pendingCount() {
        return queue.stream().filter(s -> !s.ran.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long seq;
        private final Runnable task;
        private final AtomicBoolean ran = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long seq, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.seq = seq;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return ran.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int c = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return c != 0 ? c : Long.compare(this.seq, o.seq);
        }
    }
}
