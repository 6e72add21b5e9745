package com.questrail.network.core.queue;

import com.questrail.network.api.Reliability;
import com.questrail.network.config.OutboundQueuePolicy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * OutboundQueue
 * =============================================================================
 * Thread-safe, reliability-partitioned queue of pending messages for one
 * connection.
 *
 * <h2>Lanes</h2>
 * <ul>
 *   <li><b>Reliable</b>: strict FIFO, bounded by
 *       {@link OutboundQueuePolicy#reliableCapacity()}. This class never
 *       discards a reliable message once accepted; an offer to a full lane is
 *       rejected instead.</li>
 *   <li><b>Unreliable</b>: bounded by
 *       {@link OutboundQueuePolicy#unreliableCapacity()}. On overflow the
 *       oldest message is discarded (drop-oldest).</li>
 * </ul>
 * Unreliable volume never delays or reorders the reliable lane.
 *
 * <h2>Threading Model</h2>
 * Any thread may {@link #offer}. A single drainer (the service tick) takes
 * messages with {@link #pollReliable()} / {@link #pollUnreliable()} and, if
 * the transport pushes back, puts the message back at the head with
 * {@link #restore(OutboundMessage)}. Messages are removed under the lock
 * before they are sent, so a concurrent drop-oldest can never discard a
 * message that is already in flight.
 */
public final class OutboundQueue {

    private final Object lock = new Object();
    private final Deque<OutboundMessage> reliable = new ArrayDeque<>();
    private final Deque<OutboundMessage> unreliable = new ArrayDeque<>();

    private final int reliableCapacity;
    private final int unreliableCapacity;

    public OutboundQueue(OutboundQueuePolicy policy) {
        Objects.requireNonNull(policy, "policy");
        this.reliableCapacity = policy.reliableCapacity();
        this.unreliableCapacity = policy.unreliableCapacity();
    }

    /**
     * Append a message to its lane.
     */
    public OfferResult offer(OutboundMessage message) {
        Objects.requireNonNull(message, "message");

        synchronized (lock) {
            if (message.reliability() == Reliability.RELIABLE) {
                if (reliable.size() >= reliableCapacity) {
                    return OfferResult.REJECTED_FULL;
                }
                reliable.addLast(message);
                return OfferResult.ACCEPTED;
            }

            boolean displaced = false;
            while (unreliable.size() >= unreliableCapacity) {
                unreliable.pollFirst();
                displaced = true;
            }
            unreliable.addLast(message);
            return displaced ? OfferResult.ACCEPTED_DISPLACED_OLDEST : OfferResult.ACCEPTED;
        }
    }

    /**
     * Remove and return the head of the reliable lane, or {@code null}.
     */
    public OutboundMessage pollReliable() {
        synchronized (lock) {
            return reliable.pollFirst();
        }
    }

    /**
     * Remove and return the head of the unreliable lane, or {@code null}.
     */
    public OutboundMessage pollUnreliable() {
        synchronized (lock) {
            return unreliable.pollFirst();
        }
    }

    /**
     * Put a message the transport could not take back at the head of its lane.
     *
     * <p>A restored reliable message may push the lane one past capacity
     * rather than being lost. A restored unreliable message is discarded if the
     * lane filled up with newer messages in the meantime.</p>
     *
     * @return {@code false} if the message was discarded instead of restored
     */
    public boolean restore(OutboundMessage message) {
        Objects.requireNonNull(message, "message");

        synchronized (lock) {
            if (message.reliability() == Reliability.RELIABLE) {
                reliable.addFirst(message);
                return true;
            }
            if (unreliable.size() >= unreliableCapacity) {
                return false;
            }
            unreliable.addFirst(message);
            return true;
        }
    }

    /**
     * Remove every queued unreliable message.
     *
     * @return number removed
     */
    public int clearUnreliable() {
        synchronized (lock) {
            int n = unreliable.size();
            unreliable.clear();
            return n;
        }
    }

    /**
     * Remove every queued reliable message.
     *
     * @return number removed
     */
    public int clearReliable() {
        synchronized (lock) {
            int n = reliable.size();
            reliable.clear();
            return n;
        }
    }

    public int reliableSize() {
        synchronized (lock) {
            return reliable.size();
        }
    }

    public int unreliableSize() {
        synchronized (lock) {
            return unreliable.size();
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return reliable.isEmpty() && unreliable.isEmpty();
        }
    }
}
