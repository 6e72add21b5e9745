package com.questrail.network.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a task handed to a {@link MonotonicScheduler}.
 *
 * <p>The service driver holds one of these for its next tick and cancels it
 * on {@code stop()}.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
