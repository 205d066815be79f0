package com.questrail.interactions.internal.time;

/**
 * Cancellation handle for a task handed to a {@link MonotonicScheduler}.
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
