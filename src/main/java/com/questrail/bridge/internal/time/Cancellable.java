package com.questrail.bridge.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a task registered with a {@link MonotonicScheduler}.
 *
 * <p>The reconnect loop holds exactly one of these at a time: the handle of its
 * next pending attempt. Cancelling it is how the loop is stopped mid-cooldown.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran, is running, or was cancelled before.
     */
    boolean cancel();
}
