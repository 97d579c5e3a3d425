package com.questrail.seabird.radio.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task scheduled on a {@link MonotonicScheduler}.
 *
 * <p>Backoff retries, liveness ticks, rate-limit re-checks and per-command
 * timeouts all hand one of these back to their owner so the owner can disarm
 * the timer when the condition it guards resolves first.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled earlier
     */
    boolean cancel();
}
