package com.questrail.seabird.radio.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision in the plugin.
 *
 * <h2>Binding invariant</h2>
 * Backoff spacing, session liveness, cache expiry, token-bucket refill and
 * command timeouts MUST be measured on this clock. Wall-clock time is only
 * used for timestamps that leave the process (see {@link WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Values are only meaningful relative to each other.
     */
    long nowNanos();
}
