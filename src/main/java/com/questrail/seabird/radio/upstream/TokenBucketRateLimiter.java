package com.questrail.seabird.radio.upstream;

import com.questrail.seabird.radio.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * TokenBucketRateLimiter
 * -----------------------------------------------------------------------------
 * Classic token bucket on the monotonic clock. Holds at most {@code capacity}
 * tokens and gains one every {@code refillPeriod}. Starts full.
 *
 * <p>Callers never block here: {@link #tryAcquire()} either takes a token or
 * says how long until the next one, and the caller schedules its re-check.</p>
 */
public final class TokenBucketRateLimiter {

    private final int capacity;
    private final long refillPeriodNanos;
    private final MonotonicClock clock;

    // Guarded by this.
    private long tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int capacity, Duration refillPeriod, MonotonicClock clock) {
        Objects.requireNonNull(refillPeriod, "refillPeriod");
        this.clock = Objects.requireNonNull(clock, "clock");

        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (refillPeriod.isNegative() || refillPeriod.isZero()) {
            throw new IllegalArgumentException("refillPeriod must be positive");
        }

        this.capacity = capacity;
        this.refillPeriodNanos = refillPeriod.toNanos();
        this.tokens = capacity;
        this.lastRefillNanos = clock.nowNanos();
    }

    /**
     * @return {@code 0} if a token was taken, otherwise the nanoseconds until
     *         one becomes available
     */
    public synchronized long tryAcquire() {
        refill();
        if (tokens > 0) {
            tokens--;
            return 0;
        }
        return Math.max(1, lastRefillNanos + refillPeriodNanos - clock.nowNanos());
    }

    public synchronized long availableTokens() {
        refill();
        return tokens;
    }

    // Caller holds the monitor.
    private void refill() {
        long now = clock.nowNanos();
        long periods = (now - lastRefillNanos) / refillPeriodNanos;
        if (periods <= 0) {
            return;
        }
        if (tokens + periods >= capacity) {
            tokens = capacity;
            lastRefillNanos = now;
        } else {
            tokens += periods;
            lastRefillNanos += periods * refillPeriodNanos;
        }
    }
}
