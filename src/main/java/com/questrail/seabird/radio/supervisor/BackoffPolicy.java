package com.questrail.seabird.radio.supervisor;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * BackoffPolicy
 * -----------------------------------------------------------------------------
 * Exponential reconnect spacing with additive jitter:
 *
 * <pre>
 *   delay  = min(cap, base * 2^attempt)
 *   result = delay + jitter,  jitter uniform in [0, delay / 4]
 * </pre>
 *
 * <p>The result is therefore never more than {@code cap * 1.25}.</p>
 */
public record BackoffPolicy(Duration base, Duration cap) {

    public BackoffPolicy {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(cap, "cap");

        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must be >= base");
        }
    }

    /**
     * @param attempt zero-based attempt number
     * @param jitter  source of uniform values in {@code [0, 1)}
     */
    public Duration delayFor(int attempt, DoubleSupplier jitter) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        Objects.requireNonNull(jitter, "jitter");

        long baseNanos = base.toNanos();
        long capNanos = cap.toNanos();

        long delayNanos;
        if (attempt >= Long.SIZE - 2 || baseNanos > (capNanos >> attempt)) {
            delayNanos = capNanos;
        } else {
            delayNanos = Math.min(capNanos, baseNanos << attempt);
        }

        double fraction = Math.min(Math.max(jitter.getAsDouble(), 0.0), 1.0);
        long jitterNanos = (long) ((delayNanos / 4) * fraction);
        return Duration.ofNanos(delayNanos + jitterNanos);
    }
}
