package com.questrail.seabird.radio.supervisor;

import java.time.Duration;
import java.util.Objects;

/**
 * SupervisorTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for connection supervision.
 *
 * <ul>
 *   <li><b>handshakeTimeout</b>: how long a connect attempt waits for the
 *       core's welcome before it counts as a transport failure</li>
 *   <li><b>backoff</b>: spacing between failed connect attempts</li>
 *   <li><b>heartbeatInterval</b>: quiet time after which a keep-alive is sent</li>
 *   <li><b>livenessThreshold</b>: time without any frame from the core after which the session is
 *       presumed dead (half-open connection) and replaced</li>
 *   <li><b>livenessCheckInterval</b>: how often the two rules above are
 *       evaluated</li>
 * </ul>
 */
public record SupervisorTimingPolicy(
        Duration handshakeTimeout,
        BackoffPolicy backoff,
        Duration heartbeatInterval,
        Duration livenessThreshold,
        Duration livenessCheckInterval
) {
    public SupervisorTimingPolicy {
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(livenessThreshold, "livenessThreshold");
        Objects.requireNonNull(livenessCheckInterval, "livenessCheckInterval");

        if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
            throw new IllegalArgumentException("handshakeTimeout must be positive");
        }
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (livenessThreshold.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("livenessThreshold must exceed heartbeatInterval");
        }
        if (livenessCheckInterval.isNegative() || livenessCheckInterval.isZero()) {
            throw new IllegalArgumentException("livenessCheckInterval must be positive");
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>handshakeTimeout: 10s</li>
     *   <li>backoff: 500ms base, 60s cap</li>
     *   <li>heartbeatInterval: 30s</li>
     *   <li>livenessThreshold: 90s</li>
     *   <li>livenessCheckInterval: 5s</li>
     * </ul>
     */
    public static SupervisorTimingPolicy defaults() {
        return new SupervisorTimingPolicy(
                Duration.ofSeconds(10),
                new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(60)),
                Duration.ofSeconds(30),
                Duration.ofSeconds(90),
                Duration.ofSeconds(5)
        );
    }
}
