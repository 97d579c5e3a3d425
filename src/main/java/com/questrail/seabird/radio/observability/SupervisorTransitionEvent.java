package com.questrail.seabird.radio.observability;

import com.questrail.seabird.radio.supervisor.SupervisorState;

import java.time.Duration;
import java.time.Instant;

/**
 * Record of one reconnection supervisor state change.
 *
 * @param attempt      failed connect attempts since the last LIVE transition
 * @param backoffDelay delay before the next connect attempt; {@link Duration#ZERO}
 *                     unless {@code newState} is BACKOFF
 * @param cause        failure that caused the transition; {@code null} for
 *                     successful or requested transitions
 */
public record SupervisorTransitionEvent(
    Instant timestamp,
    SupervisorState oldState,
    SupervisorState newState,
    int attempt,
    Duration backoffDelay,
    Throwable cause
) {
}
