package com.questrail.seabird.radio.supervisor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SupervisorTimingPolicyTest
 * -----------------------------------------------------------------------------
 * Validates defaults and the constructor's range checks.
 */
class SupervisorTimingPolicyTest {

    private static final BackoffPolicy BACKOFF = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(60));

    @Test
    void defaultsMatchDocumentedValues() {
        SupervisorTimingPolicy policy = SupervisorTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(10), policy.handshakeTimeout());
        assertEquals(BACKOFF, policy.backoff());
        assertEquals(Duration.ofSeconds(30), policy.heartbeatInterval());
        assertEquals(Duration.ofSeconds(90), policy.livenessThreshold());
        assertEquals(Duration.ofSeconds(5), policy.livenessCheckInterval());
    }

    @Test
    void livenessThresholdMustExceedHeartbeatInterval() {
        assertThrows(IllegalArgumentException.class, () -> new SupervisorTimingPolicy(
                Duration.ofSeconds(10), BACKOFF, Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofSeconds(5)));
    }

    @Test
    void rejectsZeroHandshakeTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new SupervisorTimingPolicy(
                Duration.ZERO, BACKOFF, Duration.ofSeconds(30), Duration.ofSeconds(90), Duration.ofSeconds(5)));
    }

    @Test
    void rejectsNullBackoff() {
        assertThrows(NullPointerException.class, () -> new SupervisorTimingPolicy(
                Duration.ofSeconds(10), null, Duration.ofSeconds(30), Duration.ofSeconds(90), Duration.ofSeconds(5)));
    }
}
