package com.questrail.seabird.radio.supervisor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(60));

    @Test
    void delayDoublesPerAttemptWithoutJitter() {
        assertEquals(Duration.ofMillis(500), policy.delayFor(0, () -> 0.0));
        assertEquals(Duration.ofMillis(1000), policy.delayFor(1, () -> 0.0));
        assertEquals(Duration.ofMillis(2000), policy.delayFor(2, () -> 0.0));
        assertEquals(Duration.ofMillis(32000), policy.delayFor(6, () -> 0.0));
    }

    @Test
    void delayIsCapped() {
        assertEquals(Duration.ofSeconds(60), policy.delayFor(7, () -> 0.0));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(40, () -> 0.0));
    }

    @Test
    void hugeAttemptCountsDoNotOverflow() {
        assertEquals(Duration.ofSeconds(60), policy.delayFor(Integer.MAX_VALUE, () -> 0.0));
    }

    @Test
    void jitterAddsAtMostAQuarter() {
        Duration max = policy.delayFor(1, () -> 1.0);
        assertEquals(Duration.ofMillis(1250), max);

        Duration capped = policy.delayFor(30, () -> 1.0);
        assertEquals(Duration.ofSeconds(75), capped);
    }

    @Test
    void outOfRangeJitterIsClamped() {
        assertEquals(Duration.ofMillis(500), policy.delayFor(0, () -> -3.0));
        assertEquals(Duration.ofMillis(625), policy.delayFor(0, () -> 7.0));
    }

    @Test
    void rejectsNegativeAttempt() {
        assertThrows(IllegalArgumentException.class, () -> policy.delayFor(-1, () -> 0.0));
    }

    @Test
    void rejectsCapBelowBase() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }

    @Test
    void rejectsZeroBase() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1)));
    }
}
