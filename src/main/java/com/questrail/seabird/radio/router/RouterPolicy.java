package com.questrail.seabird.radio.router;

import java.time.Duration;
import java.util.Objects;

/**
 * Dispatch limits for the {@link CommandRouter}.
 *
 * @param maxInFlight    commands allowed to run at once; the inbound pump
 *                       blocks when all permits are taken
 * @param commandTimeout time after which a command is answered with TIMEOUT
 *                       regardless of its handler
 */
public record RouterPolicy(int maxInFlight, Duration commandTimeout) {

    public RouterPolicy {
        Objects.requireNonNull(commandTimeout, "commandTimeout");

        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be > 0");
        }
        if (commandTimeout.isNegative() || commandTimeout.isZero()) {
            throw new IllegalArgumentException("commandTimeout must be positive");
        }
    }

    public static RouterPolicy defaults() {
        return new RouterPolicy(16, Duration.ofSeconds(10));
    }
}
