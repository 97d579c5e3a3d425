package com.questrail.seabird.radio.radio;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One Parks on the Air spot.
 */
public record Activation(
        String activator,
        String parkName,
        String locationDesc,
        Mode mode,
        Frequency frequency,
        Instant spotTime
) {
    public Activation {
        Objects.requireNonNull(activator, "activator");
        Objects.requireNonNull(parkName, "parkName");
        Objects.requireNonNull(locationDesc, "locationDesc");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(spotTime, "spotTime");
    }

    /**
     * Time between the spot and {@code now}, never negative.
     */
    public Duration ageAt(Instant now) {
        return Duration.between(spotTime, now).abs();
    }

    public boolean matches(Band band, Mode wantedMode) {
        return mode == wantedMode && band.contains(frequency);
    }
}
