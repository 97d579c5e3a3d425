package com.questrail.seabird.radio.radio;

import java.util.Objects;

/**
 * Propagation forecast for one band group, e.g. {@code Good} by day and
 * {@code Fair} by night.
 */
public record BandCondition(String day, String night) {
    public BandCondition {
        Objects.requireNonNull(day, "day");
        Objects.requireNonNull(night, "night");
    }
}
