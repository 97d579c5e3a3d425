package com.questrail.seabird.radio.radio;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Validated HamQSL solar report: when it was updated and the day/night
 * conditions per band group, ordered by group name.
 */
public record SolarReport(String updated, SortedMap<String, BandCondition> bands) {
    public SolarReport {
        Objects.requireNonNull(updated, "updated");
        bands = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(bands, "bands")));
    }
}
