package com.questrail.seabird.radio.radio;

import java.util.Locale;
import java.util.Optional;

/**
 * Amateur bands accepted by the {@code pota} command, with their inclusive
 * frequency limits.
 */
public enum Band {
    B160M("160m", 1_800_000, 2_000_000),
    B80M("80m", 3_500_000, 4_000_000),
    B60M("60m", 5_330_500, 5_406_400),
    B40M("40m", 7_000_000, 7_300_000),
    B30M("30m", 10_100_000, 10_150_000),
    B20M("20m", 14_000_000, 14_350_000),
    B17M("17m", 18_068_000, 18_168_000),
    B15M("15m", 21_000_000, 21_450_000),
    B12M("12m", 24_890_000, 24_990_000),
    B10M("10m", 28_000_000, 29_700_000),
    B6M("6m", 50_000_000, 54_000_000),
    B2M("2m", 144_000_000, 148_000_000);

    private final String label;
    private final long lowHertz;
    private final long highHertz;

    Band(String label, long lowHertz, long highHertz) {
        this.label = label;
        this.lowHertz = lowHertz;
        this.highHertz = highHertz;
    }

    public String label() {
        return label;
    }

    public boolean contains(Frequency frequency) {
        return frequency.hertz() >= lowHertz && frequency.hertz() <= highHertz;
    }

    /**
     * Case-insensitive lookup by label, e.g. {@code "20M"}.
     */
    public static Optional<Band> parse(String text) {
        String wanted = text.trim().toLowerCase(Locale.ROOT);
        for (Band band : values()) {
            if (band.label.equals(wanted)) {
                return Optional.of(band);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
