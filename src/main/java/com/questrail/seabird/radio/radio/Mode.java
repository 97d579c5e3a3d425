package com.questrail.seabird.radio.radio;

import java.util.Locale;
import java.util.Optional;

/**
 * Operating modes reported on POTA spots.
 */
public enum Mode {
    FT4,
    FT8,
    SSB,
    USB,
    LSB,
    CW,
    FM,
    RTTY,
    C4FM,
    PSK31,
    DSTAR,
    /** Spot without a usable mode. Never accepted from users. */
    UNKNOWN;

    /**
     * Parse a user-supplied mode, case-insensitively.
     */
    public static Optional<Mode> parse(String text) {
        String wanted = text.trim().toUpperCase(Locale.ROOT);
        for (Mode mode : values()) {
            if (mode != UNKNOWN && mode.name().equals(wanted)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    /**
     * Map an upstream mode string. Empty and unrecognized values become
     * {@link #UNKNOWN} so that one odd spot does not spoil the whole list.
     */
    public static Mode fromUpstream(String text) {
        if (text == null) {
            return UNKNOWN;
        }
        return parse(text).orElse(UNKNOWN);
    }

    @Override
    public String toString() {
        return this == UNKNOWN ? "unknown" : name();
    }
}
