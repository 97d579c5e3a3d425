package com.questrail.seabird.radio.radio;

/**
 * A radio frequency in whole hertz.
 *
 * <p>Rendered as {@code <MHz>.<kHz>} with the kHz part zero-padded to three
 * digits, plus a {@code .5} suffix when the remainder is exactly 500 Hz:
 * 14 074 000 Hz renders as {@code 14.074}, 7 185 500 Hz as {@code 7.185.5}.</p>
 */
public record Frequency(long hertz) implements Comparable<Frequency> {

    public Frequency {
        if (hertz < 0) {
            throw new IllegalArgumentException("hertz must be >= 0");
        }
    }

    /**
     * Parse a decimal kilohertz value such as {@code "14074.5"}; sub-hertz
     * precision is truncated.
     *
     * @throws NumberFormatException if the text is not a non-negative number
     */
    public static Frequency parseKilohertz(String kilohertz) {
        double value = Double.parseDouble(kilohertz.trim());
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new NumberFormatException("not a frequency: " + kilohertz);
        }
        return new Frequency((long) Math.floor(value * 1_000.0));
    }

    public long megahertzPart() {
        return hertz / 1_000_000;
    }

    @Override
    public int compareTo(Frequency other) {
        return Long.compare(hertz, other.hertz);
    }

    @Override
    public String toString() {
        long khz = (hertz % 1_000_000) / 1_000;
        long hz = hertz % 1_000;
        return String.format("%d.%03d%s", megahertzPart(), khz, hz == 500 ? ".5" : "");
    }
}
