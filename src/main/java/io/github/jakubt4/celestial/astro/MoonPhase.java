package io.github.jakubt4.celestial.astro;

/**
 * Named lunar phase. The continuous phase value runs from 0.0 (new moon) through
 * 0.25 (first quarter), 0.5 (full moon) and 0.75 (last quarter) back to 1.0, which
 * is the next new moon.
 */
public enum MoonPhase {
    NEW_MOON,
    WAXING_CRESCENT,
    FIRST_QUARTER,
    WAXING_GIBBOUS,
    FULL_MOON,
    WANING_GIBBOUS,
    LAST_QUARTER,
    WANING_CRESCENT;

    /**
     * Half-width of the window around 0, 0.25, 0.5, 0.75 and 1 that counts as the
     * cardinal phase itself. One millionth of a lunation is about 2.6 seconds.
     */
    public static final double CARDINAL_TOLERANCE = 1e-6;

    /**
     * Classifies a phase value in {@code [0, 1)}. Values within {@link #CARDINAL_TOLERANCE}
     * of a cardinal point (inclusive) map to that point; anything else maps to the
     * intermediate phase of its open interval. Values outside {@code [0, 1)} are
     * reduced modulo 1 first. {@code NaN} has no phase and falls through to
     * {@link #WANING_CRESCENT}, like every other value no interval claims.
     */
    public static MoonPhase fromPhase(final double phase) {
        final var p = phase - Math.floor(phase);

        if (near(p, 0) || near(p, 1)) {
            return NEW_MOON;
        } else if (near(p, 0.25)) {
            return FIRST_QUARTER;
        } else if (near(p, 0.5)) {
            return FULL_MOON;
        } else if (near(p, 0.75)) {
            return LAST_QUARTER;
        } else if (p < 0.25) {
            return WAXING_CRESCENT;
        } else if (p < 0.5) {
            return WAXING_GIBBOUS;
        } else if (p < 0.75) {
            return WANING_GIBBOUS;
        }
        return WANING_CRESCENT;
    }

    private static boolean near(final double value, final double cardinal) {
        return Math.abs(value - cardinal) <= CARDINAL_TOLERANCE;
    }
}
