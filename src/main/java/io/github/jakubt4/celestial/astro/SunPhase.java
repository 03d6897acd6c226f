package io.github.jakubt4.celestial.astro;

/**
 * Twilight band of the Sun, ordered from darkest to brightest.
 */
public enum SunPhase {
    NIGHT,
    ASTRONOMICAL_TWILIGHT,
    NAUTICAL_TWILIGHT,
    CIVIL_TWILIGHT,
    DAY;

    /**
     * Classifies a solar altitude. Thresholds are strict, so an altitude lying exactly
     * on a band edge (0, -6, -12 or -18 degrees) belongs to the darker band.
     */
    public static SunPhase fromAltitude(final double altitudeDegrees) {
        if (altitudeDegrees > 0) {
            return DAY;
        } else if (altitudeDegrees > -6) {
            return CIVIL_TWILIGHT;
        } else if (altitudeDegrees > -12) {
            return NAUTICAL_TWILIGHT;
        } else if (altitudeDegrees > -18) {
            return ASTRONOMICAL_TWILIGHT;
        }
        return NIGHT;
    }
}
