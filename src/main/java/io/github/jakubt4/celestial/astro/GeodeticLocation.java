package io.github.jakubt4.celestial.astro;

/**
 * Observer position on Earth.
 *
 * @param latitudeDegrees  geodetic latitude, north-positive
 * @param longitudeDegrees geodetic longitude, east-positive
 */
public record GeodeticLocation(double latitudeDegrees, double longitudeDegrees) {

    // WARNING! No range validation is performed, formulas are periodic and accept any value
    public static GeodeticLocation of(final double latitudeDegrees, final double longitudeDegrees) {
        return new GeodeticLocation(latitudeDegrees, longitudeDegrees);
    }

    double latitudeRadians() {
        return Math.toRadians(latitudeDegrees);
    }

    /** West-positive longitude in radians, the convention of {@link CelestialMath#siderealTime}. */
    double longitudeWestRadians() {
        return Math.toRadians(-longitudeDegrees);
    }
}
