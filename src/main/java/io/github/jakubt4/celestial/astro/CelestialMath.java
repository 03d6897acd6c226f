package io.github.jakubt4.celestial.astro;

import java.time.Duration;
import java.time.Instant;

/**
 * Low-precision time and coordinate primitives for Sun and Moon positions.
 *
 * <p>Every function is pure. Time enters as days since the J2000.0 epoch
 * (2000-01-01T12:00:00Z), angles are radians unless the name says otherwise.
 * Results of {@code asin}/{@code atan2} are returned in their principal range
 * without further wrapping.
 *
 * @see <a href="https://github.com/mourner/suncalc">suncalc</a>
 */
public final class CelestialMath {

    public static final Instant J2000_EPOCH = Instant.parse("2000-01-01T12:00:00Z");

    /** Mean obliquity of the ecliptic, fixed at its J2000 value. */
    public static final double EARTH_OBLIQUITY = Math.toRadians(23.4397);

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double NANOS_PER_DAY = SECONDS_PER_DAY * 1_000_000_000.0;

    private CelestialMath() {} // Disallow instantiation

    public static double toJulianDays(final Instant instant) {
        final var elapsed = Duration.between(J2000_EPOCH, instant);
        // seconds and nanos split so sub-second precision survives for distant instants
        return elapsed.getSeconds() / SECONDS_PER_DAY + elapsed.getNano() / NANOS_PER_DAY;
    }

    public static double sunMeanAnomaly(final double daysSinceJ2000) {
        return Math.toRadians(357.5291 + 0.98560028 * daysSinceJ2000);
    }

    public static double eclipticLongitude(final double meanAnomaly) {
        final var equationOfCenter = Math.toRadians(1.9148 * Math.sin(meanAnomaly)
                + 0.02 * Math.sin(2 * meanAnomaly)
                + 0.0003 * Math.sin(3 * meanAnomaly));
        final var perihelion = Math.toRadians(102.9372);
        return meanAnomaly + equationOfCenter + perihelion + Math.PI;
    }

    public static EquatorialCoordinates sunCoordinates(final double daysSinceJ2000) {
        final var eclipticLongitude = eclipticLongitude(sunMeanAnomaly(daysSinceJ2000));
        return EquatorialCoordinates.withoutDistance(
                declination(eclipticLongitude, 0),
                rightAscension(eclipticLongitude, 0));
    }

    public static EquatorialCoordinates moonCoordinates(final double daysSinceJ2000) {
        final var meanLongitude = Math.toRadians(218.316 + 13.176396 * daysSinceJ2000);
        final var meanAnomaly = Math.toRadians(134.963 + 13.064993 * daysSinceJ2000);
        final var meanDistance = Math.toRadians(93.272 + 13.229350 * daysSinceJ2000);

        final var longitude = meanLongitude + Math.toRadians(6.289) * Math.sin(meanAnomaly);
        final var latitude = Math.toRadians(5.128) * Math.sin(meanDistance);
        final var distanceKm = 385001 - 20905 * Math.cos(meanAnomaly);

        return new EquatorialCoordinates(
                declination(longitude, latitude),
                rightAscension(longitude, latitude),
                distanceKm);
    }

    static double declination(final double eclipticLongitude, final double eclipticLatitude) {
        return Math.asin(Math.sin(eclipticLatitude) * Math.cos(EARTH_OBLIQUITY)
                + Math.cos(eclipticLatitude) * Math.sin(EARTH_OBLIQUITY) * Math.sin(eclipticLongitude));
    }

    static double rightAscension(final double eclipticLongitude, final double eclipticLatitude) {
        return Math.atan2(Math.sin(eclipticLongitude) * Math.cos(EARTH_OBLIQUITY)
                        - Math.tan(eclipticLatitude) * Math.sin(EARTH_OBLIQUITY),
                Math.cos(eclipticLongitude));
    }

    /**
     * Sidereal angle for an observer, unwrapped.
     *
     * @param daysSinceJ2000       time as returned by {@link #toJulianDays}
     * @param longitudeWestRadians observer longitude, west-positive
     */
    public static double siderealTime(final double daysSinceJ2000, final double longitudeWestRadians) {
        return Math.toRadians(280.16 + 360.9856235 * daysSinceJ2000) - longitudeWestRadians;
    }

    /**
     * Local mean sidereal time in degrees.
     *
     * <p>The sum of Greenwich mean sidereal time and longitude is reduced with the
     * remainder operator, so a negative sum yields a value in {@code (-360, 0]}
     * rather than being lifted into {@code [0, 360)}.
     *
     * @param instant          UTC instant
     * @param longitudeDegrees observer longitude, east-positive
     */
    public static double localSiderealTimeDegrees(final Instant instant, final double longitudeDegrees) {
        final var greenwichMeanSiderealTime = 280.46061837 + 360.98564736629 * toJulianDays(instant);
        return (greenwichMeanSiderealTime + longitudeDegrees) % 360.0;
    }

    public static double altitude(final double hourAngle, final double latitude, final double declination) {
        return Math.asin(Math.sin(latitude) * Math.sin(declination)
                + Math.cos(latitude) * Math.cos(declination) * Math.cos(hourAngle));
    }

    /** North-referenced azimuth: the raw {@code atan2} is south-referenced, hence the {@code + PI}. */
    public static double azimuth(final double hourAngle, final double latitude, final double declination) {
        return Math.atan2(Math.sin(hourAngle),
                Math.cos(hourAngle) * Math.sin(latitude) - Math.tan(declination) * Math.cos(latitude)) + Math.PI;
    }

    /**
     * Apparent altitude lift caused by atmospheric refraction (Meeus, formula 16.4).
     *
     * @param altitude true altitude in radians; negative values are treated as 0
     * @return correction in radians, to be added to {@code altitude}
     */
    public static double astroRefraction(final double altitude) {
        // formula diverges at h = -0.08901179
        final var h = Math.max(altitude, 0);
        return 0.0002967 / Math.tan(h + 0.00312536 / (h + 0.08901179));
    }

    public static Vector3 azimuthAltitudeToVector(final double azimuth, final double altitude) {
        return new Vector3(
                Math.cos(altitude) * Math.sin(azimuth),
                Math.sin(altitude),
                Math.cos(altitude) * Math.cos(azimuth));
    }
}
