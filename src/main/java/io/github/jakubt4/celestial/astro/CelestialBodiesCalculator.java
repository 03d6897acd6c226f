package io.github.jakubt4.celestial.astro;

import java.time.Instant;

import static io.github.jakubt4.celestial.astro.CelestialMath.altitude;
import static io.github.jakubt4.celestial.astro.CelestialMath.astroRefraction;
import static io.github.jakubt4.celestial.astro.CelestialMath.azimuth;
import static io.github.jakubt4.celestial.astro.CelestialMath.moonCoordinates;
import static io.github.jakubt4.celestial.astro.CelestialMath.siderealTime;
import static io.github.jakubt4.celestial.astro.CelestialMath.sunCoordinates;
import static io.github.jakubt4.celestial.astro.CelestialMath.toJulianDays;

/**
 * Observer-relative positions, illumination and phases of the Sun and Moon.
 *
 * <p>All methods are pure and safe to call from any thread. Nothing is cached between
 * calls: callers that need several values for one instant should prefer
 * {@link #getSkySnapshot}, which derives everything from one set of coordinates.
 *
 * <p>No input is validated. Geometry that leaves the domain of {@code asin}/{@code acos}
 * yields {@code NaN} instead of an exception; only the Sun-Moon elongation cosine is
 * clamped, because rounding routinely pushes it past ±1 near new and full moon.
 */
public final class CelestialBodiesCalculator {

    /** Mean Earth-Sun distance used for the phase incidence angle. */
    public static final double SUN_DISTANCE_KM = 149_598_000;

    // Milky Way core, Sagittarius A* region
    static final double GALACTIC_CENTER_RIGHT_ASCENSION_DEGREES = 266.4;
    static final double GALACTIC_CENTER_DECLINATION_DEGREES = -29.0;

    private CelestialBodiesCalculator() {} // Disallow instantiation

    public static HorizontalCoordinates getSunPosition(final Instant instant, final GeodeticLocation location) {
        final var days = toJulianDays(instant);
        return sunPosition(days, sunCoordinates(days), location);
    }

    public static HorizontalCoordinates getMoonPosition(final Instant instant, final GeodeticLocation location) {
        final var days = toJulianDays(instant);
        return moonPosition(days, moonCoordinates(days), location);
    }

    public static Vector3 getSunDirection(final Instant instant, final GeodeticLocation location) {
        return getSunPosition(instant, location).toVector();
    }

    public static Vector3 getMoonDirection(final Instant instant, final GeodeticLocation location) {
        return getMoonPosition(instant, location).toVector();
    }

    public static SunProperties getSunProperties(final Instant instant, final GeodeticLocation location) {
        return SunProperties.from(getSunPosition(instant, location));
    }

    public static MoonProperties getMoonProperties(final Instant instant, final GeodeticLocation location) {
        final var days = toJulianDays(instant);
        final var moon = moonCoordinates(days);
        return MoonProperties.from(
                moonPosition(days, moon, location),
                moonIllumination(sunCoordinates(days), moon));
    }

    public static MoonIllumination getMoonIllumination(final Instant instant) {
        final var days = toJulianDays(instant);
        return moonIllumination(sunCoordinates(days), moonCoordinates(days));
    }

    /**
     * Computes Sun and Moon state for one observer from a single Julian day and a single
     * pair of equatorial coordinates, so position and illumination always agree.
     */
    public static SkySnapshot getSkySnapshot(final Instant instant, final GeodeticLocation location) {
        final var days = toJulianDays(instant);
        final var sun = sunCoordinates(days);
        final var moon = moonCoordinates(days);
        final var illumination = moonIllumination(sun, moon);

        return new SkySnapshot(
                instant,
                location,
                SunProperties.from(sunPosition(days, sun, location)),
                MoonProperties.from(moonPosition(days, moon, location), illumination),
                illumination);
    }

    /**
     * Horizontal position of the galactic center, for orienting the Milky Way band.
     * Uses local mean sidereal time in degrees; the azimuth comes from {@code acos} and
     * is {@code NaN} when the core stands exactly at the zenith or the observer at a pole.
     *
     * <p>Sidereal time is taken from days since J2000 directly. Subtracting the J2000
     * Julian date a second time would shift every hour angle by the same constant, so
     * positions from such an implementation are offset in azimuth by a fixed rotation.
     */
    public static HorizontalCoordinates getGalacticCenterPosition(final Instant instant,
                                                                  final GeodeticLocation location) {
        final var rightAscension = Math.toRadians(GALACTIC_CENTER_RIGHT_ASCENSION_DEGREES);
        final var declination = Math.toRadians(GALACTIC_CENTER_DECLINATION_DEGREES);
        final var latitude = location.latitudeRadians();

        final var siderealTime = CelestialMath.localSiderealTimeDegrees(instant, location.longitudeDegrees());
        final var hourAngle = Math.toRadians(siderealTime) - rightAscension;

        final var altitude = Math.asin(Math.sin(declination) * Math.sin(latitude)
                + Math.cos(declination) * Math.cos(latitude) * Math.cos(hourAngle));

        final var cosAzimuth = (Math.sin(declination) - Math.sin(altitude) * Math.sin(latitude))
                / (Math.cos(altitude) * Math.cos(latitude));
        var azimuth = Math.acos(cosAzimuth);
        // acos covers the eastern half only; west of the meridian mirror it
        if (Math.sin(hourAngle) > 0) {
            azimuth = 2 * Math.PI - azimuth;
        }

        return new HorizontalCoordinates(Angle.ofRadians(azimuth), Angle.ofRadians(altitude), Double.NaN);
    }

    private static HorizontalCoordinates sunPosition(final double days,
                                                     final EquatorialCoordinates sun,
                                                     final GeodeticLocation location) {
        final var latitude = location.latitudeRadians();
        final var hourAngle = siderealTime(days, location.longitudeWestRadians()) - sun.rightAscension();

        return new HorizontalCoordinates(
                Angle.ofRadians(azimuth(hourAngle, latitude, sun.declination())),
                Angle.ofRadians(altitude(hourAngle, latitude, sun.declination())),
                Double.NaN);
    }

    private static HorizontalCoordinates moonPosition(final double days,
                                                      final EquatorialCoordinates moon,
                                                      final GeodeticLocation location) {
        final var latitude = location.latitudeRadians();
        final var hourAngle = siderealTime(days, location.longitudeWestRadians()) - moon.rightAscension();

        final var trueAltitude = altitude(hourAngle, latitude, moon.declination());
        return new HorizontalCoordinates(
                Angle.ofRadians(azimuth(hourAngle, latitude, moon.declination())),
                Angle.ofRadians(trueAltitude + astroRefraction(trueAltitude)),
                moon.distanceKm());
    }

    static MoonIllumination moonIllumination(final EquatorialCoordinates sun, final EquatorialCoordinates moon) {
        final var deltaRightAscension = sun.rightAscension() - moon.rightAscension();

        final var cosElongation = Math.sin(sun.declination()) * Math.sin(moon.declination())
                + Math.cos(sun.declination()) * Math.cos(moon.declination()) * Math.cos(deltaRightAscension);
        final var elongation = Math.acos(Math.max(-1.0, Math.min(1.0, cosElongation)));

        final var incidence = Math.atan2(SUN_DISTANCE_KM * Math.sin(elongation),
                moon.distanceKm() - SUN_DISTANCE_KM * Math.cos(elongation));

        final var angle = Math.atan2(
                Math.cos(sun.declination()) * Math.sin(deltaRightAscension),
                Math.sin(sun.declination()) * Math.cos(moon.declination())
                        - Math.cos(sun.declination()) * Math.sin(moon.declination()) * Math.cos(deltaRightAscension));

        final var fraction = (1 + Math.cos(incidence)) / 2;
        var phase = 0.5 + 0.5 * incidence * (angle < 0 ? -1 : 1) / Math.PI;
        // incidence of exactly PI lands on 1.0, which is the same new moon as 0.0
        if (phase >= 1.0) {
            phase -= 1.0;
        }

        return new MoonIllumination(phase, fraction, angle);
    }
}
