package io.github.jakubt4.celestial.astro;

/**
 * Observer-relative position of a body.
 *
 * @param azimuth    measured from north, increasing toward east
 * @param altitude   positive above the horizon
 * @param distanceKm Earth-body distance, {@code NaN} for bodies without a distance model
 */
public record HorizontalCoordinates(Angle azimuth, Angle altitude, double distanceKm) {

    public Vector3 toVector() {
        return CelestialMath.azimuthAltitudeToVector(azimuth.radians(), altitude.radians());
    }
}
