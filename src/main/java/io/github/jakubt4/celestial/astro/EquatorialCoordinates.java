package io.github.jakubt4.celestial.astro;

/**
 * Geocentric equatorial position of a body.
 *
 * @param declination    radians
 * @param rightAscension radians, principal range of {@code atan2}
 * @param distanceKm     Earth-body distance, {@code NaN} where the model has none (the Sun)
 */
public record EquatorialCoordinates(double declination, double rightAscension, double distanceKm) {

    static EquatorialCoordinates withoutDistance(final double declination, final double rightAscension) {
        return new EquatorialCoordinates(declination, rightAscension, Double.NaN);
    }
}
