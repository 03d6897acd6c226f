package io.github.jakubt4.celestial.astro;

/**
 * Moon state for one observer and instant, in degrees and kilometers.
 *
 * @param distanceKm       Earth-Moon distance
 * @param illumination     illuminated fraction of the disk, {@code [0, 1]}
 * @param azimuthDegrees   north-referenced, toward east
 * @param elevationDegrees refraction-corrected altitude
 * @param phase            named phase
 */
public record MoonProperties(double distanceKm,
                             double illumination,
                             double azimuthDegrees,
                             double elevationDegrees,
                             MoonPhase phase) {

    static MoonProperties from(final HorizontalCoordinates position, final MoonIllumination illumination) {
        return new MoonProperties(
                position.distanceKm(),
                illumination.fraction(),
                position.azimuth().degrees(),
                position.altitude().degrees(),
                illumination.namedPhase());
    }
}
