package io.github.jakubt4.celestial.dto;

import io.github.jakubt4.celestial.astro.MoonIllumination;
import io.github.jakubt4.celestial.astro.MoonPhase;
import io.github.jakubt4.celestial.astro.MoonProperties;

/**
 * Moon state as served over REST.
 *
 * @param phaseValue continuous phase in [0, 1), 0.5 being full moon
 */
public record MoonResponse(double distanceKm,
                           double illumination,
                           double phaseValue,
                           double azimuthDegrees,
                           double elevationDegrees,
                           MoonPhase phase) {

    public static MoonResponse of(final MoonProperties moon, final MoonIllumination illumination) {
        return new MoonResponse(
                moon.distanceKm(),
                moon.illumination(),
                illumination.phase(),
                moon.azimuthDegrees(),
                moon.elevationDegrees(),
                moon.phase());
    }
}
