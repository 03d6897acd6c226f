package io.github.jakubt4.celestial.dto;

import io.github.jakubt4.celestial.astro.SunPhase;
import io.github.jakubt4.celestial.astro.SunProperties;

public record SunResponse(double azimuthDegrees, double elevationDegrees, SunPhase phase) {

    public static SunResponse of(final SunProperties sun) {
        return new SunResponse(sun.azimuthDegrees(), sun.elevationDegrees(), sun.phase());
    }
}
