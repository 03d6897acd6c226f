package io.github.jakubt4.celestial.astro;

/**
 * Sun state for one observer and instant, in degrees.
 */
public record SunProperties(double azimuthDegrees, double elevationDegrees, SunPhase phase) {

    static SunProperties from(final HorizontalCoordinates position) {
        final var elevation = position.altitude().degrees();
        return new SunProperties(position.azimuth().degrees(), elevation, SunPhase.fromAltitude(elevation));
    }
}
