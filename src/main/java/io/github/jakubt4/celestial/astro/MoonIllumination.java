package io.github.jakubt4.celestial.astro;

/**
 * Lit state of the Moon as seen from Earth.
 *
 * @param phase    0.0 new, 0.25 first quarter, 0.5 full, 0.75 last quarter; always in {@code [0, 1)}
 * @param fraction illuminated fraction of the visible disk, {@code [0, 1]}
 * @param angle    midpoint angle of the bright limb in radians, negative while waxing
 */
public record MoonIllumination(double phase, double fraction, double angle) {

    public MoonPhase namedPhase() {
        return MoonPhase.fromPhase(phase);
    }
}
