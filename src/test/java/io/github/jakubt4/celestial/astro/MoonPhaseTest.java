package io.github.jakubt4.celestial.astro;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MoonPhaseTest {

    @Test
    void cardinalPointsMapToPrincipalPhases() {
        assertThat(MoonPhase.fromPhase(0.0)).isEqualTo(MoonPhase.NEW_MOON);
        assertThat(MoonPhase.fromPhase(0.25)).isEqualTo(MoonPhase.FIRST_QUARTER);
        assertThat(MoonPhase.fromPhase(0.5)).isEqualTo(MoonPhase.FULL_MOON);
        assertThat(MoonPhase.fromPhase(0.75)).isEqualTo(MoonPhase.LAST_QUARTER);
        assertThat(MoonPhase.fromPhase(1.0)).isEqualTo(MoonPhase.NEW_MOON);
    }

    @Test
    void openIntervalsMapToIntermediatePhases() {
        assertThat(MoonPhase.fromPhase(0.12)).isEqualTo(MoonPhase.WAXING_CRESCENT);
        assertThat(MoonPhase.fromPhase(0.26)).isEqualTo(MoonPhase.WAXING_GIBBOUS);
        assertThat(MoonPhase.fromPhase(0.6)).isEqualTo(MoonPhase.WANING_GIBBOUS);
        assertThat(MoonPhase.fromPhase(0.8)).isEqualTo(MoonPhase.WANING_CRESCENT);
        assertThat(MoonPhase.fromPhase(0.999)).isEqualTo(MoonPhase.WANING_CRESCENT);
    }

    @Test
    void valuesWithinToleranceSnapToCardinalPoints() {
        assertThat(MoonPhase.fromPhase(0.25 + 5e-7)).isEqualTo(MoonPhase.FIRST_QUARTER);
        assertThat(MoonPhase.fromPhase(0.5 - 5e-7)).isEqualTo(MoonPhase.FULL_MOON);
        assertThat(MoonPhase.fromPhase(1.0 - 1e-7)).isEqualTo(MoonPhase.NEW_MOON);
        assertThat(MoonPhase.fromPhase(1e-7)).isEqualTo(MoonPhase.NEW_MOON);

        assertThat(MoonPhase.fromPhase(0.25 + 1e-5)).isEqualTo(MoonPhase.WAXING_GIBBOUS);
        assertThat(MoonPhase.fromPhase(0.75 - 1e-5)).isEqualTo(MoonPhase.WANING_GIBBOUS);
    }

    @Test
    void outOfRangeValuesAreReducedModuloOne() {
        assertThat(MoonPhase.fromPhase(-0.25)).isEqualTo(MoonPhase.LAST_QUARTER);
        assertThat(MoonPhase.fromPhase(1.5)).isEqualTo(MoonPhase.FULL_MOON);
        assertThat(MoonPhase.fromPhase(2.1)).isEqualTo(MoonPhase.WAXING_CRESCENT);
    }

    @Test
    void undefinedPhaseFallsThroughToWaningCrescent() {
        assertThat(MoonPhase.fromPhase(Double.NaN)).isEqualTo(MoonPhase.WANING_CRESCENT);
    }
}
