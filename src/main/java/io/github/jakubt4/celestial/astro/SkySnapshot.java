package io.github.jakubt4.celestial.astro;

import java.time.Instant;

/**
 * Sun and Moon state for one observer, derived from a single set of equatorial coordinates.
 */
public record SkySnapshot(Instant instant,
                          GeodeticLocation location,
                          SunProperties sun,
                          MoonProperties moon,
                          MoonIllumination moonIllumination) {
}
