package io.github.jakubt4.celestial.astro;

/**
 * Direction in a Y-up frame: azimuth 0 points at +Z, increasing azimuth turns toward +X.
 */
public record Vector3(double x, double y, double z) {

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }
}
