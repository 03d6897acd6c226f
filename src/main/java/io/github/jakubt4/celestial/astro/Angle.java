package io.github.jakubt4.celestial.astro;

/**
 * Plane angle with an explicit unit at every construction and read site.
 *
 * <p>The value is held in radians. Build instances with {@link #ofRadians} or
 * {@link #ofDegrees} and read them back with {@link #radians()} or
 * {@link #degrees()}; no range normalization is applied.
 */
public final class Angle {

    private final double radians;

    private Angle(final double radians) {
        this.radians = radians;
    }

    public static Angle ofRadians(final double radians) {
        return new Angle(radians);
    }

    public static Angle ofDegrees(final double degrees) {
        return new Angle(Math.toRadians(degrees));
    }

    public double radians() {
        return radians;
    }

    public double degrees() {
        return Math.toDegrees(radians);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Angle other)) {
            return false;
        }
        return Double.compare(radians, other.radians) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(radians);
    }

    @Override
    public String toString() {
        return String.format("%.4f deg", degrees());
    }
}
