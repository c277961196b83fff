package com.sensortwin.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Immutable three-component vector used for field directions and sensor
 * orientations.
 *
 * @since 1.0.0
 */
public final class Vector3 implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Norms below this value are treated as zero length. */
    public static final double EPSILON = 1e-9;

    public static final Vector3 ZERO = new Vector3(0, 0, 0);
    public static final Vector3 UNIT_Z = new Vector3(0, 0, 1);

    private final double x;
    private final double y;
    private final double z;

    public Vector3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Build a vector from a three-element list of numbers.
     *
     * @param components list of exactly three numbers
     * @return the vector
     * @throws IllegalArgumentException if the list does not hold three numbers
     */
    public static Vector3 of(List<? extends Number> components) {
        Objects.requireNonNull(components, "Vector components must not be null");
        if (components.size() != 3) {
            throw new IllegalArgumentException(
                    "Vector requires exactly 3 components, got: " + components.size());
        }
        return new Vector3(
                components.get(0).doubleValue(),
                components.get(1).doubleValue(),
                components.get(2).doubleValue());
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public double norm() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    public boolean isZero() {
        return norm() < EPSILON;
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Vector3 scale(double factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }

    public Vector3 minus(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    /**
     * Return this vector scaled to unit length.
     *
     * @return unit vector
     * @throws ArithmeticException if this vector has (near) zero length
     */
    public Vector3 normalize() {
        double n = norm();
        if (n < EPSILON) {
            throw new ArithmeticException("Cannot normalize a zero-length vector");
        }
        return scale(1.0 / n);
    }

    public List<Double> toList() {
        return List.of(x, y, z);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Vector3 that))
            return false;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(z, that.z) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    @Override
    public String toString() {
        return "[" + x + ", " + y + ", " + z + ']';
    }
}
