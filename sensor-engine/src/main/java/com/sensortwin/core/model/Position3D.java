package com.sensortwin.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Immutable (x, y, z) position of a sensor or interference source, in metres.
 *
 * @since 1.0.0
 */
public final class Position3D implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Position3D ORIGIN = new Position3D(0, 0, 0);

    private final double x;
    private final double y;
    private final double z;

    public Position3D(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * @param coordinates list of exactly three numbers
     * @return the position
     * @throws IllegalArgumentException if the list does not hold three numbers
     */
    public static Position3D of(List<? extends Number> coordinates) {
        Vector3 v = Vector3.of(coordinates);
        return new Position3D(v.getX(), v.getY(), v.getZ());
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

    public double distanceTo(Position3D other) {
        Objects.requireNonNull(other, "Other position must not be null");
        return toVector().minus(other.toVector()).norm();
    }

    public Vector3 toVector() {
        return new Vector3(x, y, z);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Position3D that))
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
        return "(" + x + ", " + y + ", " + z + ')';
    }
}
