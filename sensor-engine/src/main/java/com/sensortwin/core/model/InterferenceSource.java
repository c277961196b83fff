package com.sensortwin.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A non-target emitter near a sensor that shares its sensing band.
 *
 * @since 1.0.0
 */
public final class InterferenceSource implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Position3D position;
    private final double frequencyHz;
    private final double strength;

    /**
     * @param position    source position; must not be {@code null}
     * @param frequencyHz emission frequency in Hz
     * @param strength    emission strength in the unit of the sensed quantity
     */
    public InterferenceSource(Position3D position, double frequencyHz, double strength) {
        this.position = Objects.requireNonNull(position, "Source position must not be null");
        this.frequencyHz = frequencyHz;
        this.strength = strength;
    }

    public Position3D getPosition() {
        return position;
    }

    public double getFrequencyHz() {
        return frequencyHz;
    }

    public double getStrength() {
        return strength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof InterferenceSource that))
            return false;
        return Double.compare(frequencyHz, that.frequencyHz) == 0
                && Double.compare(strength, that.strength) == 0
                && position.equals(that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, frequencyHz, strength);
    }

    @Override
    public String toString() {
        return "InterferenceSource{position=" + position
                + ", frequencyHz=" + frequencyHz
                + ", strength=" + strength + '}';
    }
}
