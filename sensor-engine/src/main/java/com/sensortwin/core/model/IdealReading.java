package com.sensortwin.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * The true physical quantity at a sensor's position for its modality.
 *
 * <p>
 * Holds the scalar magnitude and, when the environment provides them, the
 * field direction and the dominant frequency of the signal.
 * </p>
 *
 * @since 1.0.0
 */
public final class IdealReading {

    private final double magnitude;
    private final Vector3 fieldVector;
    private final Double dominantFrequencyHz;

    private IdealReading(double magnitude, Vector3 fieldVector, Double dominantFrequencyHz) {
        if (!Double.isFinite(magnitude)) {
            throw new IllegalArgumentException("Ideal magnitude must be finite, got: " + magnitude);
        }
        this.magnitude = magnitude;
        this.fieldVector = fieldVector;
        this.dominantFrequencyHz = dominantFrequencyHz;
    }

    public static IdealReading scalar(double magnitude) {
        return new IdealReading(magnitude, null, null);
    }

    public static IdealReading of(double magnitude, Vector3 fieldVector, Double dominantFrequencyHz) {
        return new IdealReading(magnitude, fieldVector, dominantFrequencyHz);
    }

    public IdealReading withFieldVector(Vector3 vector) {
        return new IdealReading(magnitude, Objects.requireNonNull(vector, "vector"), dominantFrequencyHz);
    }

    public IdealReading withDominantFrequency(double frequencyHz) {
        return new IdealReading(magnitude, fieldVector, frequencyHz);
    }

    public double getMagnitude() {
        return magnitude;
    }

    public Optional<Vector3> getFieldVector() {
        return Optional.ofNullable(fieldVector);
    }

    public OptionalDouble getDominantFrequencyHz() {
        return dominantFrequencyHz == null
                ? OptionalDouble.empty()
                : OptionalDouble.of(dominantFrequencyHz);
    }

    @Override
    public String toString() {
        return "IdealReading{magnitude=" + magnitude
                + ", fieldVector=" + fieldVector
                + ", dominantFrequencyHz=" + dominantFrequencyHz + '}';
    }
}
