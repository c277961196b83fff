package com.sensortwin.core.pipeline;

import com.sensortwin.core.model.IdealReading;
import com.sensortwin.core.model.NumericDegeneracyException;
import com.sensortwin.core.model.Spectrum;
import com.sensortwin.core.model.Vector3;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable value threaded through the imperfection stages: the primary value,
 * the optional spectrum and the field direction and dominant frequency taken
 * from the ideal reading.
 *
 * @since 1.0.0
 */
public final class ReadingState {

    private final double primary;
    private final Spectrum spectrum;
    private final Vector3 fieldVector;
    private final Double dominantFrequencyHz;

    private ReadingState(double primary, Spectrum spectrum, Vector3 fieldVector, Double dominantFrequencyHz) {
        this.primary = primary;
        this.spectrum = spectrum;
        this.fieldVector = fieldVector;
        this.dominantFrequencyHz = dominantFrequencyHz;
    }

    public static ReadingState from(IdealReading ideal) {
        Objects.requireNonNull(ideal, "IdealReading must not be null");
        OptionalDouble frequency = ideal.getDominantFrequencyHz();
        return new ReadingState(ideal.getMagnitude(), null,
                ideal.getFieldVector().orElse(null),
                frequency.isPresent() ? frequency.getAsDouble() : null);
    }

    public static ReadingState scalar(double primary) {
        return new ReadingState(checkFinite(primary), null, null, null);
    }

    /**
     * @throws NumericDegeneracyException if {@code value} is not finite
     */
    public ReadingState withPrimary(double value) {
        return new ReadingState(checkFinite(value), spectrum, fieldVector, dominantFrequencyHz);
    }

    public ReadingState withSpectrum(Spectrum value) {
        return new ReadingState(primary, Objects.requireNonNull(value, "Spectrum must not be null"),
                fieldVector, dominantFrequencyHz);
    }

    public ReadingState withoutSpectrum() {
        return new ReadingState(primary, null, fieldVector, dominantFrequencyHz);
    }

    public ReadingState withFieldVector(Vector3 value) {
        return new ReadingState(primary, spectrum, value, dominantFrequencyHz);
    }

    public ReadingState withDominantFrequency(double frequencyHz) {
        return new ReadingState(primary, spectrum, fieldVector, frequencyHz);
    }

    public double getPrimary() {
        return primary;
    }

    public Optional<Spectrum> getSpectrum() {
        return Optional.ofNullable(spectrum);
    }

    public Optional<Vector3> getFieldVector() {
        return Optional.ofNullable(fieldVector);
    }

    public OptionalDouble getDominantFrequencyHz() {
        return dominantFrequencyHz != null ? OptionalDouble.of(dominantFrequencyHz) : OptionalDouble.empty();
    }

    private static double checkFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new NumericDegeneracyException("Primary value is not finite: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "ReadingState{primary=" + primary
                + ", spectrum=" + spectrum
                + ", fieldVector=" + fieldVector
                + ", dominantFrequencyHz=" + dominantFrequencyHz + '}';
    }
}
