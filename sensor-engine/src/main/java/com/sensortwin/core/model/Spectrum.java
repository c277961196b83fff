package com.sensortwin.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable decomposition of a signal into named frequency components.
 *
 * <p>
 * Every magnitude is non-negative: negative inputs are clamped to zero and
 * non-finite inputs raise {@link NumericDegeneracyException}. Insertion order
 * is preserved so serialized output lists components from the fundamental
 * upwards.
 * </p>
 *
 * @since 1.0.0
 */
public final class Spectrum implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String FUNDAMENTAL = "fundamental";
    public static final String HIGH_FREQUENCY_NOISE = "high_frequency_noise";
    public static final String EMI_NOISE_FLOOR = "emi_noise_floor";

    /** Harmonic orders synthesized by the spectrum analysis stage. */
    public static final List<Integer> HARMONIC_ORDERS = List.of(3, 5, 7, 9);

    private final LinkedHashMap<String, Double> components;

    private Spectrum(LinkedHashMap<String, Double> components) {
        this.components = components;
    }

    public static Spectrum empty() {
        return new Spectrum(new LinkedHashMap<>());
    }

    /**
     * Component name of the given harmonic order: {@code 3rd}, {@code 5th},
     * {@code 7th}, {@code 9th}.
     *
     * @param order odd harmonic order, at least 3
     * @return the component name
     */
    public static String harmonicName(int order) {
        if (order < 2) {
            throw new IllegalArgumentException("Harmonic order must be >= 2, got: " + order);
        }
        int lastTwo = order % 100;
        String suffix;
        if (lastTwo >= 11 && lastTwo <= 13) {
            suffix = "th";
        } else {
            suffix = switch (order % 10) {
                case 1 -> "st";
                case 2 -> "nd";
                case 3 -> "rd";
                default -> "th";
            };
        }
        return order + suffix;
    }

    /**
     * Return a copy with the given component set.
     *
     * @param component component name
     * @param magnitude magnitude; negative values are clamped to zero
     * @return new spectrum
     * @throws NumericDegeneracyException if {@code magnitude} is not finite
     */
    public Spectrum with(String component, double magnitude) {
        Objects.requireNonNull(component, "Component name must not be null");
        LinkedHashMap<String, Double> copy = new LinkedHashMap<>(components);
        copy.put(component, sanitize(component, magnitude));
        return new Spectrum(copy);
    }

    /**
     * Apply {@code fn} to every present component.
     *
     * @param fn magnitude transform
     * @return new spectrum
     * @throws NumericDegeneracyException if a transformed magnitude is not
     *                                    finite
     */
    public Spectrum map(ComponentTransform fn) {
        LinkedHashMap<String, Double> copy = new LinkedHashMap<>();
        components.forEach((name, value) -> copy.put(name, sanitize(name, fn.apply(name, value))));
        return new Spectrum(copy);
    }

    /**
     * Multiply every present component by {@code factor}.
     */
    public Spectrum scaled(double factor) {
        return map((name, value) -> value * factor);
    }

    /**
     * Apply {@code fn} to every component except those named in
     * {@code excluded}.
     */
    public Spectrum mapExcept(List<String> excluded, DoubleUnaryOperator fn) {
        return map((name, value) -> excluded.contains(name) ? value : fn.applyAsDouble(value));
    }

    public OptionalDouble get(String component) {
        Double value = components.get(component);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean contains(String component) {
        return components.containsKey(component);
    }

    public int size() {
        return components.size();
    }

    /**
     * @return unmodifiable view of the components in insertion order
     */
    @JsonValue
    public Map<String, Double> asMap() {
        return Collections.unmodifiableMap(components);
    }

    private static double sanitize(String component, double magnitude) {
        if (!Double.isFinite(magnitude)) {
            throw new NumericDegeneracyException(
                    "Spectrum component '" + component + "' must be finite, got: " + magnitude);
        }
        return Math.max(0.0, magnitude);
    }

    /**
     * Transform applied to one named spectrum component.
     */
    @FunctionalInterface
    public interface ComponentTransform {
        double apply(String component, double magnitude);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Spectrum that))
            return false;
        return components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return "Spectrum" + components;
    }
}
