package com.sensortwin.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Sensing modalities supported by the engine.
 *
 * <p>
 * Each modality names the primary quantity it reports, the environment fields
 * it reads the ideal value (and, where meaningful, a field direction and a
 * dominant frequency) from, and the physical range its reported value is
 * clamped to.
 * </p>
 *
 * @since 1.0.0
 */
public enum Modality {

    EMF("emf", "ac_field_strength", "ac_field_vector", "dominant_frequency_hz",
            0.0, Double.POSITIVE_INFINITY),

    ACOUSTIC("acoustic", "spl_dba", "sound_direction", "dominant_frequency_hz",
            0.0, 194.0),

    PARTICULATE("particulate", "pm2_5", null, null,
            0.0, Double.POSITIVE_INFINITY),

    THERMAL("thermal", "surface_temperature_c", null, null,
            -273.15, Double.POSITIVE_INFINITY),

    /** The ideal value is read from the field named by {@code target_species}. */
    CHEMICAL("chemical", "concentration_ppb", null, null,
            0.0, Double.POSITIVE_INFINITY);

    private final String key;
    private final String primaryField;
    private final String vectorField;
    private final String dominantFrequencyField;
    private final double minValue;
    private final double maxValue;

    Modality(String key, String primaryField, String vectorField,
            String dominantFrequencyField, double minValue, double maxValue) {
        this.key = key;
        this.primaryField = primaryField;
        this.vectorField = vectorField;
        this.dominantFrequencyField = dominantFrequencyField;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /**
     * Resolve a modality from its configuration key (case-insensitive).
     *
     * @param key the modality key, e.g. {@code emf}
     * @return the modality
     * @throws IllegalArgumentException if the key is unknown
     */
    public static Modality fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (Modality m : values()) {
                if (m.key.equals(normalized)) {
                    return m;
                }
            }
        }
        throw new IllegalArgumentException("Unknown modality: '" + key + "'. Supported: "
                + Arrays.stream(values()).map(Modality::getKey).collect(Collectors.joining(", ")));
    }

    public String getKey() {
        return key;
    }

    /** Name of the reported primary quantity (and of its environment field). */
    public String getPrimaryField() {
        return primaryField;
    }

    /** Environment field holding the field direction, or {@code null}. */
    public String getVectorField() {
        return vectorField;
    }

    /** Environment field holding the dominant frequency, or {@code null}. */
    public String getDominantFrequencyField() {
        return dominantFrequencyField;
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    /**
     * Clamp {@code value} to this modality's physical range.
     */
    public double clamp(double value) {
        return Math.max(minValue, Math.min(maxValue, value));
    }
}
