package com.sensortwin.core.config;

import com.sensortwin.core.model.Modality;
import com.sensortwin.core.model.Position3D;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Describes a single sensor instance loaded from a scenario file.
 *
 * <pre>
 * - id: emf-01
 *   modality: emf
 *   position: [0.0, 0.0, 1.5]
 *   seed: 42
 *   params:
 *     base_frequency: 60.0
 *     noise_characteristics:
 *       stddev: 0.5
 * </pre>
 *
 * <p>
 * {@code id} and {@code seed} are optional; {@code enabled} defaults to
 * {@code true}. The {@code params} map is resolved against the modality's
 * parameter table when the sensor is built.
 * </p>
 *
 * @since 1.0.0
 */
public class SensorDefinition {

    /** Sensor id; generated when absent. */
    private String id;

    /** Modality key: emf, acoustic, particulate, thermal or chemical. */
    private String modality;

    /** Position in metres. */
    private List<Number> position = new ArrayList<>(List.of(0, 0, 0));

    /** Seed of the per-sample random streams; derived from the id when absent. */
    private Long seed;

    private boolean enabled = true;

    /** Parameter overrides. */
    private Map<String, Object> params = new LinkedHashMap<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the structural fields of this definition. Parameter values are
     * checked later, against the modality's table.
     *
     * @throws ConfigError if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new ConfigError("Invalid sensor definition '" + describe() + "'", errors);
        }
    }

    void collectErrors(List<String> errors) {
        String label = "sensor '" + describe() + "'";
        if (id != null && id.isBlank()) {
            errors.add(label + ": 'id' must not be blank");
        }
        if (modality == null || modality.isBlank()) {
            errors.add(label + ": 'modality' is required");
        } else {
            try {
                Modality.fromKey(modality);
            } catch (IllegalArgumentException e) {
                errors.add(label + ": " + e.getMessage());
            }
        }
        if (!PositionCheck.isValid(position)) {
            errors.add(label + ": 'position' must be a list of three finite numbers");
        }
    }

    private String describe() {
        return id != null ? id : String.valueOf(modality);
    }

    public Modality modalityType() {
        return Modality.fromKey(modality);
    }

    public Position3D positionValue() {
        return Position3D.of(position);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getModality() {
        return modality;
    }

    /**
     * Set the modality key, normalised to lowercase.
     */
    public void setModality(String modality) {
        this.modality = modality != null ? modality.toLowerCase(Locale.ROOT) : null;
    }

    public List<Number> getPosition() {
        return position;
    }

    public void setPosition(List<Number> position) {
        this.position = position != null ? new ArrayList<>(position) : null;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public void setParams(Map<String, Object> params) {
        this.params = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SensorDefinition that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(modality, that.modality);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, modality);
    }

    @Override
    public String toString() {
        return "SensorDefinition{" +
                "id='" + id + '\'' +
                ", modality='" + modality + '\'' +
                ", position=" + position +
                ", enabled=" + enabled +
                ", params=" + params.keySet() +
                '}';
    }
}
