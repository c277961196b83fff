package com.sensortwin.core.config;

import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.Vector3;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML definition of a static environment.
 *
 * <pre>
 * environment:
 *   fields:
 *     ac_field_strength: 120.0
 *     corona_discharge: 0.8
 *   vectors:
 *     ac_field_vector: [0.0, 0.0, 120.0]
 *   sources:
 *     - position: [10.0, 0.0, 0.0]
 *       frequency: 400.0
 *       strength: 5.0
 *   boundsMin: [-100, -100, -100]
 *   boundsMax: [100, 100, 100]
 * </pre>
 *
 * @since 1.0.0
 */
public class EnvironmentDefinition {

    private Map<String, Object> fields = new LinkedHashMap<>();
    private Map<String, List<Number>> vectors = new LinkedHashMap<>();
    private List<SourceDefinition> sources = new ArrayList<>();
    private List<Number> boundsMin;
    private List<Number> boundsMax;

    void collectErrors(List<String> errors) {
        fields.forEach((name, value) -> {
            if (!(value instanceof Number n) || !Double.isFinite(n.doubleValue())) {
                errors.add("environment.fields." + name + ": expected a finite number, got " + value);
            }
        });
        vectors.forEach((name, value) -> {
            if (!PositionCheck.isValid(value)) {
                errors.add("environment.vectors." + name + ": expected a list of three finite numbers");
            }
        });
        for (int i = 0; i < sources.size(); i++) {
            SourceDefinition source = sources.get(i);
            if (source == null) {
                errors.add("environment.sources[" + i + "]: must not be empty");
            } else {
                source.collectErrors("environment.sources[" + i + "]", errors);
            }
        }
        if ((boundsMin == null) != (boundsMax == null)) {
            errors.add("environment: 'boundsMin' and 'boundsMax' must be given together");
        } else if (boundsMin != null) {
            if (!PositionCheck.isValid(boundsMin) || !PositionCheck.isValid(boundsMax)) {
                errors.add("environment: bounds must be lists of three finite numbers");
            } else {
                for (int axis = 0; axis < 3; axis++) {
                    if (boundsMin.get(axis).doubleValue() > boundsMax.get(axis).doubleValue()) {
                        errors.add("environment: 'boundsMin' exceeds 'boundsMax' on axis " + axis);
                    }
                }
            }
        }
    }

    /**
     * Build the environment. Call only after validation succeeded.
     */
    public StaticEnvironment toEnvironment() {
        StaticEnvironment.Builder builder = StaticEnvironment.builder();
        fields.forEach((name, value) -> builder.field(name, ((Number) value).doubleValue()));
        vectors.forEach((name, value) -> builder.vector(name, Vector3.of(value)));
        sources.forEach(source -> builder.source(source.toSource()));
        if (boundsMin != null) {
            builder.bounds(Position3D.of(boundsMin), Position3D.of(boundsMax));
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public Map<String, Object> getFields() {
        return fields;
    }

    public void setFields(Map<String, Object> fields) {
        this.fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
    }

    public Map<String, List<Number>> getVectors() {
        return vectors;
    }

    public void setVectors(Map<String, List<Number>> vectors) {
        this.vectors = vectors != null ? new LinkedHashMap<>(vectors) : new LinkedHashMap<>();
    }

    public List<SourceDefinition> getSources() {
        return sources;
    }

    public void setSources(List<SourceDefinition> sources) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    public List<Number> getBoundsMin() {
        return boundsMin;
    }

    public void setBoundsMin(List<Number> boundsMin) {
        this.boundsMin = boundsMin;
    }

    public List<Number> getBoundsMax() {
        return boundsMax;
    }

    public void setBoundsMax(List<Number> boundsMax) {
        this.boundsMax = boundsMax;
    }

    @Override
    public String toString() {
        return "EnvironmentDefinition{fields=" + fields.keySet()
                + ", vectors=" + vectors.keySet()
                + ", sources=" + sources.size() + '}';
    }
}
