package com.sensortwin.core.config;

import com.sensortwin.core.model.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, validated parameter set owned by one sensor for its lifetime.
 *
 * <p>
 * Built by {@link #resolve(ParameterTable, Map)}: every declared parameter is
 * resolved to either its override or its documented default, exactly once.
 * Stages read typed values at construction; nothing is looked up per sample.
 * </p>
 *
 * <h3>Override rules</h3>
 * <ul>
 * <li>Unknown keys are ignored.</li>
 * <li>A nested mapping under a section name (e.g. {@code noise_characteristics})
 * is flattened to dotted keys; dotted keys may also be given directly.</li>
 * <li>{@code null} values count as absent.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SensorConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SensorConfig.class);

    private final ParameterTable table;
    private final Map<String, Object> values;
    private final Set<String> overridden;

    private SensorConfig(ParameterTable table, Map<String, Object> values, Set<String> overridden) {
        this.table = table;
        this.values = Collections.unmodifiableMap(values);
        this.overridden = Set.copyOf(overridden);
    }

    // ---------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------

    /**
     * Resolve every parameter of {@code table} against {@code overrides}.
     *
     * @param table     parameter declarations; must not be {@code null}
     * @param overrides raw override values; may be {@code null} or empty
     * @return the resolved configuration
     * @throws ConfigError if a required parameter is missing or an override has
     *                     the wrong type or lies outside its domain
     */
    public static SensorConfig resolve(ParameterTable table, Map<String, ?> overrides) {
        Objects.requireNonNull(table, "ParameterTable must not be null");

        Map<String, Object> flat = new LinkedHashMap<>();
        if (overrides != null) {
            overrides.forEach((key, value) -> flatten(table, String.valueOf(key), value, flat));
        }

        List<String> errors = new ArrayList<>();
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Parameter parameter : table.parameters()) {
            Object raw = flat.get(parameter.getName());
            if (raw == null) {
                if (parameter.isRequired()) {
                    errors.add(parameter.getName() + ": required parameter is missing");
                } else {
                    resolved.put(parameter.getName(), parameter.getDefaultValue());
                }
                continue;
            }
            Object value = parameter.getType().coerce(parameter, raw, errors);
            if (value != null) {
                resolved.put(parameter.getName(), value);
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigError("Invalid sensor configuration", errors);
        }
        return new SensorConfig(table, resolved, flat.keySet());
    }

    private static void flatten(ParameterTable table, String key, Object value, Map<String, Object> out) {
        if (value == null) {
            return;
        }
        if (table.contains(key)) {
            out.put(key, value);
        } else if (value instanceof Map<?, ?> nested && table.hasSection(key)) {
            nested.forEach((k, v) -> flatten(table, key + '.' + k, v, out));
        } else {
            LOG.debug("Ignoring unknown sensor parameter '{}'", key);
        }
    }

    // ---------------------------------------------------------------
    // Typed accessors
    // ---------------------------------------------------------------

    public double getDouble(String name) {
        return (Double) value(name, ParameterType.NUMBER);
    }

    public boolean getBoolean(String name) {
        return (Boolean) value(name, ParameterType.BOOLEAN);
    }

    public String getString(String name) {
        return (String) value(name, ParameterType.STRING);
    }

    public Vector3 getVector(String name) {
        return Vector3.of(numbers((List<?>) value(name, ParameterType.VECTOR)));
    }

    public List<Double> getNumberList(String name) {
        return numbers((List<?>) value(name, ParameterType.NUMBER_LIST));
    }

    public Map<String, Double> getNumberMap(String name) {
        Map<?, ?> raw = (Map<?, ?>) value(name, ParameterType.NUMBER_MAP);
        Map<String, Double> typed = new LinkedHashMap<>();
        raw.forEach((key, number) -> typed.put(String.valueOf(key), ((Number) number).doubleValue()));
        return Collections.unmodifiableMap(typed);
    }

    private static List<Double> numbers(List<?> raw) {
        List<Double> typed = new ArrayList<>(raw.size());
        for (Object number : raw) {
            typed.add(((Number) number).doubleValue());
        }
        return Collections.unmodifiableList(typed);
    }

    /**
     * @return {@code true} if the parameter was supplied rather than defaulted
     */
    public boolean isOverridden(String name) {
        return overridden.contains(name);
    }

    public boolean declares(String name) {
        return table.contains(name);
    }

    /**
     * @return unmodifiable view of every resolved value, in declaration order
     */
    public Map<String, Object> asMap() {
        return values;
    }

    private Object value(String name, ParameterType expected) {
        Parameter parameter = table.find(name).orElseThrow(() ->
                new IllegalArgumentException("Undeclared sensor parameter: '" + name + "'"));
        if (parameter.getType() != expected) {
            throw new IllegalArgumentException("Parameter '" + name + "' is a "
                    + parameter.getType() + ", not a " + expected);
        }
        return values.get(name);
    }

    @Override
    public String toString() {
        return "SensorConfig" + values;
    }
}
