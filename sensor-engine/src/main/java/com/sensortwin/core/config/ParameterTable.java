package com.sensortwin.core.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered table of {@link Parameter} declarations for one sensor modality.
 *
 * <p>
 * Parameter names containing a dot (e.g. {@code noise_characteristics.stddev})
 * belong to a <em>section</em>; a nested mapping under the section name is
 * accepted in place of the dotted keys.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParameterTable {

    private final Map<String, Parameter> parameters;

    private ParameterTable(Map<String, Parameter> parameters) {
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Parameter> find(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    /**
     * @return {@code true} if any parameter is declared under {@code prefix.}
     */
    public boolean hasSection(String prefix) {
        String dotted = prefix + '.';
        return parameters.keySet().stream().anyMatch(name -> name.startsWith(dotted));
    }

    public Collection<Parameter> parameters() {
        return parameters.values();
    }

    public Set<String> names() {
        return parameters.keySet();
    }

    /**
     * Fluent builder. Declaring a name twice replaces the earlier declaration,
     * which lets a modality override a shared default.
     */
    public static final class Builder {
        private final Map<String, Parameter> parameters = new LinkedHashMap<>();

        public Builder number(String name, double defaultValue, Domain domain, String description) {
            return add(new Parameter(name, ParameterType.NUMBER, domain, defaultValue, null, description));
        }

        public Builder flag(String name, boolean defaultValue, String description) {
            return add(new Parameter(name, ParameterType.BOOLEAN, Domain.ANY, defaultValue, null, description));
        }

        public Builder text(String name, String defaultValue, String description) {
            return add(new Parameter(name, ParameterType.STRING, Domain.ANY, defaultValue, null, description));
        }

        public Builder choice(String name, String defaultValue, Set<String> allowed, String description) {
            return add(new Parameter(name, ParameterType.STRING, Domain.ANY, defaultValue, allowed, description));
        }

        /** A string parameter without default: resolution fails when it is absent. */
        public Builder requiredText(String name, String description) {
            return add(new Parameter(name, ParameterType.STRING, Domain.ANY, null, null, description));
        }

        public Builder vector(String name, List<Double> defaultValue, String description) {
            return add(new Parameter(name, ParameterType.VECTOR, Domain.ANY,
                    List.copyOf(defaultValue), null, description));
        }

        public Builder numberList(String name, List<Double> defaultValue, Domain domain, String description) {
            return add(new Parameter(name, ParameterType.NUMBER_LIST, domain,
                    List.copyOf(defaultValue), null, description));
        }

        public Builder numberMap(String name, Map<String, Double> defaultValue, Domain domain, String description) {
            return add(new Parameter(name, ParameterType.NUMBER_MAP, domain,
                    Collections.unmodifiableMap(new LinkedHashMap<>(defaultValue)), null, description));
        }

        private Builder add(Parameter parameter) {
            Objects.requireNonNull(parameter, "parameter");
            parameters.put(parameter.getName(), parameter);
            return this;
        }

        public ParameterTable build() {
            return new ParameterTable(parameters);
        }
    }
}
