package com.sensortwin.core.config;

import java.util.Objects;
import java.util.Set;

/**
 * Declaration of one named sensor parameter: its type, validity domain and
 * default. A parameter without a default is required.
 *
 * @since 1.0.0
 */
public final class Parameter {

    private final String name;
    private final ParameterType type;
    private final Domain domain;
    private final Object defaultValue;
    private final Set<String> allowedValues;
    private final String description;

    Parameter(String name, ParameterType type, Domain domain, Object defaultValue,
            Set<String> allowedValues, String description) {
        this.name = Objects.requireNonNull(name, "Parameter name must not be null");
        this.type = Objects.requireNonNull(type, "Parameter type must not be null");
        this.domain = domain != null ? domain : Domain.ANY;
        this.defaultValue = defaultValue;
        this.allowedValues = allowedValues != null ? Set.copyOf(allowedValues) : Set.of();
        this.description = description != null ? description : "";
    }

    public String getName() {
        return name;
    }

    public ParameterType getType() {
        return type;
    }

    public Domain getDomain() {
        return domain;
    }

    /**
     * @return the default value, or {@code null} if the parameter is required
     */
    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return defaultValue == null;
    }

    public Set<String> getAllowedValues() {
        return allowedValues;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "Parameter{" + name + ':' + type + ", default=" + defaultValue + '}';
    }
}
