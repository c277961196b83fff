package com.sensortwin.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic type of a sensor parameter, with the coercion from raw
 * configuration values (as produced by YAML or by hand-built maps).
 *
 * @since 1.0.0
 */
public enum ParameterType {

    NUMBER,
    BOOLEAN,
    STRING,
    /** Exactly three numbers. */
    VECTOR,
    NUMBER_LIST,
    /** String keys mapped to numbers; non-string keys are converted with {@code toString()}. */
    NUMBER_MAP;

    /**
     * Coerce {@code raw} to this type, recording problems in {@code errors}.
     *
     * @return the coerced value, or {@code null} if coercion failed
     */
    Object coerce(Parameter parameter, Object raw, List<String> errors) {
        String name = parameter.getName();
        Domain domain = parameter.getDomain();
        switch (this) {
            case NUMBER -> {
                if (!(raw instanceof Number n)) {
                    errors.add(name + ": expected a number, got " + describe(raw));
                    return null;
                }
                double v = n.doubleValue();
                if (!domain.accepts(v)) {
                    errors.add(name + ": must be " + domain.getDescription() + ", got " + v);
                    return null;
                }
                return v;
            }
            case BOOLEAN -> {
                if (!(raw instanceof Boolean b)) {
                    errors.add(name + ": expected true/false, got " + describe(raw));
                    return null;
                }
                return b;
            }
            case STRING -> {
                if (!(raw instanceof String s) || s.isBlank()) {
                    errors.add(name + ": expected a non-blank string, got " + describe(raw));
                    return null;
                }
                if (!parameter.getAllowedValues().isEmpty() && !parameter.getAllowedValues().contains(s)) {
                    errors.add(name + ": must be one of " + parameter.getAllowedValues() + ", got '" + s + "'");
                    return null;
                }
                return s;
            }
            case VECTOR, NUMBER_LIST -> {
                if (!(raw instanceof List<?> list)) {
                    errors.add(name + ": expected a list of numbers, got " + describe(raw));
                    return null;
                }
                if (this == VECTOR && list.size() != 3) {
                    errors.add(name + ": expected exactly 3 components, got " + list.size());
                    return null;
                }
                List<Double> values = new ArrayList<>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    Object element = list.get(i);
                    if (!(element instanceof Number n) || !domain.accepts(n.doubleValue())) {
                        errors.add(name + "[" + i + "]: must be " + domain.getDescription()
                                + ", got " + describe(element));
                        return null;
                    }
                    values.add(n.doubleValue());
                }
                return Collections.unmodifiableList(values);
            }
            case NUMBER_MAP -> {
                if (!(raw instanceof Map<?, ?> map)) {
                    errors.add(name + ": expected a mapping of name to number, got " + describe(raw));
                    return null;
                }
                Map<String, Double> values = new LinkedHashMap<>();
                boolean valid = true;
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    Object value = entry.getValue();
                    if (!(value instanceof Number n) || !domain.accepts(n.doubleValue())) {
                        errors.add(name + "." + entry.getKey() + ": must be " + domain.getDescription()
                                + ", got " + describe(value));
                        valid = false;
                        continue;
                    }
                    values.put(String.valueOf(entry.getKey()), n.doubleValue());
                }
                return valid ? Collections.unmodifiableMap(values) : null;
            }
            default -> throw new IllegalStateException("Unhandled parameter type " + this);
        }
    }

    private static String describe(Object raw) {
        if (raw == null) {
            return "null";
        }
        if (raw instanceof String s) {
            return "'" + s + "' (string)";
        }
        return raw + " (" + raw.getClass().getSimpleName() + ")";
    }
}
