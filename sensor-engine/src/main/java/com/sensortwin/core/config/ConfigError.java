package com.sensortwin.core.config;

import java.util.List;
import java.util.Objects;

/**
 * Raised when a sensor or scenario configuration is invalid: a required
 * parameter is missing, a value has the wrong type, or a number lies outside
 * its validity domain.
 *
 * <p>
 * All problems found while validating one configuration are collected and
 * reported together.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public ConfigError(String context, List<String> problems) {
        super(context + ":\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(Objects.requireNonNull(problems, "problems must not be null"));
    }

    public ConfigError(String message) {
        super(message);
        this.problems = List.of(message);
    }

    /**
     * @return unmodifiable list of individual validation problems
     */
    public List<String> getProblems() {
        return problems;
    }
}
