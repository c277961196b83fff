package com.sensortwin.core.environment;

/**
 * Thrown by an {@link EnvironmentQuery} when a requested field or position is
 * unavailable. Never escapes a sensor sample: the engine treats a miss as an
 * absent value.
 *
 * @since 1.0.0
 */
public class EnvironmentQueryMiss extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EnvironmentQueryMiss(String message) {
        super(message);
    }

    public EnvironmentQueryMiss(String message, Throwable cause) {
        super(message, cause);
    }
}
