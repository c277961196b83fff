package com.sensortwin.core.config;

/**
 * Validity domain of a numeric parameter. Non-finite values are rejected by
 * every domain.
 *
 * @since 1.0.0
 */
public enum Domain {

    ANY("a finite number"),
    NON_NEGATIVE("a number >= 0"),
    POSITIVE("a number > 0"),
    UNIT_INTERVAL("a number in [0, 1]");

    private final String description;

    Domain(String description) {
        this.description = description;
    }

    public boolean accepts(double value) {
        if (!Double.isFinite(value)) {
            return false;
        }
        return switch (this) {
            case ANY -> true;
            case NON_NEGATIVE -> value >= 0;
            case POSITIVE -> value > 0;
            case UNIT_INTERVAL -> value >= 0 && value <= 1;
        };
    }

    public String getDescription() {
        return description;
    }
}
