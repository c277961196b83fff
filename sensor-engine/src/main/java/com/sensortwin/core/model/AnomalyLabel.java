package com.sensortwin.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A ground-truth anomaly annotation attached to one sample.
 *
 * @since 1.0.0
 */
public final class AnomalyLabel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String anomalyType;
    private final double severity;
    private final double confidence;

    /**
     * @param anomalyType non-blank label type, e.g. {@code corona_discharge}
     * @param severity    non-negative severity
     * @param confidence  confidence in [0, 1]
     * @throws IllegalArgumentException if any value is out of range
     */
    public AnomalyLabel(String anomalyType, double severity, double confidence) {
        Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        if (anomalyType.isBlank()) {
            throw new IllegalArgumentException("anomalyType must not be blank");
        }
        if (!(severity >= 0) || Double.isInfinite(severity)) {
            throw new IllegalArgumentException("severity must be finite and >= 0, got: " + severity);
        }
        if (!(confidence >= 0 && confidence <= 1)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
        this.anomalyType = anomalyType;
        this.severity = severity;
        this.confidence = confidence;
    }

    @JsonProperty("type")
    public String getAnomalyType() {
        return anomalyType;
    }

    public double getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyLabel that))
            return false;
        return Double.compare(severity, that.severity) == 0
                && Double.compare(confidence, that.confidence) == 0
                && anomalyType.equals(that.anomalyType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyType, severity, confidence);
    }

    @Override
    public String toString() {
        return "AnomalyLabel{type='" + anomalyType + '\''
                + ", severity=" + severity
                + ", confidence=" + confidence + '}';
    }
}
