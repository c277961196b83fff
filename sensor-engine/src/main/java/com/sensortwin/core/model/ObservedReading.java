package com.sensortwin.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The reading a simulated instrument reports after every imperfection stage.
 *
 * <p>
 * Carries the corrupted primary quantity, an optional {@link Spectrum} and
 * the sample metadata. When spectrum output is disabled the spectrum is
 * absent, not empty, and is left out of serialized output.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code sensorId}, {@code modality},
 * {@code position} and {@code timestamp} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ObservedReading implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sensorId;
    private final Modality modality;
    private final Position3D position;
    private final Instant timestamp;
    private final String primaryField;
    private final double primaryValue;
    private final Spectrum spectrum;

    private ObservedReading(Builder builder) {
        this.sensorId = Objects.requireNonNull(builder.sensorId, "sensorId must not be null");
        this.modality = Objects.requireNonNull(builder.modality, "modality must not be null");
        this.position = Objects.requireNonNull(builder.position, "position must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.primaryField = builder.primaryField != null
                ? builder.primaryField
                : modality.getPrimaryField();
        this.primaryValue = builder.primaryValue;
        this.spectrum = builder.spectrum;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ObservedReading} instances.
     */
    public static class Builder {
        private String sensorId;
        private Modality modality;
        private Position3D position;
        private Instant timestamp;
        private String primaryField;
        private double primaryValue;
        private Spectrum spectrum;

        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }

        public Builder modality(Modality modality) {
            this.modality = modality;
            return this;
        }

        public Builder position(Position3D position) {
            this.position = position;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /** Defaults to the modality's primary field name. */
        public Builder primaryField(String primaryField) {
            this.primaryField = primaryField;
            return this;
        }

        public Builder primaryValue(double primaryValue) {
            this.primaryValue = primaryValue;
            return this;
        }

        public Builder spectrum(Spectrum spectrum) {
            this.spectrum = spectrum;
            return this;
        }

        public ObservedReading build() {
            return new ObservedReading(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSensorId() {
        return sensorId;
    }

    public String getModality() {
        return modality.getKey();
    }

    @JsonIgnore
    public Modality getModalityType() {
        return modality;
    }

    public Position3D getPosition() {
        return position;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getPrimaryField() {
        return primaryField;
    }

    public double getPrimaryValue() {
        return primaryValue;
    }

    /**
     * @return the spectrum, or {@code null} when spectrum output is disabled
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Spectrum getSpectrum() {
        return spectrum;
    }

    @JsonIgnore
    public Optional<Spectrum> findSpectrum() {
        return Optional.ofNullable(spectrum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ObservedReading that))
            return false;
        return Double.compare(primaryValue, that.primaryValue) == 0
                && sensorId.equals(that.sensorId)
                && modality == that.modality
                && position.equals(that.position)
                && timestamp.equals(that.timestamp)
                && primaryField.equals(that.primaryField)
                && Objects.equals(spectrum, that.spectrum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorId, modality, position, timestamp, primaryField, primaryValue, spectrum);
    }

    @Override
    public String toString() {
        return "ObservedReading{" +
                "sensorId='" + sensorId + '\'' +
                ", modality=" + modality.getKey() +
                ", position=" + position +
                ", timestamp=" + timestamp +
                ", " + primaryField + '=' + primaryValue +
                ", spectrum=" + spectrum +
                '}';
    }
}
