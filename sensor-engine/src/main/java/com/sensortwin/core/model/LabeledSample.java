package com.sensortwin.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * One output record per sensor per timestep: the observed reading together
 * with the ground-truth labels derived from the same environment state.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"sensorId", "timestampUsec", "position", "modality", "observedReading", "groundTruth"})
public final class LabeledSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long timestampUsec;
    private final ObservedReading observedReading;
    private final List<AnomalyLabel> groundTruth;

    /**
     * @param timestampUsec   sample timestamp in microseconds since the epoch
     * @param observedReading the corrupted reading; must not be {@code null}
     * @param groundTruth     labels (possibly empty); must not be {@code null}
     */
    public LabeledSample(long timestampUsec, ObservedReading observedReading, List<AnomalyLabel> groundTruth) {
        this.timestampUsec = timestampUsec;
        this.observedReading = Objects.requireNonNull(observedReading, "observedReading must not be null");
        this.groundTruth = List.copyOf(Objects.requireNonNull(groundTruth, "groundTruth must not be null"));
    }

    public String getSensorId() {
        return observedReading.getSensorId();
    }

    public long getTimestampUsec() {
        return timestampUsec;
    }

    public Position3D getPosition() {
        return observedReading.getPosition();
    }

    public String getModality() {
        return observedReading.getModality();
    }

    public ObservedReading getObservedReading() {
        return observedReading;
    }

    /**
     * @return unmodifiable list of labels
     */
    public List<AnomalyLabel> getGroundTruth() {
        return groundTruth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LabeledSample that))
            return false;
        return timestampUsec == that.timestampUsec
                && observedReading.equals(that.observedReading)
                && groundTruth.equals(that.groundTruth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestampUsec, observedReading, groundTruth);
    }

    @Override
    public String toString() {
        return "LabeledSample{" +
                "sensorId='" + getSensorId() + '\'' +
                ", timestampUsec=" + timestampUsec +
                ", observedReading=" + observedReading +
                ", groundTruth=" + groundTruth +
                '}';
    }
}
