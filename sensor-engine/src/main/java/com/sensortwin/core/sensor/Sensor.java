package com.sensortwin.core.sensor;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.IdealReading;
import com.sensortwin.core.model.LabeledSample;
import com.sensortwin.core.model.Modality;
import com.sensortwin.core.model.ObservedReading;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.SampleTime;

import java.util.List;
import java.util.Map;

/**
 * A simulated instrument at a position in the digital twin.
 *
 * <p>
 * Per sample, the driver reads the ideal value from the environment, corrupts
 * it with {@link #applyImperfections} and labels the result with
 * {@link #getGroundTruth}. Ground truth is computed after the observed
 * reading, because threshold labels compare against it. Implementations are
 * safe to sample from several threads as long as each call gets its own
 * {@link SampleTime}.
 * </p>
 *
 * @since 1.0.0
 */
public interface Sensor {

    String getSensorId();

    Modality getModality();

    Position3D getPosition();

    /**
     * Move the sensor. Takes effect from the next sample on.
     */
    void moveTo(Position3D position);

    /**
     * Read the true physical value at the sensor's position.
     *
     * @param environment environment state; must not be {@code null}
     * @return the ideal reading; a missing field reads as zero
     */
    IdealReading readIdeal(EnvironmentQuery environment);

    /**
     * Run the imperfection pipeline on {@code ideal}.
     *
     * @param ideal       the ideal reading
     * @param environment environment state of the sample
     * @param time        step and elapsed time of the sample
     * @return the observed reading
     */
    ObservedReading applyImperfections(IdealReading ideal, EnvironmentQuery environment, SampleTime time);

    /**
     * Derive the ground-truth labels of a sample. Never throws for missing
     * environment data and has no side effects.
     *
     * @param environment environment state of the sample
     * @param observed    result of {@link #applyImperfections}
     * @return unmodifiable list of labels, possibly empty
     */
    List<AnomalyLabel> getGroundTruth(EnvironmentQuery environment, ObservedReading observed);

    /**
     * Describe the sensor for downstream training jobs: identity, placement,
     * resolved parameters and calibration state. Keys are snake_case so the
     * map serializes next to the sample records.
     *
     * @return unmodifiable, insertion-ordered map
     */
    Map<String, Object> getMlMetadata();

    /**
     * Produce one labeled sample.
     */
    default LabeledSample sample(EnvironmentQuery environment, SampleTime time) {
        IdealReading ideal = readIdeal(environment);
        ObservedReading observed = applyImperfections(ideal, environment, time);
        List<AnomalyLabel> labels = getGroundTruth(environment, observed);
        return new LabeledSample(time.getTimestampUsec(), observed, labels);
    }
}
