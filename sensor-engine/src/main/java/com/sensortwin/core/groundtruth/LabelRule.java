package com.sensortwin.core.groundtruth;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.ObservedReading;

import java.util.Optional;

/**
 * Decides whether one anomaly type is present in a sample.
 *
 * <p>
 * Rules are stateless: the same environment and observed reading always give
 * the same answer.
 * </p>
 *
 * @since 1.0.0
 */
public interface LabelRule {

    /**
     * @param environment environment state of the sample
     * @param observed    the sensor's final reading for the sample
     * @return the label if the anomaly is present, empty otherwise
     */
    Optional<AnomalyLabel> evaluate(EnvironmentQuery environment, ObservedReading observed);

    /**
     * @return the anomaly type this rule emits
     */
    String getLabelType();
}
