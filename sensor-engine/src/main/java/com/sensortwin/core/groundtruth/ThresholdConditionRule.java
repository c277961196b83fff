package com.sensortwin.core.groundtruth;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.ObservedReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Labels an observed primary value strictly above a threshold. Severity and
 * confidence are both fixed by configuration.
 *
 * @since 1.0.0
 */
public class ThresholdConditionRule implements LabelRule {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdConditionRule.class);

    private final String labelType;
    private final double threshold;
    private final double severity;
    private final double confidence;

    public ThresholdConditionRule(String labelType, double threshold, double severity, double confidence) {
        this.labelType = Objects.requireNonNull(labelType, "Label type must not be null");
        this.threshold = threshold;
        this.severity = severity;
        this.confidence = confidence;
    }

    @Override
    public Optional<AnomalyLabel> evaluate(EnvironmentQuery environment, ObservedReading observed) {
        double v = observed.getPrimaryValue();
        if (v > threshold) {
            LOG.debug("Label [{}] present for {}: {}={} > threshold={}",
                    labelType, observed.getSensorId(), observed.getPrimaryField(), v, threshold);
            return Optional.of(new AnomalyLabel(labelType, severity, confidence));
        }
        return Optional.empty();
    }

    @Override
    public String getLabelType() {
        return labelType;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return "ThresholdConditionRule{" + labelType + " > " + threshold + '}';
    }
}
