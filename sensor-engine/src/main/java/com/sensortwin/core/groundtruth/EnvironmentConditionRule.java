package com.sensortwin.core.groundtruth;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.environment.Environments;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.ObservedReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Labels a state-based anomaly read from an environment field.
 *
 * <p>
 * The label is present whenever the field is defined and non-zero at the
 * sensor's position, with {@code severity = |value| * scale} and a fixed
 * confidence. A missing field means the condition is absent.
 * </p>
 *
 * @since 1.0.0
 */
public class EnvironmentConditionRule implements LabelRule {

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentConditionRule.class);

    private final String labelType;
    private final String field;
    private final double severityScale;
    private final double confidence;

    public EnvironmentConditionRule(String labelType, String field, double severityScale, double confidence) {
        this.labelType = Objects.requireNonNull(labelType, "Label type must not be null");
        this.field = Objects.requireNonNull(field, "Field must not be null for label '" + labelType + "'");
        this.severityScale = severityScale;
        this.confidence = confidence;
    }

    @Override
    public Optional<AnomalyLabel> evaluate(EnvironmentQuery environment, ObservedReading observed) {
        OptionalDouble value = Environments.fieldValue(environment, field, observed.getPosition());
        if (value.isEmpty() || value.getAsDouble() == 0.0) {
            LOG.trace("Label [{}]: field '{}' absent or zero, skipping", labelType, field);
            return Optional.empty();
        }
        double raw = value.getAsDouble();
        LOG.debug("Label [{}] present for {}: {}={}", labelType, observed.getSensorId(), field, raw);
        return Optional.of(new AnomalyLabel(labelType, Math.abs(raw) * severityScale, confidence));
    }

    @Override
    public String getLabelType() {
        return labelType;
    }

    public String getField() {
        return field;
    }

    @Override
    public String toString() {
        return "EnvironmentConditionRule{" + labelType + " <- " + field + '}';
    }
}
