package com.sensortwin.core.groundtruth;

import com.sensortwin.core.config.LabelSpec;
import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.Modality;
import com.sensortwin.core.model.ObservedReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the ground-truth labels of a sample from the environment and the
 * observed reading.
 *
 * <p>
 * Every rule is evaluated independently; simultaneous conditions produce one
 * label each, in rule order. Evaluation never fails: a rule that throws is
 * logged and treated as absent.
 * </p>
 *
 * @since 1.0.0
 */
public final class GroundTruthEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(GroundTruthEvaluator.class);

    private final List<LabelRule> rules;

    public GroundTruthEvaluator(List<LabelRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules must not be null"));
    }

    /**
     * Build the evaluator of {@code modality} from the label keys of
     * {@code config}.
     */
    public static GroundTruthEvaluator forSensor(Modality modality, SensorConfig config) {
        Objects.requireNonNull(config, "SensorConfig must not be null");
        List<LabelRule> rules = new ArrayList<>();
        for (LabelSpec label : ParameterTables.labelSpecs(modality)) {
            double scale = config.getDouble(label.severityScaleKey());
            double confidence = config.getDouble(label.confidenceKey());
            if (label.getKind() == LabelSpec.Kind.CONDITION) {
                rules.add(new EnvironmentConditionRule(label.getLabelType(),
                        config.getString(label.fieldKey()), scale, confidence));
            } else {
                rules.add(new ThresholdConditionRule(label.getLabelType(),
                        config.getDouble(label.thresholdKey()), scale, confidence));
            }
        }
        return new GroundTruthEvaluator(rules);
    }

    /**
     * @param environment environment state of the sample
     * @param observed    the sensor's final reading
     * @return unmodifiable list of labels, possibly empty
     */
    public List<AnomalyLabel> evaluate(EnvironmentQuery environment, ObservedReading observed) {
        Objects.requireNonNull(environment, "EnvironmentQuery must not be null");
        Objects.requireNonNull(observed, "ObservedReading must not be null");

        List<AnomalyLabel> labels = new ArrayList<>();
        for (LabelRule rule : rules) {
            try {
                Optional<AnomalyLabel> label = rule.evaluate(environment, observed);
                label.ifPresent(labels::add);
            } catch (RuntimeException e) {
                LOG.warn("Label [{}] could not be evaluated for {}: {}",
                        rule.getLabelType(), observed.getSensorId(), e.toString());
            }
        }
        return Collections.unmodifiableList(labels);
    }

    public List<LabelRule> getRules() {
        return rules;
    }
}
