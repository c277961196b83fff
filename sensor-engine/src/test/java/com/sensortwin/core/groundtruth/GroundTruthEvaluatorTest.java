package com.sensortwin.core.groundtruth;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.Modality;
import com.sensortwin.core.model.ObservedReading;
import com.sensortwin.core.model.Position3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GroundTruthEvaluator} and its rules.
 */
class GroundTruthEvaluatorTest {

    private static ObservedReading emfReading(double value) {
        return ObservedReading.builder()
                .sensorId("emf-test")
                .modality(Modality.EMF)
                .position(Position3D.ORIGIN)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .primaryValue(value)
                .build();
    }

    private static GroundTruthEvaluator emfEvaluator(Map<String, ?> overrides) {
        SensorConfig config = SensorConfig.resolve(ParameterTables.forModality(Modality.EMF), overrides);
        return GroundTruthEvaluator.forSensor(Modality.EMF, config);
    }

    /** An environment whose every query fails. */
    private static final EnvironmentQuery BROKEN = new EnvironmentQuery() {
        @Override
        public OptionalDouble getFieldValue(String fieldName, Position3D position) {
            throw new IllegalStateException("backend unavailable");
        }

        @Override
        public List<InterferenceSource> getNearbySources(Position3D position, double radius) {
            throw new IllegalStateException("backend unavailable");
        }
    };

    @Nested
    @DisplayName("Condition labels")
    class Conditions {

        @Test
        @DisplayName("Should scale the field value into severity")
        void shouldScaleSeverity() {
            StaticEnvironment env = StaticEnvironment.builder().field("corona_discharge", 0.5).build();

            List<AnomalyLabel> labels = emfEvaluator(Map.of()).evaluate(env, emfReading(10.0));

            assertThat(labels).containsExactly(new AnomalyLabel("corona_discharge", 50.0, 0.9));
        }

        @Test
        @DisplayName("A missing or zero field should mean the condition is absent")
        void missingFieldShouldBeAbsent() {
            GroundTruthEvaluator evaluator = emfEvaluator(Map.of());

            assertThat(evaluator.evaluate(StaticEnvironment.empty(), emfReading(10.0))).isEmpty();
            assertThat(evaluator.evaluate(StaticEnvironment.builder().field("corona_discharge", 0.0).build(),
                    emfReading(10.0))).isEmpty();
        }

        @Test
        @DisplayName("Should read the field named in configuration")
        void shouldHonorCustomField() {
            GroundTruthEvaluator evaluator = emfEvaluator(Map.of("corona_field", "pd_activity"));
            StaticEnvironment env = StaticEnvironment.builder()
                    .field("corona_discharge", 1.0)
                    .field("pd_activity", 0.5)
                    .build();

            assertThat(evaluator.evaluate(env, emfReading(10.0)))
                    .extracting(AnomalyLabel::getSeverity)
                    .containsExactly(50.0);
        }

        @Test
        @DisplayName("Simultaneous conditions should each produce a label")
        void shouldLabelEveryCondition() {
            StaticEnvironment env = StaticEnvironment.builder()
                    .field("corona_discharge", 0.2)
                    .field("arcing_intensity", 0.4)
                    .build();

            List<AnomalyLabel> labels = emfEvaluator(Map.of()).evaluate(env, emfReading(600.0));

            assertThat(labels).extracting(AnomalyLabel::getAnomalyType)
                    .containsExactly("corona_discharge", "arcing", "overload");
        }
    }

    @Nested
    @DisplayName("Threshold labels")
    class Thresholds {

        private final GroundTruthEvaluator evaluator = emfEvaluator(Map.of("overload_severity_scale", 50.0));

        @Test
        @DisplayName("Should fire strictly above the threshold")
        void shouldFireAboveThreshold() {
            assertThat(evaluator.evaluate(StaticEnvironment.empty(), emfReading(600.0)))
                    .containsExactly(new AnomalyLabel("overload", 50.0, 0.95));
            assertThat(evaluator.evaluate(StaticEnvironment.empty(), emfReading(500.0))).isEmpty();
            assertThat(evaluator.evaluate(StaticEnvironment.empty(), emfReading(499.9))).isEmpty();
        }
    }

    @Test
    @DisplayName("Evaluation should be idempotent")
    void evaluationShouldBeIdempotent() {
        GroundTruthEvaluator evaluator = emfEvaluator(Map.of());
        StaticEnvironment env = StaticEnvironment.builder().field("arcing_intensity", 1.5).build();
        ObservedReading reading = emfReading(700.0);

        assertThat(evaluator.evaluate(env, reading)).isEqualTo(evaluator.evaluate(env, reading));
    }

    @Test
    @DisplayName("A failing environment should yield no condition labels but keep threshold labels")
    void failingEnvironmentShouldNotAbort() {
        List<AnomalyLabel> labels = emfEvaluator(Map.of()).evaluate(BROKEN, emfReading(600.0));

        assertThat(labels).extracting(AnomalyLabel::getAnomalyType).containsExactly("overload");
    }

    @Test
    @DisplayName("A throwing rule should be treated as absent")
    void throwingRuleShouldBeSwallowed() {
        LabelRule broken = new LabelRule() {
            @Override
            public Optional<AnomalyLabel> evaluate(EnvironmentQuery environment, ObservedReading observed) {
                throw new IllegalStateException("rule failure");
            }

            @Override
            public String getLabelType() {
                return "broken";
            }
        };
        GroundTruthEvaluator evaluator = new GroundTruthEvaluator(List.of(
                broken, new ThresholdConditionRule("overload", 1.0, 1.0, 1.0)));

        assertThat(evaluator.evaluate(StaticEnvironment.empty(), emfReading(2.0)))
                .extracting(AnomalyLabel::getAnomalyType)
                .containsExactly("overload");
    }

    @Test
    @DisplayName("Returned labels should be unmodifiable")
    void labelsShouldBeUnmodifiable() {
        List<AnomalyLabel> labels = emfEvaluator(Map.of()).evaluate(StaticEnvironment.empty(), emfReading(600.0));

        assertThatThrownBy(labels::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Every modality should build one rule per label type")
    void everyModalityShouldBuildRules() {
        for (Modality modality : Modality.values()) {
            Map<String, ?> overrides = modality == Modality.CHEMICAL ? Map.of("target_species", "sf6_ppb") : Map.of();
            SensorConfig config = SensorConfig.resolve(ParameterTables.forModality(modality), overrides);

            assertThat(GroundTruthEvaluator.forSensor(modality, config).getRules())
                    .hasSize(ParameterTables.labelSpecs(modality).size());
        }
    }
}
