package com.sensortwin.runner;

import com.sensortwin.core.config.ScenarioConfig;
import com.sensortwin.core.config.ScenarioLoader;
import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.LabeledSample;
import com.sensortwin.core.model.ObservedReading;
import com.sensortwin.core.model.SampleTime;
import com.sensortwin.core.sensor.Sensor;
import com.sensortwin.core.sensor.SensorFactory;
import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.IdealReading;
import com.sensortwin.core.model.Modality;
import com.sensortwin.core.model.Position3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScenarioDriver}.
 */
class ScenarioDriverTest {

    private final ScenarioConfig scenario = ScenarioLoader.fromClasspath("runner-scenario.yml");

    private List<LabeledSample> runWith(int parallelism) throws Exception {
        List<Sensor> sensors = SensorFactory.createAll(scenario.getName(), scenario.getSensors());
        EnvironmentQuery environment = scenario.getEnvironment().toEnvironment();
        List<LabeledSample> samples = new ArrayList<>();
        try (ScenarioDriver driver = new ScenarioDriver(sensors, environment, parallelism)) {
            RunSummary summary = driver.run(scenario.getSteps(), scenario.startInstant(),
                    scenario.getStepSeconds(), samples::add);
            assertThat(summary.getSamples()).isEqualTo(samples.size());
        }
        return samples;
    }

    @Test
    @DisplayName("Output should not depend on the number of worker threads")
    void outputShouldBeIndependentOfParallelism() throws Exception {
        List<LabeledSample> sequential = runWith(1);
        List<LabeledSample> parallel = runWith(4);

        assertThat(sequential).hasSize(16);
        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    @DisplayName("Samples should be emitted step by step in sensor order")
    void samplesShouldFollowStepAndSensorOrder() throws Exception {
        List<LabeledSample> samples = runWith(2);

        assertThat(samples.subList(0, 4)).extracting(LabeledSample::getSensorId)
                .containsExactly("emf-a", "emf-b", "mic-a", "hot-a");
        assertThat(samples.get(4).getTimestampUsec() - samples.get(0).getTimestampUsec())
                .isEqualTo(1800L * 1_000_000L);
        assertThat(samples).filteredOn(s -> s.getSensorId().equals("emf-b"))
                .allSatisfy(s -> assertThat(s.getObservedReading().getSpectrum()).isNull());
    }

    @Test
    @DisplayName("The summary should count labels by type")
    void summaryShouldCountLabels() throws Exception {
        List<Sensor> sensors = SensorFactory.createAll(scenario.getName(), scenario.getSensors());
        try (ScenarioDriver driver = new ScenarioDriver(sensors, scenario.getEnvironment().toEnvironment(), 2)) {
            RunSummary summary = driver.run(4, Instant.parse("2024-06-01T00:00:00Z"), 1800, sample -> { });

            assertThat(summary.getSteps()).isEqualTo(4);
            assertThat(summary.getSamples()).isEqualTo(16);
            assertThat(summary.getLabelCounts())
                    .containsEntry("corona_discharge", 12L)
                    .containsEntry("overheat", 4L);
        }
    }

    @Test
    @DisplayName("Zero steps should produce no samples")
    void zeroStepsShouldProduceNothing() throws Exception {
        List<Sensor> sensors = SensorFactory.createAll(scenario.getName(), scenario.getSensors());
        List<LabeledSample> samples = new ArrayList<>();
        try (ScenarioDriver driver = new ScenarioDriver(sensors, StaticEnvironment.empty(), 1)) {
            RunSummary summary = driver.run(0, Instant.EPOCH, 1.0, samples::add);

            assertThat(summary.getSamples()).isZero();
            assertThat(samples).isEmpty();
        }
    }

    @Test
    @DisplayName("A failing sensor should fail the step")
    void failingSensorShouldFailStep() {
        Sensor broken = new Sensor() {
            @Override
            public String getSensorId() {
                return "broken";
            }

            @Override
            public Modality getModality() {
                return Modality.THERMAL;
            }

            @Override
            public Position3D getPosition() {
                return Position3D.ORIGIN;
            }

            @Override
            public void moveTo(Position3D position) {
            }

            @Override
            public IdealReading readIdeal(EnvironmentQuery environment) {
                throw new IllegalStateException("sensor fault");
            }

            @Override
            public ObservedReading applyImperfections(IdealReading ideal, EnvironmentQuery environment,
                    SampleTime time) {
                throw new UnsupportedOperationException();
            }

            @Override
            public List<AnomalyLabel> getGroundTruth(EnvironmentQuery environment, ObservedReading observed) {
                return List.of();
            }

            @Override
            public Map<String, Object> getMlMetadata() {
                return Map.of();
            }
        };

        try (ScenarioDriver driver = new ScenarioDriver(List.of(broken), StaticEnvironment.empty(), 1)) {
            assertThatThrownBy(() -> driver.runStep(SampleTime.atStep(Instant.EPOCH, 0, 1.0)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("sensor fault");
        }
    }

    @Test
    @DisplayName("Parallelism must be at least one")
    void parallelismMustBePositive() {
        assertThatThrownBy(() -> new ScenarioDriver(List.of(), StaticEnvironment.empty(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
