package com.sensortwin.core.sensor;

import com.sensortwin.core.config.SensorDefinition;
import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.IdealReading;
import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.LabeledSample;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.SampleTime;
import com.sensortwin.core.model.Spectrum;
import com.sensortwin.core.model.Vector3;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link ModalitySensor}, exercising whole samples through the
 * factory-built pipelines.
 */
class ModalitySensorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private static Sensor sensor(String id, String modality, Map<String, Object> params) {
        SensorDefinition definition = new SensorDefinition();
        definition.setId(id);
        definition.setModality(modality);
        definition.setParams(params);
        return SensorFactory.create(definition);
    }

    /** EMF parameters with every drift and noise source switched off. */
    private static Map<String, Object> quietEmf() {
        Map<String, Object> params = new HashMap<>();
        params.put("calibration_gain_drift_per_hour", 0.0);
        params.put("calibration_offset_drift_per_hour", 0.0);
        params.put("calibration_nonlinearity_factor", 0.0);
        params.put("orientation_uncertainty", false);
        params.put("noise_characteristics", Map.of("type", "none"));
        return params;
    }

    @Test
    @DisplayName("An EMF sample above the overload threshold should be labeled overload")
    void emfOverloadEndToEnd() {
        Sensor emf = sensor("emf-1", "emf", quietEmf());
        StaticEnvironment env = StaticEnvironment.builder().field("ac_field_strength", 600.0).build();

        LabeledSample sample = emf.sample(env, SampleTime.atStep(START, 0, 1.0));

        assertThat(sample.getObservedReading().getPrimaryValue()).isCloseTo(600.0, within(1e-9));
        assertThat(sample.getObservedReading().getPrimaryField()).isEqualTo("ac_field_strength");
        assertThat(sample.getObservedReading().getSpectrum()).isNotNull();
        assertThat(sample.getGroundTruth()).extracting(AnomalyLabel::getAnomalyType).containsExactly("overload");
        assertThat(sample.getTimestampUsec()).isEqualTo(START.getEpochSecond() * 1_000_000L);
    }

    @Test
    @DisplayName("Disabling spectrum output should omit the spectrum")
    void spectrumDisabledShouldOmitSpectrum() {
        Map<String, Object> params = quietEmf();
        params.put("enable_spectrum_output", false);
        Sensor emf = sensor("emf-1", "emf", params);
        StaticEnvironment env = StaticEnvironment.builder().field("ac_field_strength", 100.0).build();

        LabeledSample sample = emf.sample(env, SampleTime.atStep(START, 0, 1.0));

        assertThat(sample.getObservedReading().getSpectrum()).isNull();
        assertThat(sample.getObservedReading().findSpectrum()).isEmpty();
    }

    @Test
    @DisplayName("A corona condition should add high-frequency noise and a corona label")
    void coronaShouldShapeSpectrumAndLabel() {
        Sensor emf = sensor("emf-1", "emf", quietEmf());
        StaticEnvironment env = StaticEnvironment.builder()
                .field("ac_field_strength", 100.0)
                .field("corona_discharge", 0.5)
                .build();

        LabeledSample sample = emf.sample(env, SampleTime.atStep(START, 0, 1.0));

        Spectrum spectrum = sample.getObservedReading().getSpectrum();
        assertThat(spectrum.contains(Spectrum.HIGH_FREQUENCY_NOISE)).isTrue();
        assertThat(spectrum.get(Spectrum.EMI_NOISE_FLOOR)).hasValue(0.0);
        assertThat(sample.getGroundTruth()).containsExactly(new AnomalyLabel("corona_discharge", 50.0, 0.9));
    }

    @Test
    @DisplayName("Identical seeds, steps and environments should give identical samples")
    void samplesShouldBeDeterministic() {
        Map<String, Object> params = Map.of("noise_characteristics", Map.of("stddev", 2.0));
        StaticEnvironment env = StaticEnvironment.builder()
                .field("ac_field_strength", 120.0)
                .vector("ac_field_vector", new Vector3(0.0, 0.6, 0.8))
                .source(new InterferenceSource(new Position3D(3, 0, 0), 50.0, 4.0))
                .build();

        SampleTime time = SampleTime.atStep(START, 7, 60.0);
        LabeledSample first = sensor("emf-d", "emf", params).sample(env, time);
        LabeledSample second = sensor("emf-d", "emf", params).sample(env, time);
        LabeledSample otherStep = sensor("emf-d", "emf", params).sample(env, SampleTime.atStep(START, 8, 60.0));

        assertThat(first).isEqualTo(second);
        assertThat(first.getObservedReading().getPrimaryValue())
                .isNotEqualTo(otherStep.getObservedReading().getPrimaryValue());
    }

    @Test
    @DisplayName("readIdeal should read zero for a missing field and fall back to the vector norm")
    void readIdealShouldHandleMissingFields() {
        Sensor emf = sensor("emf-1", "emf", Map.of());

        assertThat(emf.readIdeal(StaticEnvironment.empty()).getMagnitude()).isEqualTo(0.0);

        IdealReading fromVector = emf.readIdeal(StaticEnvironment.builder()
                .vector("ac_field_vector", new Vector3(3.0, 4.0, 0.0))
                .field("dominant_frequency_hz", 50.0)
                .build());
        assertThat(fromVector.getMagnitude()).isCloseTo(5.0, within(1e-12));
        assertThat(fromVector.getDominantFrequencyHz()).hasValue(50.0);
    }

    @Test
    @DisplayName("A chemical sensor should read the field named by its target species")
    void chemicalShouldReadTargetSpecies() {
        Sensor gas = sensor("gas-1", "chemical", Map.of("target_species", "sf6_ppb"));
        StaticEnvironment env = StaticEnvironment.builder()
                .field("sf6_ppb", 42.0)
                .field("concentration_ppb", 7.0)
                .build();

        assertThat(gas.readIdeal(env).getMagnitude()).isEqualTo(42.0);
    }

    @Test
    @DisplayName("General drift should count the initial operating hours")
    void driftShouldIncludeInitialHours() {
        Map<String, Object> params = new HashMap<>();
        params.put("initial_operating_hours", 100.0);
        params.put("drift_parameters", Map.of("baseline_drift_per_hour", 0.5));
        params.put("noise_characteristics", Map.of("type", "none"));
        Sensor pm = sensor("pm-1", "particulate", params);
        StaticEnvironment env = StaticEnvironment.builder().field("pm2_5", 10.0).build();

        LabeledSample sample = pm.sample(env, new SampleTime(3, START.plusSeconds(7200), 2.0));

        assertThat(sample.getObservedReading().getPrimaryValue()).isCloseTo(61.0, within(1e-9));
        assertThat(sample.getGroundTruth()).containsExactly(new AnomalyLabel("pm_exceedance", 1.0, 0.9));
    }

    @Test
    @DisplayName("An overflowing spectrum should skip spectrum analysis and still produce a sample")
    void spectrumOverflowShouldNotAbortSample() {
        Map<String, Object> params = quietEmf();
        params.put("harmonic_3_ratio", 10.0);
        params.put("frequency_noise", false);
        Sensor emf = sensor("emf-1", "emf", params);
        StaticEnvironment env = StaticEnvironment.builder().field("ac_field_strength", 1e308).build();

        LabeledSample sample = emf.sample(env, SampleTime.atStep(START, 0, 1.0));

        assertThat(sample.getObservedReading().getPrimaryValue()).isEqualTo(1e308);
        assertThat(sample.getObservedReading().getSpectrum()).isNull();
        assertThat(sample.getGroundTruth()).extracting(AnomalyLabel::getAnomalyType).containsExactly("overload");
    }

    @Test
    @DisplayName("Environment misses should never abort a sample")
    void missesShouldNotAbortSample() {
        Sensor emf = sensor("emf-1", "emf", Map.of());
        emf.moveTo(new Position3D(100, 100, 100));
        StaticEnvironment bounded = StaticEnvironment.builder()
                .field("ac_field_strength", 600.0)
                .field("corona_discharge", 1.0)
                .bounds(new Position3D(-10, -10, -10), new Position3D(10, 10, 10))
                .build();

        LabeledSample sample = emf.sample(bounded, SampleTime.atStep(START, 0, 1.0));

        assertThat(sample.getPosition()).isEqualTo(new Position3D(100, 100, 100));
        assertThat(sample.getObservedReading().getPrimaryValue()).isGreaterThanOrEqualTo(0.0);
        assertThat(sample.getGroundTruth()).isEmpty();
    }

    @Test
    @DisplayName("The drift state should expose the configured calibration parameters")
    void driftStateShouldReflectConfig() {
        ModalitySensor thermal = (ModalitySensor) sensor("t-1", "thermal",
                Map.of("calibration_gain_error_factor", 1.05, "calibration_offset", -0.3));

        assertThat(thermal.getDriftState().getBaseGain()).isEqualTo(1.05);
        assertThat(thermal.getDriftState().getBaseOffset()).isEqualTo(-0.3);
        assertThat(thermal.getDriftState().gainAt(0.0)).isEqualTo(1.05);
    }

    @Test
    @DisplayName("Training metadata should carry identity, placement, calibration and resolved parameters")
    void mlMetadataShouldDescribeSensor() {
        SensorDefinition definition = new SensorDefinition();
        definition.setId("t-2");
        definition.setModality("thermal");
        definition.setPosition(List.of(1.0, 2.0, 3.0));
        definition.setParams(Map.of("calibration_gain_error_factor", 1.05, "calibration_offset", -0.3));
        Sensor thermal = SensorFactory.create(definition);

        Map<String, Object> metadata = thermal.getMlMetadata();

        assertThat(metadata).containsEntry("sensor_id", "t-2")
                .containsEntry("modality", "thermal")
                .containsEntry("position", List.of(1.0, 2.0, 3.0));
        assertThat(metadata.get("stages")).asInstanceOf(InstanceOfAssertFactories.LIST)
                .contains("calibration_drift", "noise_injection");
        assertThat(metadata.get("calibration")).asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
                .containsEntry("base_gain", 1.05)
                .containsEntry("base_offset", -0.3);
        assertThat(metadata.get("parameters")).asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
                .containsEntry("calibration_gain_error_factor", 1.05)
                .containsEntry("noise_characteristics.type", "gaussian");
    }

    @Test
    @DisplayName("Training metadata should follow the sensor when it moves")
    void mlMetadataShouldTrackPosition() {
        Sensor emf = sensor("emf-2", "emf", quietEmf());
        emf.moveTo(new Position3D(4, 5, 6));

        assertThat(emf.getMlMetadata()).containsEntry("position", List.of(4.0, 5.0, 6.0));
        assertThatThrownBy(() -> emf.getMlMetadata().put("extra", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
