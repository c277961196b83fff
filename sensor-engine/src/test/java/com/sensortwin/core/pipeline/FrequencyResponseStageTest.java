package com.sensortwin.core.pipeline;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.Spectrum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FrequencyResponseStage}.
 */
class FrequencyResponseStageTest {

    private static final Map<String, Double> CURVE = Map.of("fundamental", 1.0, "3rd", 0.5);
    private static final Map<Double, Double> GAINS = Map.of(50.0, 0.8, 60.0, 0.9, 70.0, 1.1);

    private static FrequencyResponseStage stage(double tempCoeff) {
        return new FrequencyResponseStage(CURVE, 2.0, tempCoeff, 25.0, "ambient_temperature_c",
                GAINS, 5.0, 1.0, 60.0);
    }

    private static StageContext context(EnvironmentQuery env) {
        return new StageContext("mic-test", Position3D.ORIGIN, env, new Random(1), 0.0);
    }

    private static ReadingState withSpectrum(double fundamental) {
        return ReadingState.scalar(fundamental).withSpectrum(Spectrum.empty()
                .with("fundamental", fundamental)
                .with("3rd", 4.0)
                .with("high_frequency_noise", 1.0));
    }

    @Test
    @DisplayName("Should apply the curve, default multiplier and let the primary follow the fundamental")
    void shouldApplyCurve() {
        ReadingState result = stage(0.001).apply(withSpectrum(10.0), context(StaticEnvironment.empty()));

        Spectrum spectrum = result.getSpectrum().orElseThrow();
        assertThat(spectrum.get("fundamental")).hasValue(10.0);
        assertThat(spectrum.get("3rd")).hasValue(2.0);
        assertThat(spectrum.get("high_frequency_noise")).hasValue(2.0);
        assertThat(result.getPrimary()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should correct the curve for ambient temperature")
    void shouldCorrectForTemperature() {
        StaticEnvironment warm = StaticEnvironment.builder().field("ambient_temperature_c", 35.0).build();

        ReadingState result = stage(0.01).apply(withSpectrum(10.0), context(warm));

        assertThat(result.getSpectrum().orElseThrow().get("fundamental").getAsDouble()).isCloseTo(10.1, within(1e-9));
        assertThat(result.getPrimary()).isCloseTo(10.1, within(1e-9));
    }

    @Test
    @DisplayName("An extreme temperature correction should clamp at zero, never go negative")
    void shouldClampNegativeCorrection() {
        StaticEnvironment freezing = StaticEnvironment.builder().field("ambient_temperature_c", -500.0).build();

        ReadingState result = stage(0.5).apply(withSpectrum(10.0), context(freezing));

        assertThat(result.getSpectrum().orElseThrow().asMap().values()).containsOnly(0.0);
        assertThat(result.getPrimary()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Scalar readings should use the nearest gain within tolerance")
    void scalarShouldUseNearestGain() {
        FrequencyResponseStage stage = stage(0.0);

        assertThat(stage.scalarGain(63.0)).isEqualTo(0.9);
        assertThat(stage.scalarGain(67.0)).isEqualTo(1.1);
        assertThat(stage.scalarGain(65.0)).isEqualTo(0.9);
        assertThat(stage.scalarGain(80.0)).isEqualTo(1.0);
        assertThat(stage.scalarGain(20.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Scalar readings without a dominant frequency should use the base frequency")
    void scalarShouldFallBackToBaseFrequency() {
        ReadingState result = stage(0.0).apply(ReadingState.scalar(10.0), context(StaticEnvironment.empty()));
        ReadingState tuned = stage(0.0).apply(ReadingState.scalar(10.0).withDominantFrequency(51.0),
                context(StaticEnvironment.empty()));

        assertThat(result.getPrimary()).isCloseTo(9.0, within(1e-12));
        assertThat(tuned.getPrimary()).isCloseTo(8.0, within(1e-12));
        assertThat(result.getSpectrum()).isEmpty();
    }
}
