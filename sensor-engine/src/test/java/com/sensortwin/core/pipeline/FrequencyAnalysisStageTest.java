package com.sensortwin.core.pipeline;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.NumericDegeneracyException;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.Spectrum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FrequencyAnalysisStage}.
 */
class FrequencyAnalysisStageTest {

    private static final Map<Integer, Double> RATIOS = Map.of(3, 0.15, 5, 0.1, 7, 0.1, 9, 0.1);

    private static StageContext context(EnvironmentQuery env, long seed) {
        return new StageContext("emf-test", Position3D.ORIGIN, env, new Random(seed), 0.0);
    }

    private static FrequencyAnalysisStage stage(boolean enabled, boolean noise, double stddev) {
        return new FrequencyAnalysisStage(enabled, RATIOS, noise, stddev, 0.15, "corona_discharge");
    }

    @Test
    @DisplayName("Third harmonic should be fundamental times ratio exactly when jitter is off")
    void thirdHarmonicShouldBeExact() {
        ReadingState result = stage(true, false, 0.02)
                .apply(ReadingState.scalar(10.0), context(StaticEnvironment.empty(), 1));

        Spectrum spectrum = result.getSpectrum().orElseThrow();
        assertThat(spectrum.get(Spectrum.FUNDAMENTAL)).hasValue(10.0);
        assertThat(spectrum.get("3rd")).hasValue(1.5);
        assertThat(spectrum.get("9th")).hasValue(1.0);
    }

    @Test
    @DisplayName("Noise floor slot should always be present, at zero")
    void noiseFloorShouldBePresent() {
        ReadingState result = stage(true, true, 0.02)
                .apply(ReadingState.scalar(3.0), context(StaticEnvironment.empty(), 2));

        assertThat(result.getSpectrum().orElseThrow().get(Spectrum.EMI_NOISE_FLOOR)).hasValue(0.0);
        assertThat(result.getSpectrum().orElseThrow().contains(Spectrum.HIGH_FREQUENCY_NOISE)).isFalse();
    }

    @Test
    @DisplayName("High-frequency noise should appear only while discharging")
    void highFrequencyNoiseShouldFollowDischarge() {
        StaticEnvironment discharging = StaticEnvironment.builder().field("corona_discharge", 0.5).build();
        StaticEnvironment quiet = StaticEnvironment.builder().field("corona_discharge", 0.0).build();

        ReadingState active = stage(true, false, 0).apply(ReadingState.scalar(10.0), context(discharging, 3));
        ReadingState inactive = stage(true, false, 0).apply(ReadingState.scalar(10.0), context(quiet, 3));

        assertThat(active.getSpectrum().orElseThrow().get(Spectrum.HIGH_FREQUENCY_NOISE)).hasValue(1.5);
        assertThat(inactive.getSpectrum().orElseThrow().contains(Spectrum.HIGH_FREQUENCY_NOISE)).isFalse();
    }

    @Test
    @DisplayName("An overflowing harmonic should raise a degeneracy, not an argument error")
    void overflowingHarmonicShouldBeDegenerate() {
        FrequencyAnalysisStage amplifying = new FrequencyAnalysisStage(true, Map.of(3, 10.0), false, 0.0, 0.15,
                "corona_discharge");

        assertThatThrownBy(() -> amplifying.apply(ReadingState.scalar(1e308), context(StaticEnvironment.empty(), 5)))
                .isInstanceOf(NumericDegeneracyException.class)
                .hasMessageContaining("3rd");
    }

    @Test
    @DisplayName("Disabled spectrum output should remove the spectrum entirely")
    void disabledShouldOmitSpectrum() {
        ReadingState withSpectrum = ReadingState.scalar(5.0).withSpectrum(Spectrum.empty().with("fundamental", 5.0));

        ReadingState result = stage(false, true, 0.02).apply(withSpectrum, context(StaticEnvironment.empty(), 4));

        assertThat(result.getSpectrum()).isEmpty();
        assertThat(result.getPrimary()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Components should stay non-negative under extreme jitter and negative input")
    void componentsShouldStayNonNegative() {
        FrequencyAnalysisStage noisy = stage(true, true, 50.0);
        for (long seed = 0; seed < 200; seed++) {
            double primary = seed % 2 == 0 ? 10.0 : -10.0;
            Spectrum spectrum = noisy.apply(ReadingState.scalar(primary), context(StaticEnvironment.empty(), seed))
                    .getSpectrum().orElseThrow();
            assertThat(spectrum.asMap().values()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
        }
    }

    @Test
    @DisplayName("Jitter should be reproducible from the sample seed")
    void jitterShouldBeReproducible() {
        FrequencyAnalysisStage noisy = stage(true, true, 0.1);
        ReadingState a = noisy.apply(ReadingState.scalar(10.0), context(StaticEnvironment.empty(), 99));
        ReadingState b = noisy.apply(ReadingState.scalar(10.0), context(StaticEnvironment.empty(), 99));

        assertThat(a.getSpectrum()).isEqualTo(b.getSpectrum());
    }
}
