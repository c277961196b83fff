package com.sensortwin.core.pipeline;

import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.Position3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CalibrationDriftStage}, {@link DriftState} and
 * {@link GeneralDriftStage}.
 */
class CalibrationDriftStageTest {

    private static StageContext at(double hours) {
        return new StageContext("thermal-test", Position3D.ORIGIN, StaticEnvironment.empty(), new Random(1), hours);
    }

    @Test
    @DisplayName("Should apply gain, offset and non-linearity at the given operating hours")
    void shouldApplyCalibrationFormula() {
        CalibrationDriftStage stage = new CalibrationDriftStage(new DriftState(1.1, 0.01, 0.5, 0.1), 0.001);

        ReadingState result = stage.apply(ReadingState.scalar(10.0), at(10.0));

        // 10 * (1.1 * 1.1) + (0.5 + 1.0) + 0.001 * 100
        assertThat(result.getPrimary()).isCloseTo(13.7, within(1e-9));
    }

    @Test
    @DisplayName("Identity calibration should leave the reading unchanged")
    void identityShouldBeNeutral() {
        CalibrationDriftStage stage = new CalibrationDriftStage(new DriftState(1.0, 0.0, 0.0, 0.0), 0.0);

        assertThat(stage.apply(ReadingState.scalar(42.0), at(1000.0)).getPrimary()).isEqualTo(42.0);
    }

    @Test
    @DisplayName("Gain error should grow monotonically with operating hours")
    void gainErrorShouldBeMonotone() {
        DriftState drift = new DriftState(1.02, 0.0005, 0.0, 0.0);
        double previous = -1.0;
        for (int hour = 0; hour <= 10_000; hour += 250) {
            double error = Math.abs(drift.gainAt(hour) - drift.getBaseGain());
            assertThat(error).isGreaterThanOrEqualTo(previous);
            previous = error;
        }
    }

    @Test
    @DisplayName("Drift should be a pure function of elapsed time")
    void driftShouldBePure() {
        DriftState drift = new DriftState(1.0, 0.01, 2.0, 0.5);

        assertThat(drift.gainAt(3.0)).isEqualTo(drift.gainAt(3.0));
        assertThat(drift.offsetAt(4.0)).isEqualTo(4.0);
        assertThat(drift.offsetAt(0.0)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("General drift should add rate times hours")
    void generalDriftShouldAddLinearBaseline() {
        GeneralDriftStage stage = new GeneralDriftStage(0.25);

        assertThat(stage.apply(ReadingState.scalar(10.0), at(8.0)).getPrimary()).isEqualTo(12.0);
        assertThat(stage.apply(ReadingState.scalar(10.0), at(0.0)).getPrimary()).isEqualTo(10.0);
    }
}
