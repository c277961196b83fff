package com.sensortwin.core.pipeline;

import com.sensortwin.core.environment.StaticEnvironment;
import com.sensortwin.core.model.Position3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NoiseInjectionStage}.
 */
class NoiseInjectionStageTest {

    private static StageContext context(long seed) {
        return new StageContext("pm-test", Position3D.ORIGIN, StaticEnvironment.empty(), new Random(seed), 0.0);
    }

    @Test
    @DisplayName("Type 'none' should leave the reading unchanged")
    void noneShouldBeIdentity() {
        NoiseInjectionStage stage = new NoiseInjectionStage(NoiseInjectionStage.NoiseType.NONE, 5.0, 3.0);

        assertThat(stage.apply(ReadingState.scalar(7.0), context(1)).getPrimary()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Zero spread should add exactly the mean")
    void zeroSpreadShouldAddMean() {
        NoiseInjectionStage stage = new NoiseInjectionStage(NoiseInjectionStage.NoiseType.GAUSSIAN, 2.0, 0.0);

        assertThat(stage.apply(ReadingState.scalar(7.0), context(1)).getPrimary()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("Noise should be reproducible per seed and differ across seeds")
    void noiseShouldFollowSeed() {
        NoiseInjectionStage stage = new NoiseInjectionStage(NoiseInjectionStage.NoiseType.GAUSSIAN, 0.0, 1.0);

        double first = stage.apply(ReadingState.scalar(0.0), context(11)).getPrimary();
        double again = stage.apply(ReadingState.scalar(0.0), context(11)).getPrimary();
        double other = stage.apply(ReadingState.scalar(0.0), context(12)).getPrimary();

        assertThat(first).isEqualTo(again);
        assertThat(first).isNotEqualTo(other);
    }

    @Test
    @DisplayName("Sample spread should match the configured standard deviation")
    void spreadShouldMatchStddev() {
        NoiseInjectionStage stage = new NoiseInjectionStage(NoiseInjectionStage.NoiseType.GAUSSIAN, 1.0, 2.0);
        StageContext context = context(99);
        int n = 5000;
        double sum = 0;
        double sumSq = 0;
        for (int i = 0; i < n; i++) {
            double v = stage.apply(ReadingState.scalar(0.0), context).getPrimary();
            sum += v;
            sumSq += v * v;
        }
        double mean = sum / n;
        double stddev = Math.sqrt(sumSq / n - mean * mean);

        assertThat(mean).isBetween(0.85, 1.15);
        assertThat(stddev).isBetween(1.85, 2.15);
    }
}
