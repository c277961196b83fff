package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;

import java.util.Locale;
import java.util.Objects;

/**
 * Adds measurement noise to the final primary value. Always the last stage.
 *
 * @since 1.0.0
 */
public final class NoiseInjectionStage implements ImperfectionStage {

    /** Supported noise distributions. */
    public enum NoiseType {
        GAUSSIAN,
        NONE;

        static NoiseType fromKey(String key) {
            return valueOf(key.toUpperCase(Locale.ROOT));
        }
    }

    private final NoiseType type;
    private final double mean;
    private final double stddev;

    public NoiseInjectionStage(NoiseType type, double mean, double stddev) {
        this.type = Objects.requireNonNull(type, "type");
        this.mean = mean;
        this.stddev = stddev;
    }

    public static NoiseInjectionStage fromConfig(SensorConfig config) {
        return new NoiseInjectionStage(
                NoiseType.fromKey(config.getString(ParameterTables.NOISE_TYPE)),
                config.getDouble(ParameterTables.NOISE_MEAN),
                config.getDouble(ParameterTables.NOISE_STDDEV));
    }

    @Override
    public StageKind kind() {
        return StageKind.NOISE_INJECTION;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        if (type == NoiseType.NONE) {
            return state;
        }
        double noise = mean + stddev * context.getRandom().nextGaussian();
        return state.withPrimary(state.getPrimary() + noise);
    }
}
