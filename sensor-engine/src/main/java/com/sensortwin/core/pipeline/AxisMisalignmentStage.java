package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;

/**
 * Attenuates every spectrum component by {@code cos(misalignment)}, clamped to
 * [0, 1]. A no-op when disabled or when there is no spectrum.
 *
 * @since 1.0.0
 */
public final class AxisMisalignmentStage implements ImperfectionStage {

    private final boolean enabled;
    private final double factor;

    public AxisMisalignmentStage(boolean enabled, double misalignmentDegrees) {
        this.enabled = enabled;
        this.factor = Math.max(0.0, Math.min(1.0, Math.cos(Math.toRadians(misalignmentDegrees))));
    }

    public static AxisMisalignmentStage fromConfig(SensorConfig config) {
        return new AxisMisalignmentStage(
                config.getBoolean(ParameterTables.AXIS_MISALIGNMENT_ENABLED),
                config.getDouble(ParameterTables.AXIS_MISALIGNMENT_DEGREES));
    }

    @Override
    public StageKind kind() {
        return StageKind.AXIS_MISALIGNMENT;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        if (!enabled || state.getSpectrum().isEmpty()) {
            return state;
        }
        return state.withSpectrum(state.getSpectrum().get().scaled(factor));
    }

    double getFactor() {
        return factor;
    }
}
