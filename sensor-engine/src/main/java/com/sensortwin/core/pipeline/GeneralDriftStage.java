package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;

/**
 * Additive baseline drift: {@code v' = v + rate * t}.
 *
 * @since 1.0.0
 */
public final class GeneralDriftStage implements ImperfectionStage {

    private final double driftPerHour;

    public GeneralDriftStage(double driftPerHour) {
        this.driftPerHour = driftPerHour;
    }

    public static GeneralDriftStage fromConfig(SensorConfig config) {
        return new GeneralDriftStage(config.getDouble(ParameterTables.BASELINE_DRIFT_PER_HOUR));
    }

    @Override
    public StageKind kind() {
        return StageKind.GENERAL_DRIFT;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        if (driftPerHour == 0.0) {
            return state;
        }
        return state.withPrimary(state.getPrimary() + driftPerHour * context.getOperatingHours());
    }
}
