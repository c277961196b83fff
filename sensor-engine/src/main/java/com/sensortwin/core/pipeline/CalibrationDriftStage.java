package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;

import java.util.Objects;

/**
 * {@code v' = v * gain(t) + offset(t) + nonlinearity * v^2}, with gain and
 * offset taken from the sensor's {@link DriftState} at the sample's operating
 * hours.
 *
 * @since 1.0.0
 */
public final class CalibrationDriftStage implements ImperfectionStage {

    private final DriftState drift;
    private final double nonlinearityFactor;

    public CalibrationDriftStage(DriftState drift, double nonlinearityFactor) {
        this.drift = Objects.requireNonNull(drift, "drift");
        this.nonlinearityFactor = nonlinearityFactor;
    }

    public static CalibrationDriftStage fromConfig(SensorConfig config) {
        return new CalibrationDriftStage(driftState(config),
                config.getDouble(ParameterTables.CALIBRATION_NONLINEARITY_FACTOR));
    }

    public static DriftState driftState(SensorConfig config) {
        return new DriftState(
                config.getDouble(ParameterTables.CALIBRATION_GAIN_ERROR_FACTOR),
                config.getDouble(ParameterTables.CALIBRATION_GAIN_DRIFT_PER_HOUR),
                config.getDouble(ParameterTables.CALIBRATION_OFFSET),
                config.getDouble(ParameterTables.CALIBRATION_OFFSET_DRIFT_PER_HOUR));
    }

    @Override
    public StageKind kind() {
        return StageKind.CALIBRATION_DRIFT;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        double hours = context.getOperatingHours();
        double v = state.getPrimary();
        return state.withPrimary(v * drift.gainAt(hours) + drift.offsetAt(hours) + nonlinearityFactor * v * v);
    }

    public DriftState getDrift() {
        return drift;
    }
}
