package com.sensortwin.core.pipeline;

/**
 * The imperfection stages, declared in the only order in which they may run.
 *
 * @since 1.0.0
 */
public enum StageKind {
    SPECTRUM_ANALYSIS,
    FREQUENCY_RESPONSE,
    AXIS_MISALIGNMENT,
    DIRECTIONAL_SENSITIVITY,
    INTERFERENCE_COUPLING,
    CROSS_SENSITIVITY,
    CALIBRATION_DRIFT,
    GENERAL_DRIFT,
    NOISE_INJECTION
}
