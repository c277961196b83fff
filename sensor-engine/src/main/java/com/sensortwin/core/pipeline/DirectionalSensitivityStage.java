package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.model.NumericDegeneracyException;
import com.sensortwin.core.model.Vector3;

import java.util.Objects;
import java.util.Optional;

/**
 * Scales the reading by the alignment between the sensor axis and the field.
 *
 * <p>
 * {@code alignment = unit(orientation) . unit(field)}, perturbed by a Gaussian
 * term when orientation uncertainty is enabled, then clamped to [0, 1]: a
 * reversed field contributes nothing. When the ideal reading has no field
 * vector the stage is skipped, unless scalar mode is enabled, in which case the
 * assumed field direction is used.
 * </p>
 *
 * @since 1.0.0
 */
public final class DirectionalSensitivityStage implements ImperfectionStage {

    private final Vector3 orientation;
    private final boolean orientationUncertainty;
    private final double uncertaintyStddev;
    private final boolean applyToScalar;
    private final Vector3 assumedFieldDirection;
    private final boolean scaleSpectrum;

    public DirectionalSensitivityStage(Vector3 orientation, boolean orientationUncertainty, double uncertaintyStddev,
            boolean applyToScalar, Vector3 assumedFieldDirection, boolean scaleSpectrum) {
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        this.orientationUncertainty = orientationUncertainty;
        this.uncertaintyStddev = uncertaintyStddev;
        this.applyToScalar = applyToScalar;
        this.assumedFieldDirection = Objects.requireNonNull(assumedFieldDirection, "assumedFieldDirection");
        this.scaleSpectrum = scaleSpectrum;
    }

    public static DirectionalSensitivityStage fromConfig(SensorConfig config) {
        return new DirectionalSensitivityStage(
                config.getVector(ParameterTables.ORIENTATION),
                config.getBoolean(ParameterTables.ORIENTATION_UNCERTAINTY),
                config.getDouble(ParameterTables.ORIENTATION_UNCERTAINTY_STDDEV),
                config.getBoolean(ParameterTables.DIRECTIONAL_FOR_SCALAR),
                config.getVector(ParameterTables.ASSUMED_FIELD_DIRECTION),
                config.getBoolean(ParameterTables.SCALE_SPECTRUM_WITH_ALIGNMENT));
    }

    @Override
    public StageKind kind() {
        return StageKind.DIRECTIONAL_SENSITIVITY;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        Optional<Vector3> field = state.getFieldVector();
        if (field.isEmpty() && !applyToScalar) {
            return state;
        }
        Vector3 direction = field.orElse(assumedFieldDirection);
        if (orientation.isZero()) {
            throw new NumericDegeneracyException("Sensor orientation has zero length");
        }
        if (direction.isZero()) {
            throw new NumericDegeneracyException("Field direction has zero length");
        }

        double perturbation = orientationUncertainty
                ? context.getRandom().nextGaussian() * uncertaintyStddev
                : 0.0;
        double alignment = alignmentFactor(orientation, direction, perturbation);

        ReadingState next = state.withPrimary(state.getPrimary() * alignment);
        if (scaleSpectrum && next.getSpectrum().isPresent()) {
            next = next.withSpectrum(next.getSpectrum().get().scaled(alignment));
        }
        return next;
    }

    /**
     * Alignment of two non-zero vectors plus {@code perturbation}, clamped to
     * [0, 1].
     */
    static double alignmentFactor(Vector3 orientation, Vector3 direction, double perturbation) {
        double alignment = orientation.normalize().dot(direction.normalize()) + perturbation;
        if (Double.isNaN(alignment)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, alignment));
    }
}
