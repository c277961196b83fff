package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.environment.Environments;
import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Adds the contribution of nearby interference sources.
 *
 * <p>
 * Each source within the search radius couples
 * {@code strength * K / (K + |f_source - f_sensor|) / (distance^2 + 1)}, where
 * {@code K} is the frequency coupling factor and {@code f_sensor} is the
 * dominant frequency of the reading, or the base frequency. The sum is added to
 * the primary value, scaled by the field-strength impact factor and a per-sample
 * multiplier {@code N(1, sd)}, and written to {@code emi_noise_floor} scaled by
 * the spectrum impact factor. With no sources the noise floor is set to zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class InterferenceCouplingStage implements ImperfectionStage {

    private static final Logger LOG = LoggerFactory.getLogger(InterferenceCouplingStage.class);

    private final double radiusM;
    private final double couplingFactor;
    private final double spectrumImpactFactor;
    private final double fieldStrengthImpactFactor;
    private final double randomStddev;
    private final double baseFrequencyHz;

    public InterferenceCouplingStage(double radiusM, double couplingFactor, double spectrumImpactFactor,
            double fieldStrengthImpactFactor, double randomStddev, double baseFrequencyHz) {
        if (!(couplingFactor > 0)) {
            throw new IllegalArgumentException("couplingFactor must be > 0, got: " + couplingFactor);
        }
        this.radiusM = radiusM;
        this.couplingFactor = couplingFactor;
        this.spectrumImpactFactor = spectrumImpactFactor;
        this.fieldStrengthImpactFactor = fieldStrengthImpactFactor;
        this.randomStddev = randomStddev;
        this.baseFrequencyHz = baseFrequencyHz;
    }

    public static InterferenceCouplingStage fromConfig(SensorConfig config) {
        return new InterferenceCouplingStage(
                config.getDouble(ParameterTables.EMI_RADIUS_M),
                config.getDouble(ParameterTables.EMI_FREQUENCY_COUPLING_FACTOR),
                config.getDouble(ParameterTables.EMI_SPECTRUM_IMPACT_FACTOR),
                config.getDouble(ParameterTables.EMI_FIELD_STRENGTH_IMPACT_FACTOR),
                config.getDouble(ParameterTables.EMI_FIELD_STRENGTH_RANDOM_STDDEV),
                config.getDouble(ParameterTables.BASE_FREQUENCY));
    }

    @Override
    public StageKind kind() {
        return StageKind.INTERFERENCE_COUPLING;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        double sensorFrequency = state.getDominantFrequencyHz().orElse(baseFrequencyHz);
        if (!(sensorFrequency > 0) || Double.isInfinite(sensorFrequency)) {
            sensorFrequency = baseFrequencyHz;
        }

        List<InterferenceSource> sources = Environments.nearbySources(context.getEnvironment(),
                context.getPosition(), radiusM);
        double total = 0.0;
        for (InterferenceSource source : sources) {
            double frequency = source.getFrequencyHz();
            if (!Double.isFinite(frequency) || frequency <= 0 || !Double.isFinite(source.getStrength())) {
                LOG.warn("Sensor [{}]: ignoring interference source with frequency {} Hz and strength {}",
                        context.getSensorId(), frequency, source.getStrength());
                continue;
            }
            total += coupling(source, sensorFrequency, context);
        }

        ReadingState next = state;
        if (total > 0) {
            double multiplier = 1.0 + context.getRandom().nextGaussian() * randomStddev;
            next = next.withPrimary(next.getPrimary() + total * fieldStrengthImpactFactor * multiplier);
        }
        if (next.getSpectrum().isPresent()) {
            next = next.withSpectrum(next.getSpectrum().get()
                    .with(Spectrum.EMI_NOISE_FLOOR, total * spectrumImpactFactor));
        }
        return next;
    }

    private double coupling(InterferenceSource source, double sensorFrequency, StageContext context) {
        double frequencyWeight = couplingFactor
                / (couplingFactor + Math.abs(source.getFrequencyHz() - sensorFrequency));
        double distance = source.getPosition().distanceTo(context.getPosition());
        return source.getStrength() * frequencyWeight / (distance * distance + 1.0);
    }
}
