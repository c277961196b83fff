package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.environment.Environments;
import com.sensortwin.core.model.Spectrum;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Builds the harmonic spectrum of the reading.
 *
 * <p>
 * The fundamental is the non-negative primary value; odd harmonic {@code N}
 * is {@code fundamental * harmonic_N_ratio}, optionally jittered by
 * {@code 1 + N(0, sd) * sqrt(N)}. High-frequency noise appears only while the
 * discharge field is positive at the sensor. {@code emi_noise_floor} is always
 * present, at zero, for the interference stage to fill. When spectrum output
 * is disabled the spectrum is removed instead.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrequencyAnalysisStage implements ImperfectionStage {

    private final boolean enabled;
    private final Map<Integer, Double> harmonicRatios;
    private final boolean frequencyNoise;
    private final double frequencyNoiseStddev;
    private final double hfNoiseFactor;
    private final String dischargeField;

    public FrequencyAnalysisStage(boolean enabled, Map<Integer, Double> harmonicRatios, boolean frequencyNoise,
            double frequencyNoiseStddev, double hfNoiseFactor, String dischargeField) {
        this.enabled = enabled;
        this.harmonicRatios = new LinkedHashMap<>(Objects.requireNonNull(harmonicRatios, "harmonicRatios"));
        this.frequencyNoise = frequencyNoise;
        this.frequencyNoiseStddev = frequencyNoiseStddev;
        this.hfNoiseFactor = hfNoiseFactor;
        this.dischargeField = Objects.requireNonNull(dischargeField, "dischargeField");
    }

    public static FrequencyAnalysisStage fromConfig(SensorConfig config) {
        Map<Integer, Double> ratios = new LinkedHashMap<>();
        for (int order : Spectrum.HARMONIC_ORDERS) {
            ratios.put(order, config.getDouble(harmonicRatioKey(order)));
        }
        return new FrequencyAnalysisStage(
                config.getBoolean(ParameterTables.ENABLE_SPECTRUM_OUTPUT),
                ratios,
                config.getBoolean(ParameterTables.FREQUENCY_NOISE),
                config.getDouble(ParameterTables.FREQUENCY_NOISE_STDDEV),
                config.getDouble(ParameterTables.CORONA_HF_NOISE_FACTOR),
                config.getString(ParameterTables.DISCHARGE_CONDITION_FIELD));
    }

    static String harmonicRatioKey(int order) {
        return "harmonic_" + order + "_ratio";
    }

    @Override
    public StageKind kind() {
        return StageKind.SPECTRUM_ANALYSIS;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        if (!enabled) {
            return state.withoutSpectrum();
        }
        double fundamental = Math.max(0.0, state.getPrimary());
        Random random = context.getRandom();

        Spectrum spectrum = Spectrum.empty().with(Spectrum.FUNDAMENTAL, fundamental);
        for (Map.Entry<Integer, Double> harmonic : harmonicRatios.entrySet()) {
            double strength = fundamental * harmonic.getValue();
            if (frequencyNoise) {
                double jitter = 1.0 + random.nextGaussian() * frequencyNoiseStddev * Math.sqrt(harmonic.getKey());
                strength *= Math.max(0.0, jitter);
            }
            spectrum = spectrum.with(Spectrum.harmonicName(harmonic.getKey()), strength);
        }

        OptionalDouble discharge = Environments.fieldValue(context.getEnvironment(), dischargeField,
                context.getPosition());
        if (discharge.isPresent() && discharge.getAsDouble() > 0) {
            spectrum = spectrum.with(Spectrum.HIGH_FREQUENCY_NOISE, fundamental * hfNoiseFactor);
        }
        return state.withSpectrum(spectrum.with(Spectrum.EMI_NOISE_FLOOR, 0.0));
    }
}
