package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.environment.Environments;
import com.sensortwin.core.model.Spectrum;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Applies the instrument's frequency response.
 *
 * <p>
 * With a spectrum, every component is multiplied by its curve entry (or the
 * default multiplier), corrected for ambient temperature by
 * {@code 1 + coeff * (T - ref) / 10} and clamped at zero; the primary value
 * then follows the filtered fundamental. Without a spectrum, the primary value
 * is multiplied by the gain of the table frequency nearest to the dominant
 * frequency, if it lies within the tolerance, else by the default gain.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrequencyResponseStage implements ImperfectionStage {

    private final Map<String, Double> curve;
    private final double defaultMultiplier;
    private final double tempCoeffPer10C;
    private final double refTempC;
    private final String ambientTemperatureField;
    private final TreeMap<Double, Double> gainTable;
    private final double toleranceHz;
    private final double defaultGain;
    private final double baseFrequencyHz;

    public FrequencyResponseStage(Map<String, Double> curve, double defaultMultiplier, double tempCoeffPer10C,
            double refTempC, String ambientTemperatureField, Map<Double, Double> gainTable, double toleranceHz,
            double defaultGain, double baseFrequencyHz) {
        this.curve = Map.copyOf(Objects.requireNonNull(curve, "curve"));
        this.defaultMultiplier = defaultMultiplier;
        this.tempCoeffPer10C = tempCoeffPer10C;
        this.refTempC = refTempC;
        this.ambientTemperatureField = Objects.requireNonNull(ambientTemperatureField, "ambientTemperatureField");
        this.gainTable = new TreeMap<>(Objects.requireNonNull(gainTable, "gainTable"));
        this.toleranceHz = toleranceHz;
        this.defaultGain = defaultGain;
        this.baseFrequencyHz = baseFrequencyHz;
    }

    /**
     * Build from config. Gain table keys are parsed as frequencies; the sensor
     * factory has already rejected keys that are not positive numbers.
     */
    public static FrequencyResponseStage fromConfig(SensorConfig config) {
        Map<Double, Double> table = new TreeMap<>();
        config.getNumberMap(ParameterTables.FREQUENCY_RESPONSE_GAIN)
                .forEach((frequency, gain) -> table.put(Double.parseDouble(frequency), gain));
        return new FrequencyResponseStage(
                config.getNumberMap(ParameterTables.FREQUENCY_RESPONSE_CURVE),
                config.getDouble(ParameterTables.FREQUENCY_RESPONSE_DEFAULT_MULTIPLIER),
                config.getDouble(ParameterTables.FREQUENCY_RESPONSE_TEMP_COEFF),
                config.getDouble(ParameterTables.FREQUENCY_RESPONSE_REF_TEMP),
                config.getString(ParameterTables.AMBIENT_TEMPERATURE_FIELD),
                table,
                config.getDouble(ParameterTables.FREQUENCY_TOLERANCE_HZ),
                config.getDouble(ParameterTables.DEFAULT_FREQUENCY_GAIN),
                config.getDouble(ParameterTables.BASE_FREQUENCY));
    }

    @Override
    public StageKind kind() {
        return StageKind.FREQUENCY_RESPONSE;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        if (state.getSpectrum().isEmpty()) {
            double frequency = state.getDominantFrequencyHz().orElse(baseFrequencyHz);
            return state.withPrimary(state.getPrimary() * scalarGain(frequency));
        }

        OptionalDouble ambient = Environments.fieldValue(context.getEnvironment(), ambientTemperatureField,
                context.getPosition());
        double correction = temperatureCorrection(ambient.orElse(refTempC));
        Spectrum filtered = state.getSpectrum().get().map((component, magnitude) ->
                magnitude * Math.max(0.0, curve.getOrDefault(component, defaultMultiplier) * correction));

        ReadingState next = state.withSpectrum(filtered);
        OptionalDouble fundamental = filtered.get(Spectrum.FUNDAMENTAL);
        return fundamental.isPresent() ? next.withPrimary(fundamental.getAsDouble()) : next;
    }

    double temperatureCorrection(double temperatureC) {
        return 1.0 + tempCoeffPer10C * (temperatureC - refTempC) / 10.0;
    }

    /**
     * Gain of the nearest table entry within tolerance; ties go to the lower
     * frequency.
     */
    double scalarGain(double frequencyHz) {
        Map.Entry<Double, Double> below = gainTable.floorEntry(frequencyHz);
        Map.Entry<Double, Double> above = gainTable.ceilingEntry(frequencyHz);
        Map.Entry<Double, Double> nearest;
        if (below == null) {
            nearest = above;
        } else if (above == null) {
            nearest = below;
        } else {
            nearest = (above.getKey() - frequencyHz) < (frequencyHz - below.getKey()) ? above : below;
        }
        if (nearest != null && Math.abs(nearest.getKey() - frequencyHz) <= toleranceHz) {
            return nearest.getValue();
        }
        return defaultGain;
    }
}
