package com.sensortwin.core.sensor;

import com.sensortwin.core.config.ConfigError;
import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.config.SensorDefinition;
import com.sensortwin.core.groundtruth.GroundTruthEvaluator;
import com.sensortwin.core.model.Modality;
import com.sensortwin.core.pipeline.AxisMisalignmentStage;
import com.sensortwin.core.pipeline.CalibrationDriftStage;
import com.sensortwin.core.pipeline.CrossSensitivityStage;
import com.sensortwin.core.pipeline.DirectionalSensitivityStage;
import com.sensortwin.core.pipeline.FrequencyAnalysisStage;
import com.sensortwin.core.pipeline.FrequencyResponseStage;
import com.sensortwin.core.pipeline.GeneralDriftStage;
import com.sensortwin.core.pipeline.ImperfectionPipeline;
import com.sensortwin.core.pipeline.ImperfectionStage;
import com.sensortwin.core.pipeline.InterferenceCouplingStage;
import com.sensortwin.core.pipeline.NoiseInjectionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Creates {@link Sensor} instances from {@link SensorDefinition}s.
 *
 * <p>
 * This is the single place that decides which stages each modality runs:
 * </p>
 * <ul>
 * <li>EMF: spectrum analysis, frequency response, axis misalignment,
 * directional sensitivity, interference coupling</li>
 * <li>Acoustic: the EMF stages without axis misalignment</li>
 * <li>Chemical: cross-sensitivity</li>
 * <li>Particulate, Thermal: none of the above</li>
 * </ul>
 * <p>
 * followed, for every modality, by calibration drift, general drift and noise.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SensorFactory.class);

    private SensorFactory() {
        // static helpers only
    }

    /**
     * Create a sensor from a single definition. A missing id becomes
     * {@code <modality>-01}.
     *
     * @param definition the sensor definition; must not be {@code null}
     * @return the sensor
     * @throws ConfigError if the definition or its parameters are invalid
     */
    public static Sensor create(SensorDefinition definition) {
        Objects.requireNonNull(definition, "SensorDefinition must not be null");
        definition.validate();
        String id = definition.getId() != null
                ? definition.getId()
                : definition.getModality() + "-01";
        return build(id, definition);
    }

    /**
     * Create the enabled sensors of a scenario, in definition order.
     *
     * <p>
     * Disabled definitions are skipped. A definition without an id is named
     * {@code <scenario>-<modality>-NN}, numbered per modality. Problems of all
     * sensors, including duplicate ids, are reported in one
     * {@link ConfigError}.
     * </p>
     *
     * @param scenarioName name used for generated ids
     * @param definitions  sensor definitions; must not be {@code null}
     * @return unmodifiable list of sensors
     * @throws ConfigError if any definition is invalid
     */
    public static List<Sensor> createAll(String scenarioName, List<SensorDefinition> definitions) {
        Objects.requireNonNull(definitions, "Sensor definitions must not be null");
        String prefix = scenarioName == null || scenarioName.isBlank() ? "sensor" : scenarioName;

        List<String> errors = new ArrayList<>();
        List<Sensor> sensors = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        Map<Modality, Integer> counters = new EnumMap<>(Modality.class);

        for (SensorDefinition definition : definitions) {
            Objects.requireNonNull(definition, "Sensor definition must not be null");
            if (!definition.isEnabled()) {
                LOG.info("Skipping disabled sensor '{}'", definition.getId());
                continue;
            }
            try {
                definition.validate();
            } catch (ConfigError e) {
                errors.addAll(e.getProblems());
                continue;
            }
            Modality modality = definition.modalityType();
            int ordinal = counters.merge(modality, 1, Integer::sum);
            String id = definition.getId() != null
                    ? definition.getId()
                    : String.format(Locale.ROOT, "%s-%s-%02d", prefix, modality.getKey(), ordinal);
            if (!ids.add(id)) {
                errors.add("sensor '" + id + "': duplicate sensor id");
                continue;
            }
            try {
                sensors.add(build(id, definition));
            } catch (ConfigError e) {
                e.getProblems().forEach(p -> errors.add("sensor '" + id + "': " + p));
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigError("Invalid sensor definitions", errors);
        }
        LOG.info("Created {} sensor(s) for scenario '{}'", sensors.size(), prefix);
        return Collections.unmodifiableList(sensors);
    }

    /**
     * The stages of {@code modality}, in pipeline order.
     */
    public static List<ImperfectionStage> stagesFor(Modality modality, SensorConfig config) {
        List<ImperfectionStage> stages = new ArrayList<>();
        switch (modality) {
            case EMF -> {
                stages.add(FrequencyAnalysisStage.fromConfig(config));
                stages.add(FrequencyResponseStage.fromConfig(config));
                stages.add(AxisMisalignmentStage.fromConfig(config));
                stages.add(DirectionalSensitivityStage.fromConfig(config));
                stages.add(InterferenceCouplingStage.fromConfig(config));
            }
            case ACOUSTIC -> {
                stages.add(FrequencyAnalysisStage.fromConfig(config));
                stages.add(FrequencyResponseStage.fromConfig(config));
                stages.add(DirectionalSensitivityStage.fromConfig(config));
                stages.add(InterferenceCouplingStage.fromConfig(config));
            }
            case CHEMICAL -> stages.add(CrossSensitivityStage.fromConfig(config));
            case PARTICULATE, THERMAL -> {
                // drift and noise only
            }
            default -> throw new IllegalStateException("Unhandled modality " + modality);
        }
        stages.add(CalibrationDriftStage.fromConfig(config));
        stages.add(GeneralDriftStage.fromConfig(config));
        stages.add(NoiseInjectionStage.fromConfig(config));
        return stages;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ModalitySensor build(String id, SensorDefinition definition) {
        Modality modality = definition.modalityType();
        SensorConfig config;
        try {
            config = SensorConfig.resolve(ParameterTables.forModality(modality), definition.getParams());
        } catch (ConfigError e) {
            throw new ConfigError("Invalid configuration for sensor '" + id + "'", e.getProblems());
        }

        List<String> errors = checkModalityRequirements(modality, config);
        if (!errors.isEmpty()) {
            throw new ConfigError("Invalid configuration for sensor '" + id + "'", errors);
        }

        long seed = definition.getSeed() != null ? definition.getSeed() : SeedSequence.fromId(id);
        ModalitySensor sensor = new ModalitySensor(id, modality, definition.positionValue(), config,
                new ImperfectionPipeline(modality, stagesFor(modality, config)),
                GroundTruthEvaluator.forSensor(modality, config),
                seed);
        LOG.debug("Created {}", sensor);
        return sensor;
    }

    /**
     * Cross-parameter checks that a single parameter's domain cannot express.
     */
    static List<String> checkModalityRequirements(Modality modality, SensorConfig config) {
        List<String> errors = new ArrayList<>();
        if (config.declares(ParameterTables.FREQUENCY_RANGE_HZ)) {
            List<Double> range = config.getNumberList(ParameterTables.FREQUENCY_RANGE_HZ);
            double base = config.getDouble(ParameterTables.BASE_FREQUENCY);
            if (range.size() != 2) {
                errors.add(ParameterTables.FREQUENCY_RANGE_HZ + ": expected [min, max], got " + range);
            } else if (range.get(0) >= range.get(1)) {
                errors.add(ParameterTables.FREQUENCY_RANGE_HZ + ": min must be below max, got " + range);
            } else if (base < range.get(0) || base > range.get(1)) {
                errors.add(ParameterTables.BASE_FREQUENCY + ": " + base + " Hz lies outside "
                        + ParameterTables.FREQUENCY_RANGE_HZ + " " + range);
            }
        }
        if (config.declares(ParameterTables.FREQUENCY_RESPONSE_GAIN)) {
            for (String key : config.getNumberMap(ParameterTables.FREQUENCY_RESPONSE_GAIN).keySet()) {
                try {
                    double frequency = Double.parseDouble(key);
                    if (!(frequency > 0) || Double.isInfinite(frequency)) {
                        errors.add(ParameterTables.FREQUENCY_RESPONSE_GAIN + ": frequency " + key + " must be > 0");
                    }
                } catch (NumberFormatException e) {
                    errors.add(ParameterTables.FREQUENCY_RESPONSE_GAIN + ": '" + key + "' is not a frequency");
                }
            }
        }
        return errors;
    }
}
