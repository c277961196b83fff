package com.sensortwin.core.sensor;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.environment.Environments;
import com.sensortwin.core.groundtruth.GroundTruthEvaluator;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.IdealReading;
import com.sensortwin.core.model.Modality;
import com.sensortwin.core.model.ObservedReading;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.SampleTime;
import com.sensortwin.core.model.Vector3;
import com.sensortwin.core.pipeline.CalibrationDriftStage;
import com.sensortwin.core.pipeline.DriftState;
import com.sensortwin.core.pipeline.ImperfectionPipeline;
import com.sensortwin.core.pipeline.ReadingState;
import com.sensortwin.core.pipeline.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * A {@link Sensor} of one {@link Modality}, assembled by
 * {@link SensorFactory} from the shared stage library and a
 * {@link GroundTruthEvaluator}, both configured by one {@link SensorConfig}.
 *
 * <p>
 * The configuration, pipeline and evaluator are immutable. The only mutable
 * field is the position, which the driver changes between steps.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModalitySensor implements Sensor {

    private static final Logger LOG = LoggerFactory.getLogger(ModalitySensor.class);

    private final String sensorId;
    private final Modality modality;
    private final SensorConfig config;
    private final ImperfectionPipeline pipeline;
    private final GroundTruthEvaluator evaluator;
    private final long seed;
    private final String idealField;
    private final double initialOperatingHours;
    private volatile Position3D position;

    ModalitySensor(String sensorId, Modality modality, Position3D position, SensorConfig config,
            ImperfectionPipeline pipeline, GroundTruthEvaluator evaluator, long seed) {
        this.sensorId = Objects.requireNonNull(sensorId, "Sensor id must not be null");
        this.modality = Objects.requireNonNull(modality, "Modality must not be null");
        this.position = Objects.requireNonNull(position, "Position must not be null");
        this.config = Objects.requireNonNull(config, "SensorConfig must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "Pipeline must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator must not be null");
        this.seed = seed;
        this.idealField = modality == Modality.CHEMICAL
                ? config.getString(ParameterTables.TARGET_SPECIES)
                : modality.getPrimaryField();
        this.initialOperatingHours = config.getDouble(ParameterTables.INITIAL_OPERATING_HOURS);
    }

    @Override
    public IdealReading readIdeal(EnvironmentQuery environment) {
        Objects.requireNonNull(environment, "EnvironmentQuery must not be null");
        Position3D at = position;

        Vector3 vector = null;
        if (modality.getVectorField() != null) {
            Optional<Vector3> found = Environments.fieldVector(environment, modality.getVectorField(), at);
            vector = found.orElse(null);
        }

        OptionalDouble scalar = Environments.fieldValue(environment, idealField, at);
        double magnitude;
        if (scalar.isPresent()) {
            magnitude = scalar.getAsDouble();
        } else if (vector != null) {
            magnitude = vector.norm();
        } else {
            LOG.debug("Sensor [{}]: field '{}' absent at {}, reading 0", sensorId, idealField, at);
            magnitude = 0.0;
        }

        Double dominantFrequency = null;
        if (modality.getDominantFrequencyField() != null) {
            OptionalDouble frequency = Environments.fieldValue(environment, modality.getDominantFrequencyField(), at);
            if (frequency.isPresent() && frequency.getAsDouble() > 0) {
                dominantFrequency = frequency.getAsDouble();
            }
        }
        return IdealReading.of(magnitude, vector, dominantFrequency);
    }

    @Override
    public ObservedReading applyImperfections(IdealReading ideal, EnvironmentQuery environment, SampleTime time) {
        Objects.requireNonNull(ideal, "IdealReading must not be null");
        Objects.requireNonNull(environment, "EnvironmentQuery must not be null");
        Objects.requireNonNull(time, "SampleTime must not be null");

        Position3D at = position;
        StageContext context = new StageContext(sensorId, at, environment,
                new Random(SeedSequence.forSample(seed, time.getStep())),
                time.getElapsedHours() + initialOperatingHours);
        ReadingState result = pipeline.run(ReadingState.from(ideal), context);

        return ObservedReading.builder()
                .sensorId(sensorId)
                .modality(modality)
                .position(at)
                .timestamp(time.getTimestamp())
                .primaryValue(result.getPrimary())
                .spectrum(result.getSpectrum().orElse(null))
                .build();
    }

    @Override
    public List<AnomalyLabel> getGroundTruth(EnvironmentQuery environment, ObservedReading observed) {
        return evaluator.evaluate(environment, observed);
    }

    @Override
    public Map<String, Object> getMlMetadata() {
        Position3D at = position;
        DriftState drift = getDriftState();

        Map<String, Object> calibration = new LinkedHashMap<>();
        calibration.put("base_gain", drift.getBaseGain());
        calibration.put("gain_drift_per_hour", drift.getGainDriftPerHour());
        calibration.put("base_offset", drift.getBaseOffset());
        calibration.put("offset_drift_per_hour", drift.getOffsetDriftPerHour());
        calibration.put("initial_operating_hours", initialOperatingHours);

        List<String> stages = pipeline.kinds().stream()
                .map(kind -> kind.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sensor_id", sensorId);
        metadata.put("modality", modality.getKey());
        metadata.put("position", List.of(at.getX(), at.getY(), at.getZ()));
        metadata.put("seed", seed);
        metadata.put("stages", Collections.unmodifiableList(stages));
        metadata.put("calibration", Collections.unmodifiableMap(calibration));
        metadata.put("parameters", config.asMap());
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Calibration drift parameters of this sensor.
     */
    public DriftState getDriftState() {
        return CalibrationDriftStage.driftState(config);
    }

    @Override
    public String getSensorId() {
        return sensorId;
    }

    @Override
    public Modality getModality() {
        return modality;
    }

    @Override
    public Position3D getPosition() {
        return position;
    }

    @Override
    public void moveTo(Position3D position) {
        this.position = Objects.requireNonNull(position, "Position must not be null");
    }

    public SensorConfig getConfig() {
        return config;
    }

    public ImperfectionPipeline getPipeline() {
        return pipeline;
    }

    public GroundTruthEvaluator getEvaluator() {
        return evaluator;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "ModalitySensor{id='" + sensorId + "', " + pipeline + ", position=" + position + '}';
    }
}
