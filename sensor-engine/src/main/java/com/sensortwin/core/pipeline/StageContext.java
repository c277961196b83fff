package com.sensortwin.core.pipeline;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.model.Position3D;

import java.util.Objects;
import java.util.Random;

/**
 * Per-sample inputs shared by all stages of one pipeline run.
 *
 * <p>
 * The random generator belongs to this sample only; stages draw from it in
 * pipeline order, so a sample is reproducible from its seed.
 * </p>
 *
 * @since 1.0.0
 */
public final class StageContext {

    private final String sensorId;
    private final Position3D position;
    private final EnvironmentQuery environment;
    private final Random random;
    private final double operatingHours;

    /**
     * @param sensorId       id used in log messages
     * @param position       sensor position for this sample
     * @param environment    environment state for this sample
     * @param random         sample-local random generator
     * @param operatingHours total operating hours at this sample, {@code >= 0}
     */
    public StageContext(String sensorId, Position3D position, EnvironmentQuery environment,
            Random random, double operatingHours) {
        this.sensorId = Objects.requireNonNull(sensorId, "sensorId must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        if (!Double.isFinite(operatingHours) || operatingHours < 0) {
            throw new IllegalArgumentException("operatingHours must be finite and >= 0, got: " + operatingHours);
        }
        this.operatingHours = operatingHours;
    }

    public String getSensorId() {
        return sensorId;
    }

    public Position3D getPosition() {
        return position;
    }

    public EnvironmentQuery getEnvironment() {
        return environment;
    }

    public Random getRandom() {
        return random;
    }

    public double getOperatingHours() {
        return operatingHours;
    }
}
