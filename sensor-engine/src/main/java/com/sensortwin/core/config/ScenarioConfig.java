package com.sensortwin.core.config;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for a scenario YAML file.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * name: substation
 * steps: 60
 * stepSeconds: 60
 * startTime: 2024-01-01T00:00:00Z
 * environment:
 *   fields:
 *     ac_field_strength: 120.0
 * sensors:
 *   - id: emf-01
 *     modality: emf
 *     position: [0, 0, 1.5]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the whole scenario.
 * </p>
 *
 * @since 1.0.0
 */
public class ScenarioConfig {

    public static final String DEFAULT_START_TIME = "2024-01-01T00:00:00Z";

    private String name = "scenario";
    private int steps = 1;
    private double stepSeconds = 1.0;
    private String startTime = DEFAULT_START_TIME;
    private EnvironmentDefinition environment = new EnvironmentDefinition();
    private List<SensorDefinition> sensors = new ArrayList<>();

    /**
     * Validate the scenario, its environment and every sensor definition.
     * Collects all problems and throws a single exception.
     *
     * @throws ConfigError if the scenario is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("'name' is required");
        }
        if (steps < 0) {
            errors.add("'steps' must be >= 0, got " + steps);
        }
        if (!Double.isFinite(stepSeconds) || stepSeconds <= 0) {
            errors.add("'stepSeconds' must be > 0, got " + stepSeconds);
        }
        try {
            startInstant();
        } catch (DateTimeParseException e) {
            errors.add("'startTime' is not an ISO-8601 instant: " + startTime);
        }
        environment.collectErrors(errors);
        for (int i = 0; i < sensors.size(); i++) {
            SensorDefinition sensor = sensors.get(i);
            if (sensor == null) {
                errors.add("sensors[" + i + "]: must not be empty");
            } else {
                sensor.collectErrors(errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigError("Scenario configuration validation failed", errors);
        }
    }

    public Instant startInstant() {
        return Instant.parse(startTime);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getSteps() {
        return steps;
    }

    public void setSteps(int steps) {
        this.steps = steps;
    }

    public double getStepSeconds() {
        return stepSeconds;
    }

    public void setStepSeconds(double stepSeconds) {
        this.stepSeconds = stepSeconds;
    }

    public String getStartTime() {
        return startTime;
    }

    public void setStartTime(String startTime) {
        this.startTime = startTime != null ? startTime : DEFAULT_START_TIME;
    }

    public EnvironmentDefinition getEnvironment() {
        return environment;
    }

    public void setEnvironment(EnvironmentDefinition environment) {
        this.environment = environment != null ? environment : new EnvironmentDefinition();
    }

    /**
     * @return unmodifiable list of sensor definitions
     */
    public List<SensorDefinition> getSensors() {
        return Collections.unmodifiableList(sensors);
    }

    public void setSensors(List<SensorDefinition> sensors) {
        this.sensors = sensors != null ? new ArrayList<>(sensors) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ScenarioConfig{name='" + name + '\''
                + ", steps=" + steps
                + ", stepSeconds=" + stepSeconds
                + ", sensors=" + sensors + '}';
    }
}
