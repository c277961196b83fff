package com.sensortwin.runner;

import com.sensortwin.core.config.ScenarioConfig;
import com.sensortwin.core.config.ScenarioLoader;
import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.sensor.Sensor;
import com.sensortwin.core.sensor.SensorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Main entry point: generates a labeled sample stream for a scenario.
 *
 * <pre>
 *   RunnerConfig (env vars)
 *     → ScenarioLoader (YAML)
 *     → SensorFactory (one sensor per enabled definition)
 *     → ScenarioDriver (steps × sensors, thread pool)
 *     → SampleWriter (JSON lines, stdout or file)
 * </pre>
 *
 * <p>
 * Logs go to standard error so standard output carries only samples.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScenarioRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioRunner.class);

    private ScenarioRunner() {
        // entry point only
    }

    public static void main(String[] args) throws Exception {
        RunnerConfig config = RunnerConfig.fromEnvironment();
        LOG.info("Starting scenario runner with config: {}", config);
        RunSummary summary = run(config);
        LOG.info("Wrote {} sample(s) over {} step(s), labels: {}",
                summary.getSamples(), summary.getSteps(), summary.getLabelCounts());
    }

    /**
     * Load the scenario named by {@code config}, run it and write its samples.
     *
     * @return counts of the run
     * @throws com.sensortwin.core.config.ConfigError if the scenario is invalid
     * @throws IOException                            if writing fails
     * @throws InterruptedException                   if interrupted while running
     */
    public static RunSummary run(RunnerConfig config) throws IOException, InterruptedException {
        ScenarioConfig scenario = loadScenario(config);

        long steps = config.getSteps() != null ? config.getSteps() : scenario.getSteps();
        double stepSeconds = config.getStepSeconds() != null ? config.getStepSeconds() : scenario.getStepSeconds();
        Instant start = config.getStartTime() != null ? config.getStartTime() : scenario.startInstant();

        EnvironmentQuery environment = scenario.getEnvironment().toEnvironment();
        List<Sensor> sensors = SensorFactory.createAll(scenario.getName(), scenario.getSensors());
        if (sensors.isEmpty()) {
            LOG.warn("Scenario '{}' has no enabled sensors; no samples will be written", scenario.getName());
        }

        try (ScenarioDriver driver = new ScenarioDriver(sensors, environment, config.getParallelism());
                SampleWriter writer = openWriter(config)) {
            return driver.run(steps, start, stepSeconds, writer);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ScenarioConfig loadScenario(RunnerConfig config) {
        String path = config.getScenarioConfigPath();
        if (path != null && !path.isBlank()) {
            return ScenarioLoader.fromFile(path);
        }
        return ScenarioLoader.load();
    }

    private static SampleWriter openWriter(RunnerConfig config) throws IOException {
        String output = config.getOutputPath();
        if (output == null || output.isBlank()) {
            return SampleWriter.toStdout();
        }
        LOG.info("Writing samples to {}", output);
        return SampleWriter.toFile(Path.of(output));
    }
}
