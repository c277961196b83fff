package com.sensortwin.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a scenario file (name, step count and length, start time, static
 * environment fields and the sensor definitions) into a {@link ScenarioConfig}.
 *
 * <p>
 * The runner asks for a scenario with {@link #load()}, which prefers a file
 * named by {@value #ENV_SCENARIO_PATH} and otherwise uses the bundled
 * {@value #DEFAULT_RESOURCE}. Tests and tools name a source directly through
 * {@link #fromFile(String)} or {@link #fromClasspath(String)}.
 * </p>
 *
 * <p>
 * Duplicate YAML keys are rejected. Unparseable YAML and every semantic
 * problem (bad step length, unknown modality, malformed position) surface as
 * one {@link ConfigError}, so no sensor is built from a half-valid file. A
 * missing file is an {@link IllegalArgumentException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScenarioLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioLoader.class);

    /** Names a scenario file that replaces the bundled one. */
    public static final String ENV_SCENARIO_PATH = "SCENARIO_CONFIG_PATH";

    /** Bundled scenario. */
    public static final String DEFAULT_RESOURCE = "scenario.yml";

    private ScenarioLoader() {
        // no instances
    }

    /**
     * Scenario for a runner started without arguments. A set but nonexistent
     * {@value #ENV_SCENARIO_PATH} falls through to the bundled scenario.
     *
     * @return the validated scenario
     * @throws ConfigError if the chosen file is not a valid scenario
     */
    public static ScenarioConfig load() {
        String envPath = System.getenv(ENV_SCENARIO_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading scenario from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading scenario from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path scenario YAML on disk
     * @return the validated scenario
     * @throws IllegalArgumentException if there is no file at {@code path}
     * @throws IllegalStateException    on an I/O failure while reading
     * @throws ConfigError              if the file is not a valid scenario
     */
    public static ScenarioConfig fromFile(String path) {
        Objects.requireNonNull(path, "Scenario file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Scenario file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read scenario file: " + path, e);
        }
    }

    /**
     * Same as {@link #fromFile(String)} for a scenario packaged on the
     * classpath, such as a test fixture.
     *
     * @param resource resource name relative to the classpath root
     * @return the validated scenario
     * @throws IllegalArgumentException if the resource is absent
     */
    public static ScenarioConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ScenarioLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ScenarioConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ScenarioConfig.class, options));

        ScenarioConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigError("Malformed scenario file " + source + ": " + e.getMessage());
        }

        if (config == null) {
            LOG.warn("Scenario file {} is empty", source);
            config = new ScenarioConfig();
        }
        if (config.getSensors().isEmpty()) {
            LOG.warn("No sensors defined in scenario '{}'", config.getName());
        }
        config.validate();

        LOG.info("Loaded scenario '{}' with {} sensor definition(s), {} step(s) of {} s",
                config.getName(), config.getSensors().size(), config.getSteps(), config.getStepSeconds());
        return config;
    }
}
