package com.sensortwin.runner;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Typed, immutable configuration of a scenario run.
 *
 * <p>
 * Values are resolved from environment variables with defaults. Steps, step
 * length and start time override the scenario file when set; otherwise the
 * scenario's own values apply.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} from {@code main}, or the {@link Builder} in
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    private final int parallelism;
    private final Integer steps;
    private final Double stepSeconds;
    private final Instant startTime;
    private final String scenarioConfigPath;
    private final String outputPath;

    private RunnerConfig(Builder b) {
        this.parallelism = b.parallelism;
        this.steps = b.steps;
        this.stepSeconds = b.stepSeconds;
        this.startTime = b.startTime;
        this.scenarioConfigPath = b.scenarioConfigPath;
        this.outputPath = b.outputPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment() {
        try {
            Builder builder = new Builder()
                    .parallelism(Integer.parseInt(env("RUNNER_PARALLELISM",
                            String.valueOf(Runtime.getRuntime().availableProcessors()))))
                    .scenarioConfigPath(env("SCENARIO_CONFIG_PATH", ""))
                    .outputPath(env("RUNNER_OUTPUT_PATH", ""));
            String steps = env("RUNNER_STEPS", "");
            if (!steps.isEmpty()) {
                builder.steps(Integer.parseInt(steps));
            }
            String stepSeconds = env("RUNNER_STEP_SECONDS", "");
            if (!stepSeconds.isEmpty()) {
                builder.stepSeconds(Double.parseDouble(stepSeconds));
            }
            String start = env("RUNNER_START_TIME", "");
            if (!start.isEmpty()) {
                builder.startTime(Instant.parse(start));
            }
            return builder.build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalStateException(
                    "Failed to parse runner environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getParallelism() {
        return parallelism;
    }

    /** Step count override, or {@code null} to use the scenario's. */
    public Integer getSteps() {
        return steps;
    }

    /** Step length override in seconds, or {@code null}. */
    public Double getStepSeconds() {
        return stepSeconds;
    }

    /** Start time override, or {@code null}. */
    public Instant getStartTime() {
        return startTime;
    }

    /** Scenario file path; blank means the classpath {@code scenario.yml}. */
    public String getScenarioConfigPath() {
        return scenarioConfigPath;
    }

    /** Output file path; blank means standard output. */
    public String getOutputPath() {
        return outputPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * {@link #build()} checks that parallelism is at least 1 and that the
     * overrides, where set, are in range (steps &gt;= 0, step length &gt; 0).
     * </p>
     */
    public static class Builder {
        private int parallelism = 1;
        private Integer steps;
        private Double stepSeconds;
        private Instant startTime;
        private String scenarioConfigPath = "";
        private String outputPath = "";

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder steps(Integer v) {
            this.steps = v;
            return this;
        }

        public Builder stepSeconds(Double v) {
            this.stepSeconds = v;
            return this;
        }

        public Builder startTime(Instant v) {
            this.startTime = v;
            return this;
        }

        public Builder scenarioConfigPath(String v) {
            this.scenarioConfigPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (steps != null && steps < 0) {
                throw new IllegalArgumentException("steps must be >= 0, got: " + steps);
            }
            if (stepSeconds != null && !(stepSeconds > 0 && Double.isFinite(stepSeconds))) {
                throw new IllegalArgumentException("stepSeconds must be > 0, got: " + stepSeconds);
            }
            if (scenarioConfigPath == null) {
                scenarioConfigPath = "";
            }
            if (outputPath == null) {
                outputPath = "";
            }
            return new RunnerConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "parallelism=" + parallelism +
                ", steps=" + steps +
                ", stepSeconds=" + stepSeconds +
                ", startTime=" + startTime +
                ", scenarioConfigPath='" + scenarioConfigPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                '}';
    }
}
