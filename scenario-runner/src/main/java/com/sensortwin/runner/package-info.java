/**
 * Scenario runner: loads a scenario, builds its sensors and drives them over
 * time on a thread pool, writing one JSON line per labeled sample.
 *
 * <p>
 * Configuration is resolved from environment variables by
 * {@link com.sensortwin.runner.RunnerConfig}; the entry point is
 * {@link com.sensortwin.runner.ScenarioRunner}.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensortwin.runner;
