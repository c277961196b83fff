/**
 * Configuration of sensors and scenarios.
 *
 * <p>
 * Every sensor parameter is declared in a per-modality
 * {@link com.sensortwin.core.config.ParameterTable} built by
 * {@link com.sensortwin.core.config.ParameterTables}, with a default and a
 * validity domain. {@link com.sensortwin.core.config.SensorConfig} resolves a
 * sensor's overrides against that table once, at construction, and fails with
 * {@link com.sensortwin.core.config.ConfigError} listing every problem.
 * </p>
 *
 * <p>
 * Scenario files are YAML, loaded by
 * {@link com.sensortwin.core.config.ScenarioLoader} into
 * {@link com.sensortwin.core.config.ScenarioConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensortwin.core.config;
