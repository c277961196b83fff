/**
 * Sensors: the {@link com.sensortwin.core.sensor.Sensor} capability, its
 * per-modality implementation and the factory that assembles a sensor's
 * pipeline and ground-truth evaluator from one resolved configuration.
 *
 * @since 1.0.0
 */
package com.sensortwin.core.sensor;
