/**
 * Domain model classes for the sensor engine.
 *
 * <p>
 * Value types shared by the imperfection pipeline, the ground-truth
 * evaluator and the scenario runner:
 * </p>
 * <ul>
 * <li>{@link com.sensortwin.core.model.IdealReading}: true field value at a
 * sensor</li>
 * <li>{@link com.sensortwin.core.model.ObservedReading}: reading after all
 * imperfections</li>
 * <li>{@link com.sensortwin.core.model.AnomalyLabel}: ground-truth
 * annotation</li>
 * <li>{@link com.sensortwin.core.model.LabeledSample}: one emitted record</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.sensortwin.core.model;
