package com.sensortwin.core.config;

import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.Position3D;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML definition of one point interference source.
 *
 * <pre>
 * - position: [10.0, 0.0, 2.0]
 *   frequency: 400.0
 *   strength: 5.0
 * </pre>
 *
 * @since 1.0.0
 */
public class SourceDefinition {

    private List<Number> position;
    private double frequency;
    private double strength;

    /**
     * Collect the problems of this definition into {@code errors}.
     *
     * @param label prefix used in error messages
     */
    void collectErrors(String label, List<String> errors) {
        if (!PositionCheck.isValid(position)) {
            errors.add(label + ": 'position' must be a list of three finite numbers");
        }
        if (!Double.isFinite(frequency) || frequency <= 0) {
            errors.add(label + ": 'frequency' must be > 0, got " + frequency);
        }
        if (!Double.isFinite(strength) || strength < 0) {
            errors.add(label + ": 'strength' must be >= 0, got " + strength);
        }
    }

    public InterferenceSource toSource() {
        return new InterferenceSource(Position3D.of(position), frequency, strength);
    }

    public List<Number> getPosition() {
        return position;
    }

    public void setPosition(List<Number> position) {
        this.position = position != null ? new ArrayList<>(position) : null;
    }

    public double getFrequency() {
        return frequency;
    }

    public void setFrequency(double frequency) {
        this.frequency = frequency;
    }

    public double getStrength() {
        return strength;
    }

    public void setStrength(double strength) {
        this.strength = strength;
    }

    @Override
    public String toString() {
        return "SourceDefinition{position=" + position
                + ", frequency=" + frequency
                + ", strength=" + strength + '}';
    }
}
