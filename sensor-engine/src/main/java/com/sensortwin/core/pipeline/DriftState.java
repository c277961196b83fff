package com.sensortwin.core.pipeline;

/**
 * Calibration error as a function of operating time.
 *
 * <p>
 * {@code gain(t) = baseGain * (1 + gainDriftPerHour * t)} and
 * {@code offset(t) = baseOffset + offsetDriftPerHour * t}. Values are computed
 * from the supplied hours on every call; nothing accumulates between calls.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftState {

    private final double baseGain;
    private final double gainDriftPerHour;
    private final double baseOffset;
    private final double offsetDriftPerHour;

    public DriftState(double baseGain, double gainDriftPerHour, double baseOffset, double offsetDriftPerHour) {
        this.baseGain = baseGain;
        this.gainDriftPerHour = gainDriftPerHour;
        this.baseOffset = baseOffset;
        this.offsetDriftPerHour = offsetDriftPerHour;
    }

    public double gainAt(double hours) {
        return baseGain * (1.0 + gainDriftPerHour * hours);
    }

    public double offsetAt(double hours) {
        return baseOffset + offsetDriftPerHour * hours;
    }

    public double getBaseGain() {
        return baseGain;
    }

    public double getGainDriftPerHour() {
        return gainDriftPerHour;
    }

    public double getBaseOffset() {
        return baseOffset;
    }

    public double getOffsetDriftPerHour() {
        return offsetDriftPerHour;
    }

    @Override
    public String toString() {
        return "DriftState{baseGain=" + baseGain
                + ", gainDriftPerHour=" + gainDriftPerHour
                + ", baseOffset=" + baseOffset
                + ", offsetDriftPerHour=" + offsetDriftPerHour + '}';
    }
}
