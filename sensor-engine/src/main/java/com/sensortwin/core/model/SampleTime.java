package com.sensortwin.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * The timestep a sample is taken at: step index, wall-clock timestamp and the
 * operating hours elapsed since the run started.
 *
 * <p>
 * Drift is a pure function of {@link #getElapsedHours()}; the step index
 * seeds per-sample randomness.
 * </p>
 *
 * @since 1.0.0
 */
public final class SampleTime {

    private final long step;
    private final Instant timestamp;
    private final double elapsedHours;

    /**
     * @param step         non-negative step index
     * @param timestamp    sample timestamp; must not be {@code null}
     * @param elapsedHours non-negative, finite elapsed operating hours
     * @throws IllegalArgumentException if {@code step} or {@code elapsedHours}
     *                                  is out of range
     */
    public SampleTime(long step, Instant timestamp, double elapsedHours) {
        if (step < 0) {
            throw new IllegalArgumentException("step must be >= 0, got: " + step);
        }
        if (!Double.isFinite(elapsedHours) || elapsedHours < 0) {
            throw new IllegalArgumentException(
                    "elapsedHours must be finite and >= 0, got: " + elapsedHours);
        }
        this.step = step;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.elapsedHours = elapsedHours;
    }

    /**
     * Time of step {@code step} in a run starting at {@code start} that
     * advances {@code stepSeconds} per step.
     */
    public static SampleTime atStep(Instant start, long step, double stepSeconds) {
        Objects.requireNonNull(start, "start must not be null");
        double offsetSeconds = step * stepSeconds;
        Instant timestamp = start.plus(Math.round(offsetSeconds * 1_000_000L), ChronoUnit.MICROS);
        return new SampleTime(step, timestamp, offsetSeconds / 3600.0);
    }

    public long getStep() {
        return step;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getTimestampUsec() {
        return ChronoUnit.MICROS.between(Instant.EPOCH, timestamp);
    }

    public double getElapsedHours() {
        return elapsedHours;
    }

    @Override
    public String toString() {
        return "SampleTime{step=" + step
                + ", timestamp=" + timestamp
                + ", elapsedHours=" + elapsedHours + '}';
    }
}
