package com.sensortwin.runner;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts of a finished run: steps, samples and labels per anomaly type.
 */
public final class RunSummary {

    private final long steps;
    private final long samples;
    private final Map<String, Long> labelCounts;

    RunSummary(long steps, long samples, Map<String, Long> labelCounts) {
        this.steps = steps;
        this.samples = samples;
        this.labelCounts = Collections.unmodifiableMap(new TreeMap<>(labelCounts));
    }

    public long getSteps() {
        return steps;
    }

    public long getSamples() {
        return samples;
    }

    /** Label counts keyed by anomaly type, sorted by type. */
    public Map<String, Long> getLabelCounts() {
        return labelCounts;
    }

    @Override
    public String toString() {
        return "RunSummary{steps=" + steps + ", samples=" + samples + ", labels=" + labelCounts + '}';
    }
}
