package com.sensortwin.core.pipeline;

import com.sensortwin.core.model.Modality;
import com.sensortwin.core.model.NumericDegeneracyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered subset of imperfection stages for one modality.
 *
 * <p>
 * Stages must appear in {@link StageKind} order, each at most once; the
 * constructor rejects any other arrangement. When a stage raises
 * {@link NumericDegeneracyException} its contribution is skipped and the run
 * continues with the state from before that stage. The final primary value is
 * clamped to the modality's physical range.
 * </p>
 *
 * @since 1.0.0
 */
public final class ImperfectionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ImperfectionPipeline.class);

    private final Modality modality;
    private final List<ImperfectionStage> stages;

    public ImperfectionPipeline(Modality modality, List<ImperfectionStage> stages) {
        this.modality = Objects.requireNonNull(modality, "Modality must not be null");
        Objects.requireNonNull(stages, "Stage list must not be null");
        StageKind previous = null;
        for (ImperfectionStage stage : stages) {
            Objects.requireNonNull(stage, "Stage must not be null");
            StageKind kind = stage.kind();
            if (previous != null && kind.compareTo(previous) <= 0) {
                throw new IllegalArgumentException("Stage " + kind + " may not follow " + previous
                        + "; stages must run in the order " + List.of(StageKind.values()));
            }
            previous = kind;
        }
        this.stages = List.copyOf(stages);
    }

    /**
     * Thread {@code initial} through every stage.
     *
     * @param initial state built from the ideal reading
     * @param context per-sample inputs
     * @return the final state with the primary value clamped to the modality
     *         range
     */
    public ReadingState run(ReadingState initial, StageContext context) {
        Objects.requireNonNull(initial, "Initial state must not be null");
        Objects.requireNonNull(context, "StageContext must not be null");

        ReadingState state = initial;
        for (ImperfectionStage stage : stages) {
            try {
                state = Objects.requireNonNull(stage.apply(state, context),
                        () -> "Stage " + stage.kind() + " returned null");
            } catch (NumericDegeneracyException e) {
                LOG.warn("Sensor [{}]: skipping {} for this sample: {}",
                        context.getSensorId(), stage.kind(), e.getMessage());
            }
        }
        double clamped = modality.clamp(state.getPrimary());
        return clamped == state.getPrimary() ? state : state.withPrimary(clamped);
    }

    public Modality getModality() {
        return modality;
    }

    public List<StageKind> kinds() {
        return stages.stream().map(ImperfectionStage::kind).collect(Collectors.toUnmodifiableList());
    }

    public List<ImperfectionStage> getStages() {
        return stages;
    }

    @Override
    public String toString() {
        return "ImperfectionPipeline{" + modality.getKey() + ' ' + kinds() + '}';
    }
}
