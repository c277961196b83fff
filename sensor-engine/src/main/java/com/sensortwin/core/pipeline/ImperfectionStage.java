package com.sensortwin.core.pipeline;

import com.sensortwin.core.model.NumericDegeneracyException;

/**
 * One step of the imperfection pipeline.
 *
 * <p>
 * A stage is a pure function of the incoming reading state, its own
 * configuration (captured at construction) and the per-sample
 * {@link StageContext}. Stages hold no mutable state and may be shared by
 * concurrently sampling threads.
 * </p>
 *
 * @since 1.0.0
 */
public interface ImperfectionStage {

    /**
     * @return the position of this stage in the fixed stage order
     */
    StageKind kind();

    /**
     * Transform {@code state}.
     *
     * @param state   reading state produced by the previous stage
     * @param context per-sample inputs
     * @return the new reading state; never {@code null}
     * @throws NumericDegeneracyException if the stage cannot produce a
     *                                    meaningful result for this sample
     */
    ReadingState apply(ReadingState state, StageContext context);
}
