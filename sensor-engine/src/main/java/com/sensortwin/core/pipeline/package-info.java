/**
 * The sensor imperfection pipeline.
 *
 * <p>
 * An {@link com.sensortwin.core.pipeline.ImperfectionPipeline} threads an
 * immutable {@link com.sensortwin.core.pipeline.ReadingState} through an
 * ordered subset of {@link com.sensortwin.core.pipeline.ImperfectionStage}s.
 * The order is fixed by {@link com.sensortwin.core.pipeline.StageKind}; a
 * modality may leave stages out but never reorder them. Randomness comes only
 * from the per-sample generator in the
 * {@link com.sensortwin.core.pipeline.StageContext}.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensortwin.core.pipeline;
