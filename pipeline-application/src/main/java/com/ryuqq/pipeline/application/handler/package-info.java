/**
 * Default phase handlers for the association pipeline.
 *
 * <p>Each handler drives one phase by spawning the external task types named in
 * {@link com.ryuqq.pipeline.application.handler.TaskTypes} and folding their results into the
 * {@link com.ryuqq.pipeline.core.state.PipelineState}. VALIDATION and RESOLUTION call the entity
 * resolution engine in-process. {@link com.ryuqq.pipeline.application.handler.DefaultPhaseHandlers}
 * wires the full set.</p>
 */
package com.ryuqq.pipeline.application.handler;
