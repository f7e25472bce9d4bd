/**
 * Pipeline phase state machine.
 *
 * <p>{@link com.ryuqq.pipeline.application.orchestrator.PipelineOrchestrator} walks the fixed
 * phase order, runs one {@link com.ryuqq.pipeline.application.orchestrator.PhaseHandler} per
 * phase and checkpoints after every transition. A handler abort or an uncaught exception moves
 * the run to FAILED. An interrupted run is resumed from its last saved state.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.application.orchestrator;
