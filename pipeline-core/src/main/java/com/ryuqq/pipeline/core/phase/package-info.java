/**
 * Pipeline phase state machine package.
 *
 * <p>This package defines the fixed, linear phase order of a pipeline run and the
 * transition rules between phases.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.phase.PipelinePhase} - Ordered, closed set of phases (enum)</li>
 *   <li>{@link com.ryuqq.pipeline.core.phase.PhaseTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * X → next(X)   for every non-terminal X
 * X → FAILED    for every non-terminal X
 * EXPORT → DONE (MONITOR is optional)
 *
 * Forbidden:
 * - DONE → * (terminal)
 * - FAILED → * (terminal)
 * - Backward transitions and skips (e.g., EXTRACTION → DISCOVERY, INIT → EXTRACTION)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * PipelinePhase phase = PipelinePhase.INIT;
 * phase = PhaseTransition.transition(phase, PipelinePhase.GATEKEEPER);
 *
 * // This will throw IllegalStateException
 * PhaseTransition.validate(phase, PipelinePhase.INIT);
 * </pre>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.phase;
