package com.ryuqq.pipeline.application.orchestrator;

/**
 * Handler for one pipeline phase.
 *
 * <p>A handler reads the buckets it needs from {@link PhaseContext#state()} and writes its
 * results back through the state's mutation methods. It never replaces the state object.</p>
 *
 * <p><strong>Failure signalling:</strong></p>
 * <ul>
 *   <li>{@link PhaseOutcome.Abort} - the phase failed; the orchestrator moves the run to FAILED</li>
 *   <li>Thrown exception - treated the same way, with the stack trace recorded as an error</li>
 *   <li>Individual task failures are data, not phase failures, unless the handler decides otherwise</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PhaseHandler {

    /**
     * Executes the phase.
     *
     * @param context state, spawner and configuration of the running job
     * @return outcome of the phase
     * @throws Exception any unexpected fault; converted to a FAILED run by the orchestrator
     */
    PhaseOutcome execute(PhaseContext context) throws Exception;
}
