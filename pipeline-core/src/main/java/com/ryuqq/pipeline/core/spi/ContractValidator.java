package com.ryuqq.pipeline.core.spi;

import java.util.Map;

/**
 * Contract validation SPI for task payloads.
 *
 * <p>Validation is advisory: callers log violations and continue executing the task.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContractValidator {

    /**
     * Validates a task payload against the contract of its task type.
     *
     * @param taskType the task type identifier
     * @param payload the task input
     * @return the validation report
     */
    ValidationReport validate(String taskType, Map<String, Object> payload);

    /**
     * A validator that accepts every payload.
     *
     * @return accept-all validator
     */
    static ContractValidator acceptAll() {
        return (taskType, payload) -> ValidationReport.ok();
    }
}
