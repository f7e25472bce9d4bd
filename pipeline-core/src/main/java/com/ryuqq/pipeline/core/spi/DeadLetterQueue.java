package com.ryuqq.pipeline.core.spi;

import java.util.List;
import java.util.Map;

/**
 * Dead Letter Queue SPI for failed task executions.
 *
 * <p>Every failed task result is recorded here for later inspection or manual replay.
 * The pipeline never fails because of a dead-letter write: implementations log write
 * errors instead of propagating them.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface DeadLetterQueue {

    /**
     * Records one failed task.
     *
     * @param taskType the task type identifier
     * @param payload the task input
     * @param error the failure message
     * @param context additional failure context (error type, task index, task ref)
     */
    void push(String taskType, Map<String, Object> payload, String error, Map<String, Object> context);

    /**
     * Reads every recorded entry in push order.
     *
     * @return dead-letter entries
     */
    List<DeadLetterEntry> readAll();

    /**
     * Number of recorded entries.
     *
     * @return entry count
     */
    int count();

    /**
     * A dead-letter queue that discards every entry.
     *
     * @return no-op queue
     */
    static DeadLetterQueue discarding() {
        return new DeadLetterQueue() {
            @Override
            public void push(String taskType, Map<String, Object> payload, String error, Map<String, Object> context) {
            }

            @Override
            public List<DeadLetterEntry> readAll() {
                return List.of();
            }

            @Override
            public int count() {
                return 0;
            }
        };
    }
}
