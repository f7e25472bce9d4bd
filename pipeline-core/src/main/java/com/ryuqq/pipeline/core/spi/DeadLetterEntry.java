package com.ryuqq.pipeline.core.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dead Letter Queue 항목.
 *
 * @param timestamp 기록 시각
 * @param agentType 실패한 작업 유형
 * @param task 작업 입력 payload
 * @param error 실패 메시지
 * @param context 부가 정보
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record DeadLetterEntry(
    Instant timestamp,
    String agentType,
    Map<String, Object> task,
    String error,
    Map<String, Object> context
) {

    public DeadLetterEntry {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agentType cannot be null or blank");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        task = task == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(task));
        context = context == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
