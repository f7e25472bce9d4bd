package com.ryuqq.pipeline.core.state;

import com.ryuqq.pipeline.core.phase.PipelinePhase;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 파이프라인 실행 중 발생한 오류 기록.
 *
 * <p>추가 전용이며, 기록 후 수정하거나 삭제하지 않습니다.</p>
 *
 * @param phase 오류가 발생한 단계
 * @param agent 오류를 보고한 주체 (task type 또는 "orchestrator")
 * @param errorType 오류 유형 (예외 클래스 simple name 등)
 * @param errorMessage 오류 메시지
 * @param url 관련 URL (null 가능)
 * @param context 부가 정보 (불변)
 * @param occurredAt 발생 시각 (null이면 현재 시각)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ErrorRecord(
    PipelinePhase phase,
    String agent,
    String errorType,
    String errorMessage,
    String url,
    Map<String, Object> context,
    Instant occurredAt
) {

    /**
     * 오케스트레이터가 직접 남기는 오류의 agent 이름.
     */
    public static final String ORCHESTRATOR_AGENT = "orchestrator";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException phase, agent, errorType이 비어있는 경우
     */
    public ErrorRecord {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (agent == null || agent.isBlank()) {
            throw new IllegalArgumentException("agent cannot be null or blank");
        }
        if (errorType == null || errorType.isBlank()) {
            throw new IllegalArgumentException("errorType cannot be null or blank");
        }
        context = context == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
    }

    /**
     * URL과 context 없이 오류 기록 생성.
     *
     * @param phase 발생 단계
     * @param agent 보고 주체
     * @param errorType 오류 유형
     * @param errorMessage 오류 메시지
     * @return ErrorRecord 인스턴스
     */
    public static ErrorRecord of(PipelinePhase phase, String agent, String errorType, String errorMessage) {
        return new ErrorRecord(phase, agent, errorType, errorMessage, null, null, null);
    }
}
