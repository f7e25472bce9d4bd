package com.ryuqq.pipeline.core.state;

import com.ryuqq.pipeline.core.phase.PipelinePhase;

import java.time.Instant;
import java.util.List;

/**
 * 파이프라인 상태 요약.
 *
 * <p>체크포인트 문서와 작업 목록 조회에 사용되는 경량 스냅샷입니다.
 * 추출 건수는 버킷 길이가 아닌 누적 카운터 값입니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record StateSummary(
    String jobId,
    List<String> associations,
    PipelinePhase currentPhase,
    int queueSize,
    int visitedUrls,
    int blockedUrls,
    long urlsDiscovered,
    long pagesFetched,
    long companiesExtracted,
    long eventsExtracted,
    long participantsExtracted,
    long signalsDetected,
    long entitiesResolved,
    int errors,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId 또는 currentPhase가 null인 경우
     */
    public StateSummary {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (currentPhase == null) {
            throw new IllegalArgumentException("currentPhase cannot be null");
        }
        associations = associations == null ? List.of() : List.copyOf(associations);
    }
}
