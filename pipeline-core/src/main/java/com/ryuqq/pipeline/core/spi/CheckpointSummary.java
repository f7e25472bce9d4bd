package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.state.StateSummary;

import java.time.Instant;

/**
 * 단계별 체크포인트 요약.
 *
 * <p>전체 상태 대신 단계 이름, 시각, 집계 카운터만 담는 가벼운 문서입니다.</p>
 *
 * @param jobId 작업 ID
 * @param phase 체크포인트 시점의 단계
 * @param timestamp 체크포인트 시각
 * @param summary 상태 요약
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record CheckpointSummary(
    String jobId,
    PipelinePhase phase,
    Instant timestamp,
    StateSummary summary
) {

    public CheckpointSummary {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (summary == null) {
            throw new IllegalArgumentException("summary cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * 현재 상태로부터 체크포인트 요약 생성.
     *
     * @param state 파이프라인 상태
     * @return 체크포인트 요약
     */
    public static CheckpointSummary of(PipelineState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return new CheckpointSummary(state.getJobId(), state.getCurrentPhase(), Instant.now(), state.summary());
    }
}
