package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.state.PipelineState;

import java.time.Instant;
import java.util.List;

/**
 * 저장된 작업 목록 항목.
 *
 * @param jobId 작업 ID
 * @param associationCodes 대상 연관 단체 코드
 * @param currentPhase 현재 단계
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 갱신 시각
 * @param completedAt 완료 시각 (미완료면 null)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record JobInfo(
    String jobId,
    List<String> associationCodes,
    PipelinePhase currentPhase,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {

    public JobInfo {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        associationCodes = associationCodes == null ? List.of() : List.copyOf(associationCodes);
    }

    public static JobInfo from(PipelineState state) {
        return new JobInfo(
            state.getJobId(),
            state.getAssociationCodes(),
            state.getCurrentPhase(),
            state.getCreatedAt(),
            state.getUpdatedAt(),
            state.getCompletedAt()
        );
    }

    public boolean completed() {
        return completedAt != null;
    }
}
