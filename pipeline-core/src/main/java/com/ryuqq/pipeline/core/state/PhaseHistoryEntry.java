package com.ryuqq.pipeline.core.state;

import com.ryuqq.pipeline.core.phase.PipelinePhase;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 단계 전이 이력 항목.
 *
 * <p>전이가 일어날 때마다 종료되는 단계 기준으로 한 건씩 추가됩니다.</p>
 *
 * @param phase 종료된 단계
 * @param nextPhase 전이된 단계
 * @param startedAt 단계 시작 시각
 * @param endedAt 단계 종료 시각
 * @param stats 종료 시점의 누적 카운터 스냅샷
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record PhaseHistoryEntry(
    PipelinePhase phase,
    PipelinePhase nextPhase,
    Instant startedAt,
    Instant endedAt,
    Map<String, Long> stats
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException phase 또는 nextPhase가 null인 경우
     */
    public PhaseHistoryEntry {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (nextPhase == null) {
            throw new IllegalArgumentException("nextPhase cannot be null");
        }
        stats = stats == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }
}
