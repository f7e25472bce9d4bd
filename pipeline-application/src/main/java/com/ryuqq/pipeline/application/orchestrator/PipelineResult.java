package com.ryuqq.pipeline.application.orchestrator;

import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.state.ErrorRecord;
import com.ryuqq.pipeline.core.state.PhaseHistoryEntry;
import com.ryuqq.pipeline.core.state.PipelineState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 실행 최종 결과.
 *
 * <p>success는 최종 단계가 DONE일 때만 true입니다.
 * 실패한 실행도 오류 목록 전체와 단계 이력을 포함합니다.</p>
 *
 * @param success 성공 여부
 * @param jobId 작업 ID
 * @param finalPhase 최종 단계
 * @param associations 대상 단체 코드
 * @param totals 누적 카운터
 * @param exports 생성된 내보내기 목록
 * @param errors 오류 기록 전체
 * @param phaseHistory 단계 이력
 * @param startedAt 작업 생성 시각
 * @param completedAt 결과 생성 시각
 * @param recordsProcessed 처리한 페이지 수 (방문 URL 수)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record PipelineResult(
    boolean success,
    String jobId,
    PipelinePhase finalPhase,
    List<String> associations,
    Map<String, Long> totals,
    List<Map<String, Object>> exports,
    List<ErrorRecord> errors,
    List<PhaseHistoryEntry> phaseHistory,
    Instant startedAt,
    Instant completedAt,
    long recordsProcessed
) {

    public PipelineResult {
        associations = List.copyOf(associations);
        totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
        exports = List.copyOf(exports);
        errors = List.copyOf(errors);
        phaseHistory = List.copyOf(phaseHistory);
    }

    /**
     * 상태로부터 결과 생성.
     *
     * @param state 파이프라인 상태
     * @param completedAt 결과 생성 시각
     * @return PipelineResult
     */
    public static PipelineResult from(PipelineState state, Instant completedAt) {
        Map<String, Long> totals = new LinkedHashMap<>();
        totals.put("urls_discovered", state.getTotalUrlsDiscovered());
        totals.put("pages_fetched", state.getTotalPagesFetched());
        totals.put("companies_extracted", state.getTotalCompaniesExtracted());
        totals.put("events_extracted", state.getTotalEventsExtracted());
        totals.put("participants_extracted", state.getTotalParticipantsExtracted());
        totals.put("signals_detected", state.getTotalSignalsDetected());
        totals.put("entities_resolved", state.getTotalEntitiesResolved());

        return new PipelineResult(
            state.getCurrentPhase() == PipelinePhase.DONE,
            state.getJobId(),
            state.getCurrentPhase(),
            state.getAssociationCodes(),
            totals,
            state.getExports(),
            state.getErrors(),
            state.getPhaseHistory(),
            state.getCreatedAt(),
            completedAt,
            state.getVisitedUrls().size()
        );
    }
}
