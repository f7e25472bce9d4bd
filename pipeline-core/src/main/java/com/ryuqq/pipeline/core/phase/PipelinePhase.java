package com.ryuqq.pipeline.core.phase;

import java.util.Optional;

/**
 * 파이프라인 실행 단계.
 *
 * <p>단계 순서는 선언 순서와 동일하며 고정되어 있습니다.</p>
 *
 * <p><strong>단계 흐름:</strong></p>
 * <pre>
 * INIT → GATEKEEPER → DISCOVERY → CLASSIFICATION → EXTRACTION → ENRICHMENT
 *      → VALIDATION → RESOLUTION → GRAPH → EXPORT → MONITOR → DONE
 *
 * 모든 비종료 단계 ─► FAILED
 * EXPORT ─► DONE (MONITOR 생략 가능)
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum PipelinePhase {

    /**
     * 초기화 (연관 단체 설정 로드, 시드 URL 적재).
     */
    INIT,

    /**
     * 접근 허용 여부 확인 (robots, 인증).
     */
    GATEKEEPER,

    /**
     * 회원 URL 탐색.
     */
    DISCOVERY,

    /**
     * 페이지 유형 분류.
     */
    CLASSIFICATION,

    /**
     * 레코드 추출.
     */
    EXTRACTION,

    /**
     * 외부 데이터 보강.
     */
    ENRICHMENT,

    /**
     * 중복 제거 및 검증.
     */
    VALIDATION,

    /**
     * 엔티티 해석 (정규 엔티티 생성).
     */
    RESOLUTION,

    /**
     * 관계 그래프 구성.
     */
    GRAPH,

    /**
     * 내보내기.
     */
    EXPORT,

    /**
     * 소스 모니터링 기준선 생성 (선택).
     */
    MONITOR,

    /**
     * 완료.
     */
    DONE,

    /**
     * 실패 (영구).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(DONE, FAILED)에서는 더 이상 다른 단계로 전이할 수 없습니다.</p>
     *
     * @return DONE 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * 고정 순서상 다음 단계 조회.
     *
     * <p>MONITOR의 다음 단계는 DONE이며, 종료 상태에는 다음 단계가 없습니다.</p>
     *
     * @return 다음 단계 (종료 상태이면 empty)
     */
    public Optional<PipelinePhase> next() {
        if (isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(values()[ordinal() + 1]);
    }

    /**
     * 고정 순서상 이 단계가 other보다 뒤에 있는지 확인.
     *
     * @param other 비교 대상 단계
     * @return 이 단계가 더 뒤에 있으면 true
     */
    public boolean isAfter(PipelinePhase other) {
        return ordinal() > other.ordinal();
    }
}
