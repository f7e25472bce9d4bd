package com.ryuqq.pipeline.core.task;

import java.util.Map;

/**
 * 파이프라인 작업 단위 (Agent) 계약.
 *
 * <p>스크래퍼, 외부 API 클라이언트, 점수 계산기 등 구체 구현은 모두 이 인터페이스를 구현합니다.
 * 구현체는 {@link com.ryuqq.pipeline.core.state.PipelineState}를 직접 변경하지 않고
 * 결과 payload만 반환합니다.</p>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>일반적인 실패는 {@link TaskFailure}로 반환하는 것을 권장</li>
 *   <li>예상하지 못한 예외는 던져도 됨 (Spawner가 {@link TaskFailure}로 변환)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskUnit {

    /**
     * 작업 실행.
     *
     * @param payload 작업 유형별 입력 payload
     * @return 실행 결과
     * @throws Exception 예상하지 못한 오류 (Spawner가 실패 결과로 변환)
     */
    TaskResult execute(Map<String, Object> payload) throws Exception;
}
