package com.ryuqq.pipeline.core.task;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 작업 실행기 (Task Spawner) 계약.
 *
 * <p>작업 유형 식별자를 구현체로 해석하고, 타임아웃 안에서 실행합니다.
 * 타임아웃과 구현체 예외는 {@link TaskFailure}로 변환되며 호출자에게 전파되지 않습니다.</p>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>알 수 없는 작업 유형은 실행 전에 {@link UnknownTaskTypeException} (설정 오류)</li>
 *   <li>{@code spawnMany} 결과 순서 = 입력 payload 순서</li>
 *   <li>한 작업의 실패/타임아웃은 다른 작업을 취소하지 않음</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface TaskSpawner {

    /**
     * 단일 작업 실행.
     *
     * @param taskType 작업 유형 식별자
     * @param payload 작업 입력
     * @param timeout 작업 타임아웃
     * @return 실행 결과 (예외를 던지지 않음)
     * @throws UnknownTaskTypeException 등록되지 않은 작업 유형인 경우
     */
    TaskResult spawn(String taskType, Map<String, Object> payload, Duration timeout);

    /**
     * 여러 작업을 동시 실행 상한 안에서 실행.
     *
     * @param taskType 작업 유형 식별자
     * @param payloads 작업 입력 목록
     * @param maxConcurrent 동시 실행 상한 (1 이상)
     * @param timeout 작업별 타임아웃
     * @return 입력과 같은 순서의 실행 결과
     * @throws UnknownTaskTypeException 등록되지 않은 작업 유형인 경우
     */
    List<TaskResult> spawnMany(String taskType, List<Map<String, Object>> payloads, int maxConcurrent, Duration timeout);
}
