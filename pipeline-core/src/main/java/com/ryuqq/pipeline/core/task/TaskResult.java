package com.ryuqq.pipeline.core.task;

/**
 * 작업 실행 결과.
 *
 * <ul>
 *   <li>{@link TaskSuccess}: 작업 성공 (결과 데이터 포함)</li>
 *   <li>{@link TaskFailure}: 작업 실패 (타임아웃, 예외, 업무 실패)</li>
 * </ul>
 *
 * <p>Spawner 경계 밖으로는 예외가 아닌 이 타입만 전달됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public sealed interface TaskResult permits TaskSuccess, TaskFailure {

    /**
     * 처리한 레코드 수.
     *
     * @return 처리 레코드 수 (실패 시 0)
     */
    long recordsProcessed();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof TaskSuccess;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof TaskFailure;
    }
}
