package com.ryuqq.pipeline.core.task;

/**
 * 등록되지 않은 작업 유형 요청 시 발생하는 예외.
 *
 * <p>작업 단위 실패가 아닌 설정/프로그래밍 오류이므로 실패 결과로 변환하지 않고 즉시 전파합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class UnknownTaskTypeException extends IllegalArgumentException {

    private final String taskType;

    public UnknownTaskTypeException(String taskType) {
        super("Unknown task type: " + taskType);
        this.taskType = taskType;
    }

    public String getTaskType() {
        return taskType;
    }
}
