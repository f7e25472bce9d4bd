package com.ryuqq.pipeline.core.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업 실패 결과.
 *
 * <p>타임아웃, 구현체 예외, 업무 실패를 모두 이 형태로 표현합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>타임아웃: errorType=TimeoutException, error="Timeout after 300s"</li>
 *   <li>구현체 예외: errorType=예외 클래스 simple name</li>
 * </ul>
 *
 * @param errorType 오류 유형
 * @param error 오류 메시지
 * @param context 부가 정보 (task_index, task_ref 등, 불변)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record TaskFailure(
    String errorType,
    String error,
    Map<String, Object> context
) implements TaskResult {

    /**
     * 타임아웃 실패의 오류 유형.
     */
    public static final String TIMEOUT_ERROR_TYPE = "TimeoutException";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorType이 null이거나 빈 문자열인 경우
     */
    public TaskFailure {
        if (errorType == null || errorType.isBlank()) {
            throw new IllegalArgumentException("errorType cannot be null or blank");
        }
        if (error == null) {
            error = "";
        }
        context = context == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * context 없이 TaskFailure 생성.
     *
     * @param errorType 오류 유형
     * @param error 오류 메시지
     * @return TaskFailure 인스턴스
     */
    public static TaskFailure of(String errorType, String error) {
        return new TaskFailure(errorType, error, null);
    }

    /**
     * 예외로부터 TaskFailure 생성.
     *
     * @param throwable 원인 예외
     * @return TaskFailure 인스턴스 (errorType = 예외 simple name)
     */
    public static TaskFailure from(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        return new TaskFailure(throwable.getClass().getSimpleName(), String.valueOf(throwable.getMessage()), null);
    }

    /**
     * 타임아웃 실패 생성.
     *
     * @param timeoutSeconds 타임아웃 (초)
     * @return TaskFailure 인스턴스
     */
    public static TaskFailure timeout(long timeoutSeconds) {
        return new TaskFailure(TIMEOUT_ERROR_TYPE, "Timeout after " + timeoutSeconds + "s", null);
    }

    @Override
    public long recordsProcessed() {
        return 0;
    }

    /**
     * context에 항목을 추가한 새 인스턴스 생성.
     *
     * @param extra 추가할 context 항목
     * @return 새 TaskFailure 인스턴스
     */
    public TaskFailure withContext(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        if (extra != null) {
            merged.putAll(extra);
        }
        return new TaskFailure(errorType, error, merged);
    }
}
