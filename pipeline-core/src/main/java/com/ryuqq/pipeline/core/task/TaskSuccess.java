package com.ryuqq.pipeline.core.task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 작업 성공 결과.
 *
 * <p>작업 유형별 필드(records, member_urls, verdict 등)는 {@code data}에 담깁니다.</p>
 *
 * @param recordsProcessed 처리 레코드 수 (0 이상)
 * @param data 작업 유형별 결과 데이터 (불변)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record TaskSuccess(
    long recordsProcessed,
    Map<String, Object> data
) implements TaskResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException recordsProcessed가 음수인 경우
     */
    public TaskSuccess {
        if (recordsProcessed < 0) {
            throw new IllegalArgumentException(
                "recordsProcessed must not be negative (current: " + recordsProcessed + ")"
            );
        }
        data = data == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * TaskSuccess 생성.
     *
     * @param recordsProcessed 처리 레코드 수
     * @param data 결과 데이터
     * @return TaskSuccess 인스턴스
     */
    public static TaskSuccess of(long recordsProcessed, Map<String, Object> data) {
        return new TaskSuccess(recordsProcessed, data);
    }

    /**
     * 결과 데이터 없이 TaskSuccess 생성.
     *
     * @param recordsProcessed 처리 레코드 수
     * @return TaskSuccess 인스턴스
     */
    public static TaskSuccess of(long recordsProcessed) {
        return new TaskSuccess(recordsProcessed, null);
    }

    /**
     * 단일 필드 조회.
     *
     * @param key 필드 이름
     * @return 값 (없으면 empty)
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(data.get(key));
    }

    /**
     * 레코드 목록 필드 조회.
     *
     * <p>Map이 아닌 원소는 무시합니다. 필드가 없거나 목록이 아니면 빈 목록을 반환합니다.</p>
     *
     * @param key 필드 이름 (예: "records", "companies")
     * @return 레코드 목록 (새 가변 Map 복사본)
     */
    public List<Map<String, Object>> records(String key) {
        Object value = data.get(key);
        List<Map<String, Object>> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof Map<?, ?> map) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    map.forEach((field, fieldValue) -> copy.put(String.valueOf(field), fieldValue));
                    result.add(copy);
                }
            }
        }
        return result;
    }

    /**
     * 문자열 목록 필드 조회.
     *
     * @param key 필드 이름 (예: "member_urls")
     * @return 문자열 목록 (null 원소 제외)
     */
    public List<String> strings(String key) {
        Object value = data.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        }
        return result;
    }
}
