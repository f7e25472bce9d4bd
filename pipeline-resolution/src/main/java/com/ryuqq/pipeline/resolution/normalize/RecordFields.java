package com.ryuqq.pipeline.resolution.normalize;

import java.util.Collection;
import java.util.Map;

/**
 * 레코드(Map) 필드 접근 유틸리티.
 *
 * <p>추출 레코드는 스키마가 고정되지 않은 {@code Map<String, Object>}이므로
 * 값의 존재 여부와 문자열 변환 규칙을 한 곳에서 정의합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class RecordFields {

    private RecordFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 값이 채워져 있는지 확인.
     *
     * <p>null, 빈 문자열, 0, 빈 컬렉션/Map, false는 비어있는 것으로 봅니다.</p>
     *
     * @param value 필드 값
     * @return 채워져 있으면 true
     */
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return true;
    }

    /**
     * 필드 값을 문자열로 조회.
     *
     * @param record 레코드
     * @param key 필드 이름
     * @return 문자열 값 (비어있으면 "")
     */
    public static String text(Map<String, Object> record, String key) {
        Object value = record.get(key);
        return isPresent(value) ? value.toString() : "";
    }

    /**
     * 첫 번째로 채워진 필드 값을 문자열로 조회.
     *
     * @param record 레코드
     * @param keys 우선순위 순 필드 이름
     * @return 문자열 값 (모두 비어있으면 "")
     */
    public static String firstText(Map<String, Object> record, String... keys) {
        for (String key : keys) {
            String value = text(record, key);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
}
