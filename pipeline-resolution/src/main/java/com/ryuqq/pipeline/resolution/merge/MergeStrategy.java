package com.ryuqq.pipeline.resolution.merge;

import java.util.Locale;

/**
 * 그룹 병합 전략.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum MergeStrategy {

    /**
     * 기준 레코드의 필드만 유지 (연관 단체, provenance, 별칭만 합침).
     */
    KEEP_BEST,

    /**
     * 기준 레코드에 다른 구성원의 빈 필드, 목록 필드, 최대 수치까지 합침.
     */
    MERGE_ALL;

    /**
     * 외부 표기("keep_best", "merge_all")로부터 변환.
     *
     * @param value 전략 이름 (대소문자 무시)
     * @return 병합 전략
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static MergeStrategy from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be null or blank");
        }
        return MergeStrategy.valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
