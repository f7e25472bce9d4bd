package com.ryuqq.pipeline.resolution.merge;

import java.util.List;
import java.util.Map;

/**
 * 병합 결과 정규 레코드.
 *
 * @param record 정규 레코드 (가변 복사본)
 * @param aliases 병합된 다른 구성원의 회사명
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record CanonicalRecord(
    Map<String, Object> record,
    List<String> aliases
) {

    public CanonicalRecord {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
