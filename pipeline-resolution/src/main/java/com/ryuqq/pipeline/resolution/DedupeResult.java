package com.ryuqq.pipeline.resolution;

import com.ryuqq.pipeline.resolution.match.MergeGroup;

import java.util.List;
import java.util.Map;

/**
 * 배치 내 중복 제거 결과.
 *
 * @param records 중복 제거된 레코드 (비병합 레코드 입력 순 → 병합 레코드 그룹 최초 구성원 순)
 * @param duplicateGroups 2개 이상 구성원이 병합된 그룹
 * @param inputCount 입력 레코드 수
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record DedupeResult(
    List<Map<String, Object>> records,
    List<MergeGroup> duplicateGroups,
    int inputCount
) {

    public DedupeResult {
        records = List.copyOf(records);
        duplicateGroups = List.copyOf(duplicateGroups);
    }

    /**
     * 제거된 중복 레코드 수.
     */
    public int duplicatesFound() {
        return inputCount - records.size();
    }
}
