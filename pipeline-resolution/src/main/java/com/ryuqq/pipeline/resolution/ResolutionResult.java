package com.ryuqq.pipeline.resolution;

import com.ryuqq.pipeline.resolution.match.MergeGroup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 교차 배치 해석 결과.
 *
 * <p>그룹 인덱스는 기존 엔티티 다음에 새 레코드가 이어지는 결합 입력 기준입니다.</p>
 *
 * @param canonicalEntities 전체 정규 엔티티 목록
 * @param aliasMappings 정규 엔티티 키(id, 없으면 company_name) → 별칭
 * @param mergeGroups 2개 이상 구성원이 병합된 그룹
 * @param recordsProcessed 처리한 새 레코드 수
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ResolutionResult(
    List<Map<String, Object>> canonicalEntities,
    Map<String, List<String>> aliasMappings,
    List<MergeGroup> mergeGroups,
    int recordsProcessed
) {

    public ResolutionResult {
        canonicalEntities = List.copyOf(canonicalEntities);
        aliasMappings = Collections.unmodifiableMap(new LinkedHashMap<>(aliasMappings));
        mergeGroups = List.copyOf(mergeGroups);
    }
}
