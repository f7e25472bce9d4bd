package com.ryuqq.pipeline.resolution;

import com.ryuqq.pipeline.resolution.match.BlockingIndex;
import com.ryuqq.pipeline.resolution.match.MergeGroup;
import com.ryuqq.pipeline.resolution.match.MergeGrouper;
import com.ryuqq.pipeline.resolution.match.RecordFeatures;
import com.ryuqq.pipeline.resolution.match.WeightedRecordScorer;
import com.ryuqq.pipeline.resolution.merge.CanonicalRecord;
import com.ryuqq.pipeline.resolution.merge.Canonicalizer;
import com.ryuqq.pipeline.resolution.normalize.RecordFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 엔티티 해석 / 중복 제거 엔진.
 *
 * <p><strong>두 가지 동작 모드:</strong></p>
 * <ul>
 *   <li>{@link #dedupe(List)}: 한 배치 안의 중복 레코드 병합</li>
 *   <li>{@link #resolve(List, List)}: 새 레코드를 기존 정규 엔티티에 해석 (병합 또는 신규 엔티티)</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong> 특징값 추출 → blocking 색인 → flood-fill 그룹화 → 정규 레코드 생성</p>
 *
 * <p><strong>출력 순서:</strong> 병합되지 않은 레코드를 입력 순서대로 먼저 배치하고,
 * 병합된 그룹의 정규 레코드를 그룹 최초 구성원의 입력 순서대로 뒤에 배치합니다.</p>
 *
 * <p>단일 스레드 동기 알고리즘이며 입력 레코드를 변경하지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class EntityResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(EntityResolutionEngine.class);

    private final ResolutionConfig config;
    private final MergeGrouper grouper;
    private final Canonicalizer canonicalizer;

    public EntityResolutionEngine(ResolutionConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 해석 설정
     * @param clock merged_at 기록용 시계
     */
    public EntityResolutionEngine(ResolutionConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.grouper = new MergeGrouper(new WeightedRecordScorer(config.weights()), config.threshold());
        this.canonicalizer = new Canonicalizer(clock);
    }

    /**
     * 배치 내 중복 제거.
     *
     * @param records 새로 추출된 레코드
     * @return 중복 제거 결과
     * @throws IllegalArgumentException records가 null인 경우
     */
    public DedupeResult dedupe(List<Map<String, Object>> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        log.info("Deduplicating {} records", records.size());

        Grouping grouping = group(records);
        List<Map<String, Object>> output = assemble(records, grouping.groups(), null, true);

        log.info("Deduplication complete: original={}, final={}, duplicate_groups={}",
            records.size(), output.size(), grouping.merging().size());
        return new DedupeResult(output, grouping.merging(), records.size());
    }

    /**
     * 교차 배치 해석.
     *
     * <p>결합 입력은 기존 엔티티 뒤에 새 레코드를 이어 붙인 목록입니다.</p>
     *
     * @param newRecords 새 레코드
     * @param existingEntities 이전에 정규화된 엔티티 (null이면 빈 목록)
     * @return 해석 결과 (전체 정규 엔티티 + 별칭 매핑)
     * @throws IllegalArgumentException newRecords가 null인 경우
     */
    public ResolutionResult resolve(List<Map<String, Object>> newRecords, List<Map<String, Object>> existingEntities) {
        if (newRecords == null) {
            throw new IllegalArgumentException("newRecords cannot be null");
        }
        List<Map<String, Object>> existing = existingEntities == null ? List.of() : existingEntities;
        log.info("Resolving {} records against {} existing entities", newRecords.size(), existing.size());

        List<Map<String, Object>> combined = new ArrayList<>(existing.size() + newRecords.size());
        combined.addAll(existing);
        combined.addAll(newRecords);

        Grouping grouping = group(combined);
        Map<String, List<String>> aliasMappings = new LinkedHashMap<>();
        List<Map<String, Object>> output = assemble(combined, grouping.groups(), aliasMappings, false);

        log.info("Resolution complete: input_records={}, canonical_entities={}, merge_groups={}",
            newRecords.size(), output.size(), grouping.merging().size());
        return new ResolutionResult(output, aliasMappings, grouping.merging(), newRecords.size());
    }

    private Grouping group(List<Map<String, Object>> records) {
        List<RecordFeatures> features = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            features.add(RecordFeatures.of(record));
        }
        BlockingIndex index = new BlockingIndex(features, config.minNameTokenLength());
        List<MergeGroup> groups = grouper.group(index);

        List<MergeGroup> merging = new ArrayList<>();
        for (MergeGroup group : groups) {
            if (group.merges()) {
                merging.add(group);
            }
        }
        return new Grouping(groups, merging);
    }

    private List<Map<String, Object>> assemble(
        List<Map<String, Object>> records,
        List<MergeGroup> groups,
        Map<String, List<String>> aliasMappings,
        boolean tagGroup
    ) {
        List<Map<String, Object>> passThrough = new ArrayList<>();
        List<Map<String, Object>> merged = new ArrayList<>();

        // groups는 최초 구성원 순으로 생성되므로 별도 정렬이 필요 없음
        for (MergeGroup group : groups) {
            if (!group.merges()) {
                passThrough.add(records.get(group.earliest()));
                continue;
            }
            List<Map<String, Object>> members = new ArrayList<>(group.size());
            for (int index : group.members()) {
                members.add(records.get(index));
            }
            CanonicalRecord canonical = canonicalizer.canonicalize(members, config.strategy());
            if (tagGroup) {
                canonical.record().put("_duplicate_group", group.members());
            }
            if (aliasMappings != null && !canonical.aliases().isEmpty()) {
                String key = RecordFields.firstText(canonical.record(), "id", "company_name");
                aliasMappings.put(key, canonical.aliases());
            }
            merged.add(canonical.record());
        }

        // passThrough는 group.earliest() 순이며, 단일 구성원 그룹은 입력 순서와 같음
        List<Map<String, Object>> output = new ArrayList<>(passThrough.size() + merged.size());
        output.addAll(passThrough);
        output.addAll(merged);
        return output;
    }

    private record Grouping(List<MergeGroup> groups, List<MergeGroup> merging) {
    }
}
