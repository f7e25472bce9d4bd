package com.ryuqq.pipeline.resolution.merge;

import com.ryuqq.pipeline.resolution.normalize.RecordFields;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 병합 그룹의 정규(canonical) 레코드 생성.
 *
 * <p><strong>기준 레코드 선택:</strong> quality_score가 가장 높은 레코드.
 * quality_score가 없거나 0이면 완전성 점수(체크리스트 필드 중 채워진 비율, 0~100)를 사용합니다.
 * 동점이면 입력 순서가 빠른 레코드를 선택합니다.</p>
 *
 * <p><strong>공통 병합 결과:</strong></p>
 * <ul>
 *   <li>associations: 모든 구성원의 association / associations 합집합 (정렬)</li>
 *   <li>provenance: 모든 구성원의 provenance 연결</li>
 *   <li>aliases: 기준 레코드와 다른 구성원 회사명 (기존 별칭 포함, 중복 제거)</li>
 *   <li>merged_from_count, merged_at</li>
 * </ul>
 *
 * <p>{@link MergeStrategy#MERGE_ALL}은 추가로 빈 필드 채우기, 목록 합집합
 * (contacts는 email 또는 name 기준, 그 외는 값 기준), 수치 필드 최대값을 적용합니다.
 * 단, 매칭 신호 필드({@link #MATCH_FIELDS})는 채우지 않습니다. 정규 레코드의 매칭 신호는
 * 항상 기준 레코드 하나의 신호와 같으므로, 결과를 다시 중복 제거해도 추가 병합이 생기지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class Canonicalizer {

    /**
     * 완전성 점수 체크리스트.
     */
    public static final List<String> COMPLETENESS_FIELDS = List.of(
        "company_name", "website", "domain", "city", "state",
        "employee_count_min", "revenue_min_usd", "industry",
        "erp_system", "contacts"
    );

    /**
     * 병합 시 최대값을 취하는 수치 필드.
     */
    public static final Set<String> MAX_NUMERIC_FIELDS = Set.of(
        "employee_count_min", "employee_count_max", "revenue_min_usd", "quality_score"
    );

    /**
     * 매칭 점수와 블로킹에 쓰이는 필드. MERGE_ALL에서도 다른 구성원 값으로 채우지 않음.
     */
    public static final Set<String> MATCH_FIELDS = Set.of(
        "company_name", "website", "domain", "phone", "city", "state", "full_address"
    );

    private static final Set<String> PROTECTED_FIELDS = Set.of("id", "created_at");

    private final Clock clock;

    public Canonicalizer(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 그룹 구성원을 하나의 정규 레코드로 병합.
     *
     * @param members 구성원 레코드 (입력 순서)
     * @param strategy 병합 전략
     * @return 정규 레코드와 별칭
     * @throws IllegalArgumentException members가 비어있는 경우
     */
    public CanonicalRecord canonicalize(List<Map<String, Object>> members, MergeStrategy strategy) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("members cannot be null or empty");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (members.size() == 1) {
            return new CanonicalRecord(new LinkedHashMap<>(members.get(0)), List.of());
        }

        List<Map<String, Object>> ranked = rank(members);
        Map<String, Object> canonical = new LinkedHashMap<>(ranked.get(0));
        List<String> aliases = collectAliases(canonical, ranked);

        if (strategy == MergeStrategy.MERGE_ALL) {
            for (Map<String, Object> other : ranked.subList(1, ranked.size())) {
                mergeInto(canonical, other);
            }
        }

        canonical.put("merged_at", Instant.now(clock).toString());
        canonical.put("merged_from_count", members.size());
        canonical.put("aliases", aliases);

        List<Object> provenance = collectProvenance(ranked);
        if (!provenance.isEmpty()) {
            canonical.put("provenance", provenance);
        }
        Set<String> associations = collectAssociations(ranked);
        if (!associations.isEmpty()) {
            canonical.put("associations", new ArrayList<>(associations));
        }
        return new CanonicalRecord(canonical, aliases);
    }

    /**
     * 기준 레코드 선택 점수.
     *
     * @param record 레코드
     * @return quality_score (없거나 0이면 완전성 점수)
     */
    public static double selectionScore(Map<String, Object> record) {
        Object quality = record.get("quality_score");
        if (quality instanceof Number number && number.doubleValue() != 0.0) {
            return number.doubleValue();
        }
        return completeness(record);
    }

    /**
     * 완전성 점수 (0 ~ 100, 정수 내림).
     */
    public static int completeness(Map<String, Object> record) {
        int filled = 0;
        for (String field : COMPLETENESS_FIELDS) {
            if (RecordFields.isPresent(record.get(field))) {
                filled++;
            }
        }
        return (filled * 100) / COMPLETENESS_FIELDS.size();
    }

    // 점수 내림차순, 동점은 입력 순서 유지 (List.sort는 stable)
    private static List<Map<String, Object>> rank(List<Map<String, Object>> members) {
        List<Map<String, Object>> ranked = new ArrayList<>(members);
        ranked.sort(Comparator.comparingDouble(Canonicalizer::selectionScore).reversed());
        return ranked;
    }

    private static List<String> collectAliases(Map<String, Object> canonical, List<Map<String, Object>> ranked) {
        String canonicalName = RecordFields.text(canonical, "company_name");
        Set<String> aliases = new LinkedHashSet<>();
        for (Map<String, Object> record : ranked) {
            Object existing = record.get("aliases");
            if (existing instanceof Collection<?> collection) {
                for (Object alias : collection) {
                    if (alias != null) {
                        aliases.add(alias.toString());
                    }
                }
            }
        }
        for (Map<String, Object> record : ranked.subList(1, ranked.size())) {
            String name = RecordFields.text(record, "company_name");
            if (!name.isEmpty()) {
                aliases.add(name);
            }
        }
        aliases.remove(canonicalName);
        return new ArrayList<>(aliases);
    }

    private static List<Object> collectProvenance(List<Map<String, Object>> ranked) {
        List<Object> provenance = new ArrayList<>();
        for (Map<String, Object> record : ranked) {
            Object value = record.get("provenance");
            if (value instanceof Collection<?> collection) {
                provenance.addAll(collection);
            } else if (RecordFields.isPresent(value)) {
                provenance.add(value);
            }
        }
        return provenance;
    }

    private static Set<String> collectAssociations(List<Map<String, Object>> ranked) {
        Set<String> associations = new TreeSet<>();
        for (Map<String, Object> record : ranked) {
            Object list = record.get("associations");
            if (list instanceof Collection<?> collection) {
                for (Object code : collection) {
                    if (RecordFields.isPresent(code)) {
                        associations.add(code.toString());
                    }
                }
            }
            Object single = record.get("association");
            if (single instanceof Collection<?> collection) {
                for (Object code : collection) {
                    if (RecordFields.isPresent(code)) {
                        associations.add(code.toString());
                    }
                }
            } else if (RecordFields.isPresent(single)) {
                associations.add(single.toString());
            }
        }
        return associations;
    }

    private static void mergeInto(Map<String, Object> target, Map<String, Object> source) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key.startsWith("_") || PROTECTED_FIELDS.contains(key)) {
                continue;
            }
            Object existing = target.get(key);

            if (!RecordFields.isPresent(existing) && RecordFields.isPresent(value)) {
                if (MATCH_FIELDS.contains(key)) {
                    continue;
                }
                target.put(key, value instanceof List<?> list ? new ArrayList<>(list) : value);
                continue;
            }

            if (existing instanceof List<?> existingList && value instanceof List<?> valueList) {
                target.put(key, "contacts".equals(key)
                    ? unionContacts(existingList, valueList)
                    : unionValues(existingList, valueList));
                continue;
            }

            if (MAX_NUMERIC_FIELDS.contains(key)
                && existing instanceof Number existingNumber
                && value instanceof Number valueNumber
                && valueNumber.doubleValue() > existingNumber.doubleValue()) {
                target.put(key, value);
            }
        }
    }

    private static List<Object> unionValues(List<?> existing, List<?> incoming) {
        Set<Object> union = new LinkedHashSet<>(existing);
        union.addAll(incoming);
        return new ArrayList<>(union);
    }

    // email, 없으면 name을 키로 사용. 키가 없는 연락처는 새로 추가하지 않음
    private static List<Object> unionContacts(List<?> existing, List<?> incoming) {
        List<Object> merged = new ArrayList<>(existing);
        Set<String> keys = new LinkedHashSet<>();
        for (Object contact : existing) {
            String key = contactKey(contact);
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        for (Object contact : incoming) {
            String key = contactKey(contact);
            if (!key.isEmpty() && keys.add(key)) {
                merged.add(contact);
            }
        }
        return merged;
    }

    private static String contactKey(Object contact) {
        if (contact instanceof Map<?, ?> map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            map.forEach((key, value) -> fields.put(String.valueOf(key), value));
            return RecordFields.firstText(fields, "email", "name");
        }
        return "";
    }
}
