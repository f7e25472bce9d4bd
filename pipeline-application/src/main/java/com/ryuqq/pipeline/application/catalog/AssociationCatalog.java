package com.ryuqq.pipeline.application.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 연관 단체 설정 목록.
 *
 * <p>INIT 단계가 단체 코드로 시작 URL과 우선순위를 조회합니다. 등록 순서를 유지합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class AssociationCatalog {

    private final Map<String, AssociationSource> sources;

    private AssociationCatalog(Map<String, AssociationSource> sources) {
        this.sources = Collections.unmodifiableMap(sources);
    }

    /**
     * 단체 설정 목록으로 카탈로그 생성.
     *
     * @param sources 단체 설정 (코드 중복 불가)
     * @return AssociationCatalog
     * @throws IllegalArgumentException 코드가 중복된 경우
     */
    public static AssociationCatalog of(Collection<AssociationSource> sources) {
        if (sources == null) {
            throw new IllegalArgumentException("sources cannot be null");
        }
        Map<String, AssociationSource> byCode = new LinkedHashMap<>();
        for (AssociationSource source : sources) {
            if (byCode.putIfAbsent(source.code(), source) != null) {
                throw new IllegalArgumentException("Duplicate association code: " + source.code());
            }
        }
        return new AssociationCatalog(byCode);
    }

    public static AssociationCatalog empty() {
        return new AssociationCatalog(new LinkedHashMap<>());
    }

    public Optional<AssociationSource> find(String code) {
        return Optional.ofNullable(sources.get(code));
    }

    /**
     * 등록된 모든 단체 코드 (등록 순서).
     */
    public List<String> codes() {
        return new ArrayList<>(sources.keySet());
    }

    /**
     * 우선순위가 "high"인 단체 코드 (등록 순서).
     */
    public List<String> highPriorityCodes() {
        List<String> codes = new ArrayList<>();
        for (AssociationSource source : sources.values()) {
            if (source.queuePriority() == AssociationSource.HIGH_PRIORITY) {
                codes.add(source.code());
            }
        }
        return codes;
    }

    public int size() {
        return sources.size();
    }
}
