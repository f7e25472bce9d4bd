package com.ryuqq.pipeline.resolution.match;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 후보 생성을 위한 역색인 (blocking index).
 *
 * <p>정규화 도메인, 회사명 첫 토큰, 전화번호 끝 10자리의 세 가지 키로 레코드 인덱스를 색인합니다.
 * 같은 버킷을 공유하는 레코드만 비교 후보가 되므로 전체 쌍 비교를 피할 수 있습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class BlockingIndex {

    private final List<RecordFeatures> features;
    private final Map<String, List<Integer>> byDomain = new HashMap<>();
    private final Map<String, List<Integer>> byNameToken = new HashMap<>();
    private final Map<String, List<Integer>> byPhone = new HashMap<>();
    private final int minNameTokenLength;

    /**
     * 색인 생성.
     *
     * @param features 레코드별 특징값 (인덱스 = 입력 순서)
     * @param minNameTokenLength 이름 토큰 색인 최소 길이 (이보다 짧은 토큰은 색인하지 않음)
     */
    public BlockingIndex(List<RecordFeatures> features, int minNameTokenLength) {
        if (features == null) {
            throw new IllegalArgumentException("features cannot be null");
        }
        this.features = List.copyOf(features);
        this.minNameTokenLength = minNameTokenLength;
        for (int i = 0; i < this.features.size(); i++) {
            RecordFeatures f = this.features.get(i);
            put(byDomain, f.domain(), i);
            if (isIndexableToken(f.nameToken())) {
                put(byNameToken, f.nameToken(), i);
            }
            put(byPhone, f.phoneKey(), i);
        }
    }

    private boolean isIndexableToken(String token) {
        return token.length() >= Math.max(1, minNameTokenLength);
    }

    private static void put(Map<String, List<Integer>> index, String key, int recordIndex) {
        if (key.isEmpty()) {
            return;
        }
        index.computeIfAbsent(key, k -> new ArrayList<>()).add(recordIndex);
    }

    /**
     * 레코드와 버킷을 공유하는 후보 (자기 자신 제외).
     *
     * @param recordIndex 기준 레코드 인덱스
     * @return 후보 인덱스 (오름차순)
     */
    public SortedSet<Integer> candidates(int recordIndex) {
        RecordFeatures f = features.get(recordIndex);
        SortedSet<Integer> candidates = new TreeSet<>();
        addBucket(candidates, byDomain, f.domain());
        if (isIndexableToken(f.nameToken())) {
            addBucket(candidates, byNameToken, f.nameToken());
        }
        addBucket(candidates, byPhone, f.phoneKey());
        candidates.remove(recordIndex);
        return candidates;
    }

    private static void addBucket(SortedSet<Integer> target, Map<String, List<Integer>> index, String key) {
        if (key.isEmpty()) {
            return;
        }
        List<Integer> bucket = index.get(key);
        if (bucket != null) {
            target.addAll(bucket);
        }
    }

    public int size() {
        return features.size();
    }

    public RecordFeatures features(int recordIndex) {
        return features.get(recordIndex);
    }
}
