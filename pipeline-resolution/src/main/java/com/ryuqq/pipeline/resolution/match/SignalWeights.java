package com.ryuqq.pipeline.resolution.match;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 신호별 가중치 (불변 record).
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>교차 배치 해석: domain 0.40, name 0.35, phone 0.10, address 0.15</li>
 *   <li>배치 내 중복 제거: name 0.50, domain 0.30, city 0.10, state 0.10</li>
 * </ul>
 *
 * @param weights 신호 → 가중치 (0 이상, 최소 하나는 양수)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record SignalWeights(Map<MatchSignal, Double> weights) {

    public SignalWeights {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("weights cannot be null or empty");
        }
        boolean anyPositive = false;
        for (Map.Entry<MatchSignal, Double> entry : weights.entrySet()) {
            Double weight = entry.getValue();
            if (entry.getKey() == null || weight == null || weight < 0 || weight.isNaN()) {
                throw new IllegalArgumentException("Invalid weight for " + entry.getKey() + ": " + weight);
            }
            anyPositive |= weight > 0;
        }
        if (!anyPositive) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
        weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    /**
     * 교차 배치 해석 기본 가중치.
     */
    public static SignalWeights resolutionDefaults() {
        Map<MatchSignal, Double> weights = new EnumMap<>(MatchSignal.class);
        weights.put(MatchSignal.DOMAIN, 0.40);
        weights.put(MatchSignal.NAME, 0.35);
        weights.put(MatchSignal.PHONE, 0.10);
        weights.put(MatchSignal.ADDRESS, 0.15);
        return new SignalWeights(weights);
    }

    /**
     * 배치 내 중복 제거 기본 가중치.
     */
    public static SignalWeights dedupeDefaults() {
        Map<MatchSignal, Double> weights = new EnumMap<>(MatchSignal.class);
        weights.put(MatchSignal.NAME, 0.50);
        weights.put(MatchSignal.DOMAIN, 0.30);
        weights.put(MatchSignal.CITY, 0.10);
        weights.put(MatchSignal.STATE, 0.10);
        return new SignalWeights(weights);
    }

    /**
     * 신호 가중치 조회 (미설정 신호는 0.0).
     */
    public double weight(MatchSignal signal) {
        return weights.getOrDefault(signal, 0.0);
    }
}
