package com.ryuqq.pipeline.resolution;

import com.ryuqq.pipeline.resolution.match.SignalWeights;
import com.ryuqq.pipeline.resolution.merge.MergeStrategy;

/**
 * 엔티티 해석 / 중복 제거 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threshold: 병합 임계값 (기본 0.85, 포함 비교)</li>
 *   <li>weights: 신호별 가중치</li>
 *   <li>strategy: 병합 전략 (기본 KEEP_BEST)</li>
 *   <li>minNameTokenLength: 이름 토큰 색인 최소 길이 (해석 3, 중복 제거 1)</li>
 * </ul>
 *
 * @param threshold 병합 임계값 (0.0 ~ 1.0)
 * @param weights 신호별 가중치
 * @param strategy 병합 전략
 * @param minNameTokenLength 이름 토큰 색인 최소 길이 (1 이상)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ResolutionConfig(
    double threshold,
    SignalWeights weights,
    MergeStrategy strategy,
    int minNameTokenLength
) {

    /**
     * 기본 임계값.
     */
    public static final double DEFAULT_THRESHOLD = 0.85;

    /**
     * 기본 설정 생성자 (교차 배치 해석 기본값).
     */
    public ResolutionConfig() {
        this(DEFAULT_THRESHOLD, SignalWeights.resolutionDefaults(), MergeStrategy.KEEP_BEST, 3);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ResolutionConfig {
        if (threshold < 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException(
                "threshold must be within [0, 1] (current: " + threshold + ")"
            );
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (minNameTokenLength <= 0) {
            throw new IllegalArgumentException(
                "minNameTokenLength must be positive (current: " + minNameTokenLength + ")"
            );
        }
    }

    /**
     * 교차 배치 해석 기본 설정.
     */
    public static ResolutionConfig resolutionDefaults() {
        return new ResolutionConfig();
    }

    /**
     * 배치 내 중복 제거 기본 설정.
     */
    public static ResolutionConfig dedupeDefaults() {
        return new ResolutionConfig(DEFAULT_THRESHOLD, SignalWeights.dedupeDefaults(), MergeStrategy.KEEP_BEST, 1);
    }

    public ResolutionConfig withThreshold(double threshold) {
        return new ResolutionConfig(threshold, weights, strategy, minNameTokenLength);
    }

    public ResolutionConfig withWeights(SignalWeights weights) {
        return new ResolutionConfig(threshold, weights, strategy, minNameTokenLength);
    }

    public ResolutionConfig withStrategy(MergeStrategy strategy) {
        return new ResolutionConfig(threshold, weights, strategy, minNameTokenLength);
    }

    public ResolutionConfig withMinNameTokenLength(int minNameTokenLength) {
        return new ResolutionConfig(threshold, weights, strategy, minNameTokenLength);
    }
}
