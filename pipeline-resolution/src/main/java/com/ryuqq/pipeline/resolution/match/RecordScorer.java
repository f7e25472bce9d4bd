package com.ryuqq.pipeline.resolution.match;

/**
 * 레코드 쌍 유사도 계산기.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RecordScorer {

    /**
     * 두 레코드의 유사도.
     *
     * @param a 첫 번째 레코드 특징값
     * @param b 두 번째 레코드 특징값
     * @return 0.0 ~ 1.0 (대칭)
     */
    double score(RecordFeatures a, RecordFeatures b);
}
