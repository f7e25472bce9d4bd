package com.ryuqq.pipeline.resolution.match;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * 가중 평균 유사도 계산기.
 *
 * <p>양쪽 모두 값이 있는 신호만 기여하며, 점수는 기여한 신호들의 가중치 합으로 정규화됩니다.
 * 기여한 신호가 하나도 없으면 0.0입니다.</p>
 *
 * <pre>
 * score = Σ(weight_s × similarity_s) / Σ(weight_s)   (s ∈ 기여 신호)
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class WeightedRecordScorer implements RecordScorer {

    private final SignalWeights weights;

    public WeightedRecordScorer(SignalWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        this.weights = weights;
    }

    @Override
    public double score(RecordFeatures a, RecordFeatures b) {
        double totalScore = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<MatchSignal, Double> entry : weights.weights().entrySet()) {
            double weight = entry.getValue();
            if (weight == 0.0) {
                continue;
            }
            OptionalDouble similarity = entry.getKey().similarity(a, b);
            if (similarity.isPresent()) {
                totalWeight += weight;
                totalScore += weight * similarity.getAsDouble();
            }
        }
        return totalWeight > 0 ? totalScore / totalWeight : 0.0;
    }
}
