package com.ryuqq.pipeline.resolution.match;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BlockingIndex / WeightedRecordScorer / MergeGrouper 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class MergeGrouperTest {

    private static RecordFeatures features(String name, String website, String phone) {
        return RecordFeatures.of(Map.of("company_name", name, "website", website, "phone", phone));
    }

    private static SignalWeights nameOnly() {
        Map<MatchSignal, Double> weights = new EnumMap<>(MatchSignal.class);
        weights.put(MatchSignal.NAME, 1.0);
        return new SignalWeights(weights);
    }

    // ============================================================
    // Blocking
    // ============================================================

    @Test
    void candidates_도메인_이름토큰_전화번호_버킷_합집합() {
        // given
        BlockingIndex index = new BlockingIndex(List.of(
            features("Acme Inc", "acme.com", ""),
            features("Zeta", "acme.com", ""),
            features("Acme Tools", "other.com", ""),
            features("Omega", "omega.com", "555-123-4567"),
            features("Sigma", "sigma.com", "1 555 123 4567"),
            features("Unrelated", "nothing.com", "")
        ), 3);

        // then
        assertThat(index.candidates(0)).containsExactly(1, 2);
        assertThat(index.candidates(3)).containsExactly(4);
        assertThat(index.candidates(5)).isEmpty();
    }

    @Test
    void candidates_짧은_이름_토큰은_색인하지_않음() {
        // given
        BlockingIndex index = new BlockingIndex(List.of(
            features("AB Tools", "", ""),
            features("AB Metals", "", "")
        ), 3);

        // then
        assertThat(index.candidates(0)).isEmpty();
    }

    // ============================================================
    // Scoring
    // ============================================================

    @Test
    void score_양쪽에_값이_있는_신호만_기여() {
        // given
        WeightedRecordScorer scorer = new WeightedRecordScorer(SignalWeights.resolutionDefaults());
        RecordFeatures a = RecordFeatures.of(Map.of("company_name", "Acme", "website", "acme.com"));
        RecordFeatures b = RecordFeatures.of(Map.of("company_name", "Acme", "website", "acme.com", "phone", "5551234567"));

        // when
        double score = scorer.score(a, b);

        // then
        assertThat(score).isEqualTo(1.0, org.assertj.core.data.Offset.offset(1e-12));
    }

    @Test
    void score_도메인_불일치는_가중치만큼_감점() {
        // given
        WeightedRecordScorer scorer = new WeightedRecordScorer(SignalWeights.resolutionDefaults());
        RecordFeatures a = RecordFeatures.of(Map.of("company_name", "Acme", "website", "acme.com"));
        RecordFeatures b = RecordFeatures.of(Map.of("company_name", "Acme", "website", "acme.net"));

        // when
        double score = scorer.score(a, b);

        // then
        assertThat(score).isCloseTo(0.35 / 0.75, org.assertj.core.data.Offset.offset(1e-12));
    }

    @Test
    void score_기여_신호가_없으면_0() {
        WeightedRecordScorer scorer = new WeightedRecordScorer(SignalWeights.resolutionDefaults());
        assertThat(scorer.score(RecordFeatures.of(Map.of()), RecordFeatures.of(Map.of()))).isZero();
    }

    @Test
    void signalWeights_음수_가중치는_거부() {
        Map<MatchSignal, Double> weights = new EnumMap<>(MatchSignal.class);
        weights.put(MatchSignal.NAME, -0.1);
        assertThatThrownBy(() -> new SignalWeights(weights)).isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // Grouping
    // ============================================================

    @Test
    void group_연쇄_병합_A_B_C() {
        // given: A~B, B~C는 임계값 이상, A~C는 미만
        List<RecordFeatures> records = List.of(
            features("alpha beta gamma", "", ""),
            features("alpha beta gamma delta", "", ""),
            features("alpha beta gamma delta epsilon", "", "")
        );
        WeightedRecordScorer scorer = new WeightedRecordScorer(nameOnly());
        assertThat(scorer.score(records.get(0), records.get(2))).isLessThan(0.8);

        MergeGrouper grouper = new MergeGrouper(scorer, 0.8);

        // when
        List<MergeGroup> groups = grouper.group(new BlockingIndex(records, 1));

        // then
        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).members()).containsExactly(0, 1, 2);
    }

    @Test
    void group_단일_구성원_그룹은_병합하지_않음() {
        // given
        List<RecordFeatures> records = List.of(
            features("Acme", "acme.com", ""),
            features("Beta", "beta.com", ""),
            features("Acme Inc", "acme.com", "")
        );
        MergeGrouper grouper = new MergeGrouper(new WeightedRecordScorer(SignalWeights.resolutionDefaults()), 0.85);

        // when
        List<MergeGroup> groups = grouper.group(new BlockingIndex(records, 3));

        // then
        assertThat(groups).extracting(MergeGroup::members)
            .containsExactly(List.of(0, 2), List.of(1));
        assertThat(groups.get(1).merges()).isFalse();
    }

    @Test
    void group_같은_입력은_같은_결과() {
        // given
        List<RecordFeatures> records = List.of(
            features("Acme", "acme.com", ""),
            features("Acme Tools", "", ""),
            features("Acme Inc", "acme.com", ""),
            features("Acme Toolz", "", "")
        );
        MergeGrouper grouper = new MergeGrouper(new WeightedRecordScorer(SignalWeights.resolutionDefaults()), 0.85);

        // when
        List<MergeGroup> first = grouper.group(new BlockingIndex(records, 3));
        List<MergeGroup> second = grouper.group(new BlockingIndex(records, 3));

        // then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void 생성자_임계값_범위_검증() {
        WeightedRecordScorer scorer = new WeightedRecordScorer(SignalWeights.resolutionDefaults());
        assertThatThrownBy(() -> new MergeGrouper(scorer, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MergeGrouper(null, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
