package com.ryuqq.pipeline.resolution.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Flood-fill 병합 그룹 탐색.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>아직 처리되지 않은 레코드를 입력 순서대로 시작점으로 선택</li>
 *   <li>그룹 구성원의 blocking 후보 중 미처리 레코드를 점수화</li>
 *   <li>임계값 이상(포함)인 후보를 그룹에 흡수하고 처리 완료로 표시</li>
 *   <li>흡수된 후보의 후보도 같은 방식으로 탐색 (더 이상 흡수할 후보가 없을 때까지)</li>
 * </ol>
 *
 * <p><strong>주의:</strong> 흡수는 직접 후보 관계만 평가하므로 연쇄 병합이 발생할 수 있습니다.
 * A~B, B~C가 임계값 이상이면 A와 C의 직접 점수가 낮아도 한 그룹이 됩니다.</p>
 *
 * <p>후보는 인덱스 오름차순으로 평가하므로 같은 입력과 설정에 대해 결과가 항상 같습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class MergeGrouper {

    private static final Logger log = LoggerFactory.getLogger(MergeGrouper.class);

    private final RecordScorer scorer;
    private final double threshold;

    /**
     * 생성자.
     *
     * @param scorer 쌍 유사도 계산기
     * @param threshold 병합 임계값 (0.0 ~ 1.0, 포함 비교)
     */
    public MergeGrouper(RecordScorer scorer, double threshold) {
        if (scorer == null) {
            throw new IllegalArgumentException("scorer cannot be null");
        }
        if (threshold < 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be within [0, 1] (current: " + threshold + ")");
        }
        this.scorer = scorer;
        this.threshold = threshold;
    }

    /**
     * 모든 레코드를 그룹으로 분할.
     *
     * @param index blocking 색인
     * @return 그룹 목록 (단일 구성원 그룹 포함, 시작 레코드 순)
     */
    public List<MergeGroup> group(BlockingIndex index) {
        int size = index.size();
        boolean[] processed = new boolean[size];
        List<MergeGroup> groups = new ArrayList<>();
        long comparisons = 0;

        for (int seed = 0; seed < size; seed++) {
            if (processed[seed]) {
                continue;
            }
            processed[seed] = true;
            List<Integer> members = new ArrayList<>();
            members.add(seed);

            Deque<Integer> frontier = new ArrayDeque<>();
            frontier.add(seed);
            while (!frontier.isEmpty()) {
                int current = frontier.poll();
                RecordFeatures currentFeatures = index.features(current);
                for (int candidate : index.candidates(current)) {
                    if (processed[candidate]) {
                        continue;
                    }
                    comparisons++;
                    if (scorer.score(currentFeatures, index.features(candidate)) >= threshold) {
                        processed[candidate] = true;
                        members.add(candidate);
                        frontier.add(candidate);
                    }
                }
            }
            groups.add(new MergeGroup(members));
        }

        log.debug("Grouped {} records into {} groups ({} comparisons)", size, groups.size(), comparisons);
        return groups;
    }
}
