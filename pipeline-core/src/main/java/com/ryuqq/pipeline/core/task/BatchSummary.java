package com.ryuqq.pipeline.core.task;

import java.util.List;

/**
 * 배치 실행 결과 집계.
 *
 * @param successes 성공 수
 * @param failures 실패 수
 * @param totalRecords 성공 결과의 처리 레코드 합계
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record BatchSummary(
    int successes,
    int failures,
    long totalRecords
) {

    /**
     * 결과 목록 집계.
     *
     * @param results 실행 결과 목록
     * @return 집계 결과
     * @throws IllegalArgumentException results가 null인 경우
     */
    public static BatchSummary of(List<? extends TaskResult> results) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        int successes = 0;
        int failures = 0;
        long totalRecords = 0;
        for (TaskResult result : results) {
            if (result.isSuccess()) {
                successes++;
                totalRecords += result.recordsProcessed();
            } else {
                failures++;
            }
        }
        return new BatchSummary(successes, failures, totalRecords);
    }

    /**
     * 전체 작업 수.
     */
    public int total() {
        return successes + failures;
    }

    /**
     * 실패율 (작업이 없으면 0.0).
     */
    public double failureRate() {
        int total = total();
        return total == 0 ? 0.0 : (double) failures / total;
    }
}
