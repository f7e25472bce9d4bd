package com.ryuqq.pipeline.application.config;

import com.ryuqq.pipeline.resolution.merge.MergeStrategy;

import java.time.Duration;

/**
 * 파이프라인 실행 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxConcurrent: 5 (단계 내 동시 작업 수)</li>
 *   <li>taskTimeout: 300초 (작업별 타임아웃)</li>
 *   <li>discoveryCheckpointInterval: 10 (방문 URL 수 기준)</li>
 *   <li>extractionCheckpointInterval: 50 (방문 URL 수 기준)</li>
 *   <li>extractionBatchSize: maxConcurrent</li>
 *   <li>classificationLimit: 100</li>
 *   <li>maxExtractionErrorRate: 0.5 (초과 시 EXTRACTION 실패)</li>
 *   <li>dryRun: false (true면 EXPORT 생략)</li>
 *   <li>mergeStrategy: KEEP_BEST</li>
 *   <li>graphSignalCompanyLimit: 100</li>
 *   <li>monitorUrlLimit: 20</li>
 *   <li>exportMinQuality: 60</li>
 * </ul>
 *
 * @param maxConcurrent 단계 내 동시 작업 수
 * @param taskTimeout 작업별 타임아웃
 * @param discoveryCheckpointInterval DISCOVERY 중간 체크포인트 간격
 * @param extractionCheckpointInterval EXTRACTION 중간 체크포인트 간격
 * @param extractionBatchSize EXTRACTION 배치 크기
 * @param classificationLimit CLASSIFICATION 최대 분류 수
 * @param maxExtractionErrorRate 허용 추출 실패율 (0.0 ~ 1.0)
 * @param dryRun EXPORT 생략 여부
 * @param mergeStrategy RESOLUTION 병합 전략
 * @param graphSignalCompanyLimit 경쟁 신호 수집 대상 회사 수 상한
 * @param monitorUrlLimit 모니터링 기준선 URL 수 상한
 * @param exportMinQuality 회사 내보내기 최소 품질 점수
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record PipelineConfig(
    int maxConcurrent,
    Duration taskTimeout,
    int discoveryCheckpointInterval,
    int extractionCheckpointInterval,
    int extractionBatchSize,
    int classificationLimit,
    double maxExtractionErrorRate,
    boolean dryRun,
    MergeStrategy mergeStrategy,
    int graphSignalCompanyLimit,
    int monitorUrlLimit,
    int exportMinQuality
) {

    private static final int DEFAULT_MAX_CONCURRENT = 5;

    /**
     * 기본 설정 생성자.
     */
    public PipelineConfig() {
        this(DEFAULT_MAX_CONCURRENT, Duration.ofSeconds(300), 10, 50, DEFAULT_MAX_CONCURRENT,
            100, 0.5, false, MergeStrategy.KEEP_BEST, 100, 20, 60);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PipelineConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
        if (taskTimeout == null || taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("taskTimeout must be positive (current: " + taskTimeout + ")");
        }
        if (discoveryCheckpointInterval <= 0) {
            throw new IllegalArgumentException(
                "discoveryCheckpointInterval must be positive (current: " + discoveryCheckpointInterval + ")");
        }
        if (extractionCheckpointInterval <= 0) {
            throw new IllegalArgumentException(
                "extractionCheckpointInterval must be positive (current: " + extractionCheckpointInterval + ")");
        }
        if (extractionBatchSize <= 0) {
            throw new IllegalArgumentException("extractionBatchSize must be positive (current: " + extractionBatchSize + ")");
        }
        if (classificationLimit < 0) {
            throw new IllegalArgumentException("classificationLimit cannot be negative (current: " + classificationLimit + ")");
        }
        if (maxExtractionErrorRate < 0.0 || maxExtractionErrorRate > 1.0) {
            throw new IllegalArgumentException(
                "maxExtractionErrorRate must be between 0.0 and 1.0 (current: " + maxExtractionErrorRate + ")");
        }
        if (mergeStrategy == null) {
            throw new IllegalArgumentException("mergeStrategy cannot be null");
        }
        if (graphSignalCompanyLimit < 0) {
            throw new IllegalArgumentException("graphSignalCompanyLimit cannot be negative");
        }
        if (monitorUrlLimit < 0) {
            throw new IllegalArgumentException("monitorUrlLimit cannot be negative");
        }
    }

    /**
     * 동시 작업 수 변경 (추출 배치 크기도 함께 맞춤).
     */
    public PipelineConfig withMaxConcurrent(int maxConcurrent) {
        return new PipelineConfig(maxConcurrent, taskTimeout, discoveryCheckpointInterval, extractionCheckpointInterval,
            maxConcurrent, classificationLimit, maxExtractionErrorRate, dryRun, mergeStrategy,
            graphSignalCompanyLimit, monitorUrlLimit, exportMinQuality);
    }

    public PipelineConfig withTaskTimeout(Duration taskTimeout) {
        return new PipelineConfig(maxConcurrent, taskTimeout, discoveryCheckpointInterval, extractionCheckpointInterval,
            extractionBatchSize, classificationLimit, maxExtractionErrorRate, dryRun, mergeStrategy,
            graphSignalCompanyLimit, monitorUrlLimit, exportMinQuality);
    }

    public PipelineConfig withCheckpointIntervals(int discoveryCheckpointInterval, int extractionCheckpointInterval) {
        return new PipelineConfig(maxConcurrent, taskTimeout, discoveryCheckpointInterval, extractionCheckpointInterval,
            extractionBatchSize, classificationLimit, maxExtractionErrorRate, dryRun, mergeStrategy,
            graphSignalCompanyLimit, monitorUrlLimit, exportMinQuality);
    }

    public PipelineConfig withExtractionBatchSize(int extractionBatchSize) {
        return new PipelineConfig(maxConcurrent, taskTimeout, discoveryCheckpointInterval, extractionCheckpointInterval,
            extractionBatchSize, classificationLimit, maxExtractionErrorRate, dryRun, mergeStrategy,
            graphSignalCompanyLimit, monitorUrlLimit, exportMinQuality);
    }

    public PipelineConfig withMaxExtractionErrorRate(double maxExtractionErrorRate) {
        return new PipelineConfig(maxConcurrent, taskTimeout, discoveryCheckpointInterval, extractionCheckpointInterval,
            extractionBatchSize, classificationLimit, maxExtractionErrorRate, dryRun, mergeStrategy,
            graphSignalCompanyLimit, monitorUrlLimit, exportMinQuality);
    }

    public PipelineConfig withDryRun(boolean dryRun) {
        return new PipelineConfig(maxConcurrent, taskTimeout, discoveryCheckpointInterval, extractionCheckpointInterval,
            extractionBatchSize, classificationLimit, maxExtractionErrorRate, dryRun, mergeStrategy,
            graphSignalCompanyLimit, monitorUrlLimit, exportMinQuality);
    }

    public PipelineConfig withMergeStrategy(MergeStrategy mergeStrategy) {
        return new PipelineConfig(maxConcurrent, taskTimeout, discoveryCheckpointInterval, extractionCheckpointInterval,
            extractionBatchSize, classificationLimit, maxExtractionErrorRate, dryRun, mergeStrategy,
            graphSignalCompanyLimit, monitorUrlLimit, exportMinQuality);
    }
}
