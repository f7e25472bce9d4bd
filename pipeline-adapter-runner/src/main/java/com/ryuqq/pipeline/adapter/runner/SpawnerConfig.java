package com.ryuqq.pipeline.adapter.runner;

import java.time.Duration;

/**
 * BoundedTaskSpawner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrent: 배치 동시 실행 상한 (기본 5)</li>
 *   <li>defaultTimeout: 작업 타임아웃 미지정 시 사용 (기본 300초)</li>
 * </ul>
 *
 * <p>동시 실행 상한은 원격 출처의 요청 제한을 고려해 작게 유지합니다 (3~5 권장).</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 * @param maxConcurrent 배치 동시 실행 상한 (1 이상)
 * @param defaultTimeout 기본 작업 타임아웃 (양수)
 */
public record SpawnerConfig(
    int maxConcurrent,
    Duration defaultTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrent=5, defaultTimeout=300s</p>
     */
    public SpawnerConfig() {
        this(5, Duration.ofSeconds(300));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SpawnerConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException(
                "defaultTimeout must be positive (current: " + defaultTimeout + ")"
            );
        }
    }

    /**
     * maxConcurrent만 변경한 새 인스턴스 생성.
     */
    public SpawnerConfig withMaxConcurrent(int maxConcurrent) {
        return new SpawnerConfig(maxConcurrent, defaultTimeout);
    }

    /**
     * defaultTimeout만 변경한 새 인스턴스 생성.
     */
    public SpawnerConfig withDefaultTimeout(Duration defaultTimeout) {
        return new SpawnerConfig(maxConcurrent, defaultTimeout);
    }
}
