package com.ryuqq.pipeline.core.state;

import java.time.Instant;

/**
 * 크롤 큐 항목.
 *
 * <p>큐 내 정렬은 priority 내림차순이며, 같은 priority끼리는 삽입 순서를 유지합니다.</p>
 *
 * @param url 대상 URL (필수)
 * @param priority 우선순위 (클수록 먼저 처리)
 * @param depth 시드로부터의 깊이 (0 이상)
 * @param sourceUrl 이 URL을 발견한 페이지 (null 가능)
 * @param association 소속 연관 단체 코드 (null 가능)
 * @param pageTypeHint 탐색 단계에서 부여한 페이지 유형 힌트 (null 가능)
 * @param pageType 분류 단계에서 판정한 페이지 유형 (null 가능)
 * @param extractor 분류 단계에서 추천한 추출기 task type (null 가능)
 * @param addedAt 큐 적재 시각 (null이면 현재 시각)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record QueueItem(
    String url,
    int priority,
    int depth,
    String sourceUrl,
    String association,
    String pageTypeHint,
    String pageType,
    String extractor,
    Instant addedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException url이 비어있거나 depth가 음수인 경우
     */
    public QueueItem {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative (current: " + depth + ")");
        }
        if (addedAt == null) {
            addedAt = Instant.now();
        }
    }

    /**
     * 최소 정보로 큐 항목 생성.
     *
     * @param url 대상 URL
     * @param priority 우선순위
     * @return QueueItem 인스턴스
     */
    public static QueueItem of(String url, int priority) {
        return new QueueItem(url, priority, 0, null, null, null, null, null, null);
    }

    /**
     * 연관 단체와 페이지 유형 힌트를 포함한 큐 항목 생성.
     *
     * @param url 대상 URL
     * @param priority 우선순위
     * @param association 연관 단체 코드
     * @param pageTypeHint 페이지 유형 힌트 (null 가능)
     * @return QueueItem 인스턴스
     */
    public static QueueItem of(String url, int priority, String association, String pageTypeHint) {
        return new QueueItem(url, priority, 0, null, association, pageTypeHint, null, null, null);
    }

    /**
     * 분류 결과를 반영한 새 인스턴스 생성.
     *
     * @param pageType 판정된 페이지 유형
     * @param extractor 추천 추출기
     * @return 분류 정보가 채워진 QueueItem
     */
    public QueueItem withClassification(String pageType, String extractor) {
        return new QueueItem(url, priority, depth, sourceUrl, association, pageTypeHint, pageType, extractor, addedAt);
    }

    /**
     * 실제 적용할 페이지 유형 (분류 결과 우선, 없으면 힌트).
     *
     * @return 페이지 유형 (둘 다 없으면 null)
     */
    public String effectivePageType() {
        return pageType != null ? pageType : pageTypeHint;
    }
}
