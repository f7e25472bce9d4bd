package com.ryuqq.pipeline.application.catalog;

/**
 * 수집 대상 연관 단체 한 곳의 설정.
 *
 * @param code 단체 코드 (예: "PMA")
 * @param name 단체 이름 (null 가능)
 * @param url 기본 URL (null 가능)
 * @param directoryUrl 회원 디렉터리 URL (null 가능)
 * @param priority 우선순위 표기 ("high"면 큐 우선순위 10)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record AssociationSource(
    String code,
    String name,
    String url,
    String directoryUrl,
    String priority
) {

    public static final int HIGH_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;

    public AssociationSource {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
    }

    /**
     * 큐에 넣을 시작 URL (url, 없으면 directoryUrl).
     *
     * @return 시작 URL (둘 다 없으면 null)
     */
    public String seedUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        if (directoryUrl != null && !directoryUrl.isBlank()) {
            return directoryUrl;
        }
        return null;
    }

    public int queuePriority() {
        return "high".equalsIgnoreCase(priority) ? HIGH_PRIORITY : DEFAULT_PRIORITY;
    }
}
