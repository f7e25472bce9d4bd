package com.ryuqq.pipeline.resolution.normalize;

import java.util.Locale;

/**
 * URL에서 비교용 도메인 추출.
 *
 * <p>scheme이 없으면 https://를 가정하고, host 부분을 소문자로 변환한 뒤 선행 {@code www.}를 제거합니다.
 * 파싱할 수 없는 입력도 예외 없이 처리합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class DomainExtractor {

    private DomainExtractor() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 도메인 추출.
     *
     * <pre>
     * extract("https://www.Acme.com/about") → "acme.com"
     * extract("acme.com")                  → "acme.com"
     * extract("")                          → ""
     * </pre>
     *
     * @param url URL 또는 도메인 (null 가능)
     * @return 도메인 (추출할 수 없으면 "")
     */
    public static String extract(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String value = url.strip();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }

        String rest = value.substring(value.indexOf("://") + 3);
        int end = rest.length();
        for (char delimiter : new char[] {'/', '?', '#'}) {
            int index = rest.indexOf(delimiter);
            if (index >= 0 && index < end) {
                end = index;
            }
        }

        String host = rest.substring(0, end).toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host;
    }
}
