package com.ryuqq.pipeline.resolution.normalize;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 회사명 정규화.
 *
 * <p><strong>정규화 단계:</strong></p>
 * <ul>
 *   <li>{@link #normalize(String)}: 소문자화, 법인 접미사 제거, 구두점 제거, 공백 정리</li>
 *   <li>{@link #deepNormalize(String)}: 위 단계에 확장 접미사 목록과 약어 확장 추가</li>
 * </ul>
 *
 * <p>{@code normalize}는 blocking 키(첫 토큰)에, {@code deepNormalize}는 이름 유사도 비교에 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * normalize("ACME, Incorporated")      → "acme"
 * deepNormalize("Acme Mfg Corp.")      → "acme manufacturing"
 * deepNormalize("Intl Tech Sys LLP")    → "international technology systems"
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class CompanyNameNormalizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Pattern> BASIC_SUFFIXES = List.of(
        Pattern.compile("\\b(inc\\.?|incorporated|corp\\.?|corporation|llc|l\\.l\\.c\\.?)$", FLAGS),
        Pattern.compile("\\b(ltd\\.?|limited|co\\.?|company|plc)$", FLAGS),
        Pattern.compile("\\b(gmbh|ag|sa|nv|bv)$", FLAGS)
    );

    private static final List<Pattern> LEGAL_SUFFIXES = List.of(
        Pattern.compile("\\b(inc\\.?|incorporated)$", FLAGS),
        Pattern.compile("\\b(corp\\.?|corporation)$", FLAGS),
        Pattern.compile("\\b(llc|l\\.l\\.c\\.?)$", FLAGS),
        Pattern.compile("\\b(ltd\\.?|limited)$", FLAGS),
        Pattern.compile("\\b(co\\.?|company)$", FLAGS),
        Pattern.compile("\\b(plc)$", FLAGS),
        Pattern.compile("\\b(gmbh|ag|sa|nv|bv)$", FLAGS),
        Pattern.compile("\\b(lp|l\\.p\\.)$", FLAGS),
        Pattern.compile("\\b(llp|l\\.l\\.p\\.)$", FLAGS)
    );

    private static final Map<String, String> ABBREVIATIONS = Map.of(
        "mfg", "manufacturing",
        "intl", "international",
        "corp", "corporation",
        "ind", "industries",
        "mach", "machine",
        "eng", "engineering",
        "tech", "technology",
        "svcs", "services",
        "sys", "systems",
        "assoc", "associates"
    );

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private CompanyNameNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 정규화.
     *
     * @param name 원본 회사명 (null 가능)
     * @return 정규화된 이름 (입력이 비어있으면 "")
     */
    public static String normalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String result = name.toLowerCase(Locale.ROOT);
        for (Pattern suffix : BASIC_SUFFIXES) {
            result = suffix.matcher(result).replaceAll("");
        }
        result = PUNCTUATION.matcher(result).replaceAll("");
        return collapseWhitespace(result);
    }

    /**
     * 유사도 비교용 심층 정규화.
     *
     * @param name 원본 회사명 (null 가능)
     * @return 정규화된 이름 (입력이 비어있으면 "")
     */
    public static String deepNormalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String result = name.toLowerCase(Locale.ROOT).strip();
        for (Pattern suffix : LEGAL_SUFFIXES) {
            result = suffix.matcher(result).replaceAll("");
        }

        StringBuilder expanded = new StringBuilder();
        for (String word : WHITESPACE.split(result.strip())) {
            if (word.isEmpty()) {
                continue;
            }
            if (expanded.length() > 0) {
                expanded.append(' ');
            }
            expanded.append(ABBREVIATIONS.getOrDefault(word, word));
        }

        result = PUNCTUATION.matcher(expanded).replaceAll("");
        return collapseWhitespace(result);
    }

    /**
     * 기본 정규화 결과의 첫 토큰 (blocking 키).
     *
     * @param name 원본 회사명
     * @return 첫 토큰 (없으면 "")
     */
    public static String firstToken(String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return "";
        }
        int space = normalized.indexOf(' ');
        return space < 0 ? normalized : normalized.substring(0, space);
    }

    static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value.strip()).replaceAll(" ");
    }
}
