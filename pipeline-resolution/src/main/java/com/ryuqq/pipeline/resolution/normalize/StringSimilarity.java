package com.ryuqq.pipeline.resolution.normalize;

/**
 * 문자열 유사도 (Indel 정규화 비율).
 *
 * <p>{@code 2 * LCS(a, b) / (len(a) + len(b))}. 동일 문자열은 1.0, 한쪽이 비어있으면 0.0입니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class StringSimilarity {

    private StringSimilarity() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 유사도 계산.
     *
     * @param a 첫 번째 문자열
     * @param b 두 번째 문자열
     * @return 0.0 ~ 1.0
     */
    public static double ratio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return (2.0 * lcs) / (a.length() + b.length());
    }

    // O(n*m) 시간, O(min(n, m)) 공간
    static int longestCommonSubsequence(String a, String b) {
        if (a.length() < b.length()) {
            String swap = a;
            a = b;
            b = swap;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
