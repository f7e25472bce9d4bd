package com.ryuqq.pipeline.resolution.normalize;

/**
 * 전화번호 정규화.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class PhoneNormalizer {

    /**
     * 비교/색인에 사용하는 끝자리 수.
     */
    public static final int SIGNIFICANT_DIGITS = 10;

    private PhoneNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 숫자만 남김.
     *
     * @param phone 원본 전화번호 (null 가능)
     * @return 숫자 문자열
     */
    public static String digits(String phone) {
        if (phone == null || phone.isEmpty()) {
            return "";
        }
        StringBuilder digits = new StringBuilder(phone.length());
        for (int i = 0; i < phone.length(); i++) {
            char c = phone.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    /**
     * 끝 10자리 키.
     *
     * @param phone 원본 전화번호
     * @return 끝 10자리 (숫자가 10개 미만이면 "")
     */
    public static String matchKey(String phone) {
        String digits = digits(phone);
        if (digits.length() < SIGNIFICANT_DIGITS) {
            return "";
        }
        return digits.substring(digits.length() - SIGNIFICANT_DIGITS);
    }
}
