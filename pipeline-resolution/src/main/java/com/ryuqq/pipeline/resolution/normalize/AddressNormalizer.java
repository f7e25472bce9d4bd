package com.ryuqq.pipeline.resolution.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 주소 비교 문자열 생성 (city + state + full_address).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class AddressNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private AddressNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String normalize(Map<String, Object> record) {
        List<String> parts = new ArrayList<>(3);
        String city = RecordFields.text(record, "city");
        if (!city.isEmpty()) {
            parts.add(city.toLowerCase(Locale.ROOT));
        }
        String state = RecordFields.text(record, "state");
        if (!state.isEmpty()) {
            parts.add(state.toLowerCase(Locale.ROOT));
        }
        String fullAddress = RecordFields.text(record, "full_address");
        if (!fullAddress.isEmpty()) {
            parts.add(PUNCTUATION.matcher(fullAddress.toLowerCase(Locale.ROOT)).replaceAll(""));
        }
        return String.join(" ", parts);
    }
}
