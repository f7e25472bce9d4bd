package com.ryuqq.pipeline.core.spi;

import java.util.List;

/**
 * 계약 검증 결과.
 *
 * @param valid 유효 여부
 * @param errors 위반 내역 (유효하면 빈 목록)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ValidationReport(
    boolean valid,
    List<String> errors
) {

    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("valid report cannot carry errors");
        }
    }

    public static ValidationReport ok() {
        return new ValidationReport(true, List.of());
    }

    public static ValidationReport invalid(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        return new ValidationReport(false, errors);
    }
}
