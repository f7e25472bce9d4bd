package com.ryuqq.pipeline.application.orchestrator;

/**
 * 단계 핸들러 실행 결과.
 *
 * <p>{@link Abort}만이 파이프라인을 FAILED로 보내는 신호입니다.</p>
 *
 * <pre>
 * return PhaseOutcome.proceed();
 * return PhaseOutcome.abort("Extraction error rate 62% exceeds threshold 50%");
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public sealed interface PhaseOutcome permits PhaseOutcome.Proceed, PhaseOutcome.Abort {

    static PhaseOutcome proceed() {
        return Proceed.INSTANCE;
    }

    static PhaseOutcome abort(String reason) {
        return new Abort(reason);
    }

    default boolean isProceed() {
        return this instanceof Proceed;
    }

    /**
     * 다음 단계로 진행.
     */
    record Proceed() implements PhaseOutcome {

        private static final Proceed INSTANCE = new Proceed();
    }

    /**
     * 단계 실패 (FAILED로 전이).
     *
     * @param reason 실패 사유
     */
    record Abort(String reason) implements PhaseOutcome {

        public Abort {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
