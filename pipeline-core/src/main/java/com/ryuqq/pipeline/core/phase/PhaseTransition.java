package com.ryuqq.pipeline.core.phase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 단계 전이 검증 및 실행.
 *
 * <p>이 클래스는 파이프라인 단계 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>비종료 단계 → 고정 순서상 다음 단계</li>
 *   <li>비종료 단계 → FAILED</li>
 *   <li>EXPORT → DONE (MONITOR 생략)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(DONE, FAILED)에서는 어떤 단계로도 전이 불가</li>
 *   <li>역방향 전이 및 단계 건너뛰기 불가 (EXPORT → DONE 제외)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    private static final Map<PipelinePhase, Set<PipelinePhase>> ALLOWED = buildTransitionTable();

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static Map<PipelinePhase, Set<PipelinePhase>> buildTransitionTable() {
        Map<PipelinePhase, Set<PipelinePhase>> table = new EnumMap<>(PipelinePhase.class);
        for (PipelinePhase phase : PipelinePhase.values()) {
            if (phase.isTerminal()) {
                table.put(phase, Collections.emptySet());
                continue;
            }
            Set<PipelinePhase> targets = EnumSet.of(PipelinePhase.FAILED);
            phase.next().ifPresent(targets::add);
            if (phase == PipelinePhase.EXPORT) {
                targets.add(PipelinePhase.DONE);
            }
            table.put(phase, Collections.unmodifiableSet(targets));
        }
        return Collections.unmodifiableMap(table);
    }

    /**
     * 전이 가능한 대상 단계 조회.
     *
     * @param from 현재 단계
     * @return 허용된 대상 단계 (불변)
     * @throws IllegalArgumentException from이 null인 경우
     */
    public static Set<PipelinePhase> allowedTargets(PipelinePhase from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return ALLOWED.get(from);
    }

    /**
     * 전이 허용 여부 확인 (예외 없음).
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @return 허용된 전이이면 true, null 인자는 false
     */
    public static boolean isAllowed(PipelinePhase from, PipelinePhase to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED.get(from).contains(to);
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PipelinePhase from, PipelinePhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        if (!ALLOWED.get(from).contains(to)) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s (allowed: %s)", from, to, ALLOWED.get(from))
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static PipelinePhase transition(PipelinePhase current, PipelinePhase next) {
        validate(current, next);
        return next;
    }
}
