package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.application.orchestrator.PhaseContext;
import com.ryuqq.pipeline.application.orchestrator.PhaseHandler;
import com.ryuqq.pipeline.application.orchestrator.PhaseOutcome;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.resolution.EntityResolutionEngine;
import com.ryuqq.pipeline.resolution.ResolutionConfig;
import com.ryuqq.pipeline.resolution.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * RESOLUTION 단계: 회사 레코드를 기존 정규 엔티티에 해석.
 *
 * <p>병합 전략은 {@code PipelineConfig.mergeStrategy()}를 따릅니다.
 * 결과 정규 엔티티 목록이 상태의 정규 엔티티 목록을 대체합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ResolutionPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ResolutionPhaseHandler.class);

    private final Clock clock;

    public ResolutionPhaseHandler() {
        this(Clock.systemUTC());
    }

    public ResolutionPhaseHandler(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();
        if (state.getCompanies().isEmpty()) {
            log.info("No companies to resolve");
            return PhaseOutcome.proceed();
        }

        EntityResolutionEngine engine = new EntityResolutionEngine(
            ResolutionConfig.resolutionDefaults().withStrategy(context.config().mergeStrategy()), clock);
        ResolutionResult result = engine.resolve(state.getCompanies(), state.getCanonicalEntities());
        state.replaceCanonicalEntities(result.canonicalEntities());

        log.info("Resolved {} records into {} canonical entities ({} merge groups)",
            result.recordsProcessed(), result.canonicalEntities().size(), result.mergeGroups().size());
        return PhaseOutcome.proceed();
    }
}
