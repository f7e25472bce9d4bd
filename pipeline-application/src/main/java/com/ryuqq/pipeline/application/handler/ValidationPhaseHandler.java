package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.application.orchestrator.PhaseContext;
import com.ryuqq.pipeline.application.orchestrator.PhaseHandler;
import com.ryuqq.pipeline.application.orchestrator.PhaseOutcome;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.resolution.DedupeResult;
import com.ryuqq.pipeline.resolution.EntityResolutionEngine;
import com.ryuqq.pipeline.resolution.ResolutionConfig;
import com.ryuqq.pipeline.resolution.merge.MergeStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * VALIDATION 단계: 배치 내 중복 제거 후 교차 검증과 품질 점수 부여.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * EntityResolutionEngine.dedupe (프로세스 내, MERGE_ALL)
 *   ↓
 * validation.crossref  → records 교체
 *   ↓
 * validation.scorer    → records 교체
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ValidationPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ValidationPhaseHandler.class);

    private final EntityResolutionEngine engine;

    public ValidationPhaseHandler() {
        this(Clock.systemUTC());
    }

    public ValidationPhaseHandler(Clock clock) {
        this.engine = new EntityResolutionEngine(
            ResolutionConfig.dedupeDefaults().withStrategy(MergeStrategy.MERGE_ALL), clock);
    }

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();
        if (state.getCompanies().isEmpty()) {
            log.info("No companies to validate");
            return PhaseOutcome.proceed();
        }

        DedupeResult deduped = engine.dedupe(state.getCompanies());
        state.replaceCompanies(deduped.records());
        log.info("Dedupe: {} → {} records ({} duplicates in {} groups)",
            deduped.inputCount(), deduped.records().size(),
            deduped.duplicatesFound(), deduped.duplicateGroups().size());

        EnrichmentPhaseHandler.applyRecords(context, TaskTypes.CROSSREF, state.getCompanies());
        EnrichmentPhaseHandler.applyRecords(context, TaskTypes.SCORER, state.getCompanies());

        log.info("Validation complete: {} companies", state.getCompanies().size());
        return PhaseOutcome.proceed();
    }
}
