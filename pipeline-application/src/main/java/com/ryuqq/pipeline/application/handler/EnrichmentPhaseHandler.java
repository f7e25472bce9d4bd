package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.application.orchestrator.PhaseContext;
import com.ryuqq.pipeline.application.orchestrator.PhaseHandler;
import com.ryuqq.pipeline.application.orchestrator.PhaseOutcome;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.task.TaskResult;
import com.ryuqq.pipeline.core.task.TaskSuccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ENRICHMENT 단계: 회사 레코드 보강.
 *
 * <p>firmographic → tech_stack → contact_finder 순으로 전체 회사 레코드를 넘기고,
 * 성공 결과에 {@code records}가 있으면 회사 목록을 그 결과로 교체합니다.
 * 보강 작업 하나가 실패해도 다음 보강은 계속 진행합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class EnrichmentPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentPhaseHandler.class);

    static final List<String> ENRICHERS = List.of(
        TaskTypes.FIRMOGRAPHIC,
        TaskTypes.TECH_STACK,
        TaskTypes.CONTACT_FINDER
    );

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();
        if (state.getCompanies().isEmpty()) {
            log.info("No companies to enrich");
            return PhaseOutcome.proceed();
        }

        for (String enricher : ENRICHERS) {
            applyRecords(context, enricher, state.getCompanies());
        }

        log.info("Enrichment complete: {} companies", state.getCompanies().size());
        return PhaseOutcome.proceed();
    }

    /**
     * 레코드 목록을 넘겨 작업을 실행하고, 성공 시 반환된 레코드로 회사 목록 교체.
     *
     * @return 교체 여부
     */
    static boolean applyRecords(PhaseContext context, String taskType, List<Map<String, Object>> records) {
        TaskResult result = context.spawn(taskType, Map.of("records", new ArrayList<>(records)));
        if (result instanceof TaskSuccess success && success.get("records").isPresent()) {
            context.state().replaceCompanies(success.records("records"));
            return true;
        }
        return false;
    }
}
