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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EXPORT 단계: 회사/이벤트 내보내기와 요약 보고서 생성.
 *
 * <p>dryRun이면 아무 작업도 실행하지 않습니다. 회사 내보내기는 정규 엔티티가 있으면 정규 엔티티를,
 * 없으면 회사 레코드를 대상으로 하며 {@code min_quality} 필터를 함께 넘깁니다.
 * 성공한 내보내기는 {@code {type, path, count}} 형태로 상태에 기록됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ExportPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ExportPhaseHandler.class);

    private static final String FORMAT = "csv";

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        if (context.config().dryRun()) {
            log.info("Dry run - skipping exports");
            return PhaseOutcome.proceed();
        }

        PipelineState state = context.state();
        List<Map<String, Object>> companies = state.getCanonicalEntities().isEmpty()
            ? state.getCompanies()
            : state.getCanonicalEntities();

        if (!companies.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("export_type", "companies");
            payload.put("format", FORMAT);
            payload.put("records", new ArrayList<>(companies));
            payload.put("filters", Map.of("min_quality", context.config().exportMinQuality()));
            export(context, "companies", payload);
        }

        if (!state.getEvents().isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("export_type", "events");
            payload.put("format", FORMAT);
            payload.put("records", new ArrayList<>(state.getEvents()));
            export(context, "events", payload);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("export_type", "summary");
        summary.put("action", "summary_report");
        summary.put("companies", new ArrayList<>(companies));
        summary.put("events", new ArrayList<>(state.getEvents()));
        summary.put("signals", new ArrayList<>(state.getCompetitorSignals()));
        context.spawn(TaskTypes.EXPORT_ACTIVATION, summary);

        log.info("Export complete: {} exports recorded", state.getExports().size());
        return PhaseOutcome.proceed();
    }

    private static void export(PhaseContext context, String type, Map<String, Object> payload) {
        TaskResult result = context.spawn(TaskTypes.EXPORT_ACTIVATION, payload);
        if (!(result instanceof TaskSuccess success)) {
            return;
        }
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("type", type);
        export.put("path", success.get("export_path").orElse(null));
        export.put("count", success.get("records_exported").orElse(null));
        context.state().addExport(export);
    }
}
