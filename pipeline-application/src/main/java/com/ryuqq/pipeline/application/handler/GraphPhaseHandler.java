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
 * GRAPH 단계: 경쟁사 신호 수집과 관계 그래프 구성.
 *
 * <p>웹사이트가 있는 회사 중 앞에서부터 {@code graphSignalCompanyLimit}개에 대해
 * {@code intelligence.competitor_signal_miner}를 병렬 실행하고 {@code signals}를 누적합니다.
 * 이후 {@code intelligence.relationship_graph_builder}의 {@code edges}를 그래프 간선으로 추가합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class GraphPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(GraphPhaseHandler.class);

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();

        mineSignals(context);

        List<Map<String, Object>> companies = state.getCanonicalEntities().isEmpty()
            ? state.getCompanies()
            : state.getCanonicalEntities();
        List<Map<String, Object>> associations = new ArrayList<>();
        for (String code : state.getAssociationCodes()) {
            associations.add(Map.of("code", code));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "build");
        payload.put("companies", new ArrayList<>(companies));
        payload.put("events", new ArrayList<>(state.getEvents()));
        payload.put("participants", new ArrayList<>(state.getParticipants()));
        payload.put("signals", new ArrayList<>(state.getCompetitorSignals()));
        payload.put("associations", associations);
        TaskResult result = context.spawn(TaskTypes.RELATIONSHIP_GRAPH_BUILDER, payload);

        if (result instanceof TaskSuccess success) {
            List<Map<String, Object>> edges = success.records("edges");
            edges.forEach(state::addEdge);
            log.info("Graph built: {} edges added", edges.size());
        }
        return PhaseOutcome.proceed();
    }

    private void mineSignals(PhaseContext context) {
        PipelineState state = context.state();
        int limit = context.config().graphSignalCompanyLimit();

        List<Map<String, Object>> payloads = new ArrayList<>();
        for (Map<String, Object> company : state.getCompanies()) {
            if (payloads.size() >= limit) {
                break;
            }
            Object website = company.get("website");
            if (website == null || website.toString().isBlank()) {
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("url", website.toString());
            payload.put("source_company_id", company.get("id"));
            payload.put("association", firstAssociation(company));
            payloads.add(payload);
        }
        if (payloads.isEmpty()) {
            return;
        }

        int signals = 0;
        for (TaskResult result : context.spawnMany(TaskTypes.COMPETITOR_SIGNAL_MINER, payloads)) {
            if (result instanceof TaskSuccess success) {
                for (Map<String, Object> signal : success.records("signals")) {
                    state.addSignal(signal);
                    signals++;
                }
            }
        }
        log.info("Mined {} competitor signals from {} companies", signals, payloads.size());
    }

    private static Object firstAssociation(Map<String, Object> company) {
        if (company.get("associations") instanceof List<?> list && !list.isEmpty()) {
            return list.get(0);
        }
        return company.get("association");
    }
}
