package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.application.orchestrator.PhaseContext;
import com.ryuqq.pipeline.application.orchestrator.PhaseHandler;
import com.ryuqq.pipeline.application.orchestrator.PhaseOutcome;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.state.QueueItem;
import com.ryuqq.pipeline.core.task.TaskResult;
import com.ryuqq.pipeline.core.task.TaskSuccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * EXTRACTION 단계: 큐를 배치 단위로 비우며 페이지 데이터 추출.
 *
 * <p><strong>추출기 선택 (페이지 유형 기준):</strong></p>
 * <ul>
 *   <li>EVENTS_LIST, EVENT_DETAIL → {@code extraction.event_extractor} → events</li>
 *   <li>SPONSORS_LIST, EXHIBITORS_LIST, PARTICIPANTS_LIST → {@code extraction.event_participant_extractor} → participants</li>
 *   <li>그 외 → 분류 단계 추천 추출기, 없으면 {@code extraction.html_parser} → companies</li>
 * </ul>
 *
 * <p>배치 안에서는 추출기별로 묶어 병렬 실행하고, 결과는 입력 순서대로 상태에 반영합니다.
 * 전체 실패율이 {@code maxExtractionErrorRate}를 넘으면 단계를 실패 처리합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ExtractionPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPhaseHandler.class);

    private static final Set<String> EVENT_PAGE_TYPES = Set.of("EVENTS_LIST", "EVENT_DETAIL");
    private static final Set<String> PARTICIPANT_PAGE_TYPES = Set.of("SPONSORS_LIST", "EXHIBITORS_LIST", "PARTICIPANTS_LIST");
    private static final String DEFAULT_PAGE_TYPE = "MEMBER_DETAIL";

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();
        int batchSize = context.config().extractionBatchSize();
        int interval = context.config().extractionCheckpointInterval();

        int attempted = 0;
        int failed = 0;
        int sinceCheckpoint = 0;

        while (true) {
            List<QueueItem> batch = state.nextUrls(batchSize);
            if (batch.isEmpty()) {
                break;
            }

            Map<String, List<QueueItem>> byExtractor = new LinkedHashMap<>();
            for (QueueItem item : batch) {
                byExtractor.computeIfAbsent(selectExtractor(item), key -> new ArrayList<>()).add(item);
            }

            for (Map.Entry<String, List<QueueItem>> group : byExtractor.entrySet()) {
                String extractor = group.getKey();
                List<QueueItem> items = group.getValue();
                List<TaskResult> results = context.spawnMany(extractor, payloads(items));

                for (int i = 0; i < items.size(); i++) {
                    TaskResult result = results.get(i);
                    state.markVisited(items.get(i).url());
                    attempted++;
                    if (result instanceof TaskSuccess success) {
                        store(state, extractor, success.records("records"));
                    } else {
                        failed++;
                    }
                }
            }

            sinceCheckpoint += batch.size();
            if (sinceCheckpoint >= interval) {
                context.checkpoint();
                sinceCheckpoint = 0;
            }
        }

        double errorRate = attempted == 0 ? 0.0 : (double) failed / attempted;
        log.info("Extraction complete: {} pages, {} failures ({}%)", attempted, failed, Math.round(errorRate * 100));

        double maxErrorRate = context.config().maxExtractionErrorRate();
        if (errorRate > maxErrorRate) {
            return PhaseOutcome.abort(String.format(
                "Extraction error rate %d%% exceeds threshold %d%% (%d of %d pages failed)",
                Math.round(errorRate * 100), Math.round(maxErrorRate * 100), failed, attempted));
        }
        return PhaseOutcome.proceed();
    }

    /**
     * 큐 항목의 페이지 유형으로 추출기 결정.
     */
    static String selectExtractor(QueueItem item) {
        String pageType = pageType(item);
        if (EVENT_PAGE_TYPES.contains(pageType)) {
            return TaskTypes.EVENT_EXTRACTOR;
        }
        if (PARTICIPANT_PAGE_TYPES.contains(pageType)) {
            return TaskTypes.EVENT_PARTICIPANT_EXTRACTOR;
        }
        if (item.extractor() != null && !item.extractor().isBlank()) {
            return item.extractor();
        }
        return TaskTypes.HTML_PARSER;
    }

    private static String pageType(QueueItem item) {
        String pageType = item.effectivePageType();
        return pageType == null ? DEFAULT_PAGE_TYPE : pageType;
    }

    private static List<Map<String, Object>> payloads(List<QueueItem> items) {
        List<Map<String, Object>> payloads = new ArrayList<>(items.size());
        for (QueueItem item : items) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("url", item.url());
            payload.put("association", item.association());
            payload.put("page_type", pageType(item));
            payloads.add(payload);
        }
        return payloads;
    }

    private static void store(PipelineState state, String extractor, List<Map<String, Object>> records) {
        if (TaskTypes.EVENT_PARTICIPANT_EXTRACTOR.equals(extractor)) {
            records.forEach(state::addParticipant);
        } else if (TaskTypes.EVENT_EXTRACTOR.equals(extractor)) {
            records.forEach(state::addEvent);
        } else {
            records.forEach(state::addCompany);
        }
    }
}
