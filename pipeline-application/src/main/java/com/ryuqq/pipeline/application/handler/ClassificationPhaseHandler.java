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

/**
 * CLASSIFICATION 단계: 유형 정보가 없는 큐 항목 분류.
 *
 * <p>힌트도 분류 결과도 없는 항목을 큐 순서대로 최대 {@code classificationLimit}개까지
 * {@code discovery.page_classifier}로 분류하고, 결과(page_type, recommended_extractor)를 큐 항목에 반영합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ClassificationPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ClassificationPhaseHandler.class);

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();
        int limit = context.config().classificationLimit();

        List<String> urls = new ArrayList<>();
        for (QueueItem item : state.getCrawlQueue()) {
            if (urls.size() >= limit) {
                break;
            }
            if (item.effectivePageType() == null) {
                urls.add(item.url());
            }
        }
        if (urls.isEmpty()) {
            log.info("No pages to classify");
            return PhaseOutcome.proceed();
        }

        List<Map<String, Object>> payloads = new ArrayList<>(urls.size());
        for (String url : urls) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("url", url);
            payload.put("fetch", true);
            payloads.add(payload);
        }

        List<TaskResult> results = context.spawnMany(TaskTypes.PAGE_CLASSIFIER, payloads);
        int classified = 0;
        for (int i = 0; i < results.size(); i++) {
            if (!(results.get(i) instanceof TaskSuccess success)) {
                continue;
            }
            Object pageType = success.get("page_type").orElse(null);
            Object extractor = success.get("recommended_extractor").orElse(null);
            if (pageType != null && state.classifyQueued(urls.get(i), pageType.toString(),
                extractor == null ? null : extractor.toString())) {
                classified++;
            }
        }

        log.info("Classified {} of {} pages", classified, urls.size());
        return PhaseOutcome.proceed();
    }
}
