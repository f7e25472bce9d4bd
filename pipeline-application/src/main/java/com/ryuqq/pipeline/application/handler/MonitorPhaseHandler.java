package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.application.orchestrator.PhaseContext;
import com.ryuqq.pipeline.application.orchestrator.PhaseHandler;
import com.ryuqq.pipeline.application.orchestrator.PhaseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MONITOR 단계: 디렉토리 URL에 대한 변경 감지 기준선 생성.
 *
 * <p>방문한 URL 중 {@code /member} 또는 {@code /directory}를 포함하는 URL을
 * 최대 {@code monitorUrlLimit}개까지 {@code monitoring.source_monitor}에 넘깁니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class MonitorPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(MonitorPhaseHandler.class);

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        int limit = context.config().monitorUrlLimit();

        List<String> urls = new ArrayList<>();
        for (String url : context.state().getVisitedUrls()) {
            if (urls.size() >= limit) {
                break;
            }
            if (url.contains("/member") || url.contains("/directory")) {
                urls.add(url);
            }
        }
        if (urls.isEmpty()) {
            log.info("No directory URLs to monitor");
            return PhaseOutcome.proceed();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "baseline");
        payload.put("urls", urls);
        context.spawn(TaskTypes.SOURCE_MONITOR, payload);

        log.info("Baselines requested for {} URLs", urls.size());
        return PhaseOutcome.proceed();
    }
}
