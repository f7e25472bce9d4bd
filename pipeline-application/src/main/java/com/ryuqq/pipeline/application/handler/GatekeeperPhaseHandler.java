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

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * GATEKEEPER 단계: 큐에 있는 도메인별 접근 허용 여부 확인.
 *
 * <p>도메인마다 {@code discovery.access_gatekeeper}를 한 번 실행합니다.
 * {@code is_allowed}가 true가 아니면 (작업 실패 포함) 해당 도메인의 큐 URL을 모두 차단합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class GatekeeperPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(GatekeeperPhaseHandler.class);

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();

        Set<String> domains = new LinkedHashSet<>();
        for (QueueItem item : state.getCrawlQueue()) {
            String host = host(item.url());
            if (host != null) {
                domains.add(host);
            }
        }

        int blocked = 0;
        for (String domain : domains) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("domain", domain);
            payload.put("check_page", false);
            TaskResult result = context.spawn(TaskTypes.ACCESS_GATEKEEPER, payload);

            if (isAllowed(result)) {
                continue;
            }
            String reason = reasons(result);
            List<String> urls = new ArrayList<>();
            for (QueueItem item : state.getCrawlQueue()) {
                if (domain.equals(host(item.url()))) {
                    urls.add(item.url());
                }
            }
            for (String url : urls) {
                if (state.markBlocked(url, reason)) {
                    blocked++;
                }
            }
            log.warn("Domain {} blocked ({} URLs): {}", domain, urls.size(), reason);
        }

        log.info("Checked {} domains, blocked {} URLs", domains.size(), blocked);
        return PhaseOutcome.proceed();
    }

    private static boolean isAllowed(TaskResult result) {
        return result instanceof TaskSuccess success
            && Boolean.TRUE.equals(success.get("is_allowed").orElse(Boolean.FALSE));
    }

    private static String reasons(TaskResult result) {
        if (result instanceof TaskSuccess success) {
            List<String> reasons = success.strings("reasons");
            return reasons.isEmpty() ? "disallowed" : String.join("; ", reasons);
        }
        return "gatekeeper check failed";
    }

    /**
     * URL의 호스트 (소문자). 파싱할 수 없으면 null.
     */
    static String host(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            log.debug("Cannot parse URL {}: {}", url, e.getMessage());
            return null;
        }
    }
}
