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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DISCOVERY 단계: 단체 사이트에서 회원 상세 URL을 찾아 큐에 넣음.
 *
 * <p><strong>처리 흐름 (힌트 없는 큐 항목마다, 우선순위 순):</strong></p>
 * <pre>
 * discovery.site_mapper(base_url)         → directory_url, pagination
 *   ↓ 방문 처리
 * discovery.link_crawler(entry_url)       → member_urls
 *   ↓
 * member_urls를 MEMBER_DETAIL 힌트로 큐에 추가
 * </pre>
 *
 * <p>힌트가 있는 항목(이미 발견된 회원 URL)은 EXTRACTION 단계 몫이므로 건드리지 않습니다.
 * 중단 후 재개하면 큐에 남은 힌트 없는 항목부터 이어서 처리합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class DiscoveryPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryPhaseHandler.class);

    static final String MEMBER_DETAIL = "MEMBER_DETAIL";
    static final int MEMBER_PRIORITY = 5;

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();
        int interval = context.config().discoveryCheckpointInterval();

        List<QueueItem> seeds = new ArrayList<>();
        for (QueueItem item : state.getCrawlQueue()) {
            if (item.pageTypeHint() == null) {
                seeds.add(item);
            }
        }
        seeds.sort(Comparator.comparingInt(QueueItem::priority).reversed());

        int processed = 0;
        int discovered = 0;
        for (QueueItem item : seeds) {
            if (!state.isQueued(item.url())) {
                continue;
            }
            discovered += discover(context, item);
            processed++;
            if (processed % interval == 0) {
                context.checkpoint();
            }
        }

        log.info("Discovery complete: {} sites mapped, {} member URLs queued", processed, discovered);
        return PhaseOutcome.proceed();
    }

    private int discover(PhaseContext context, QueueItem item) {
        PipelineState state = context.state();

        Map<String, Object> mapperPayload = new LinkedHashMap<>();
        mapperPayload.put("base_url", item.url());
        mapperPayload.put("association", item.association());
        TaskResult mapped = context.spawn(TaskTypes.SITE_MAPPER, mapperPayload);

        state.markVisited(item.url());

        if (!(mapped instanceof TaskSuccess mapping)) {
            return 0;
        }
        Object directoryUrl = mapping.get("directory_url").orElse(null);
        if (directoryUrl == null) {
            log.debug("No directory found for {}", item.url());
            return 0;
        }

        Map<String, Object> crawlerPayload = new LinkedHashMap<>();
        crawlerPayload.put("entry_url", directoryUrl.toString());
        crawlerPayload.put("pagination", mapping.get("pagination").orElse(null));
        crawlerPayload.put("association", item.association());
        TaskResult crawled = context.spawn(TaskTypes.LINK_CRAWLER, crawlerPayload);

        if (!(crawled instanceof TaskSuccess crawl)) {
            return 0;
        }
        int added = 0;
        for (String memberUrl : crawl.strings("member_urls")) {
            if (memberUrl.isBlank()) {
                continue;
            }
            QueueItem member = new QueueItem(memberUrl, MEMBER_PRIORITY, item.depth() + 1, directoryUrl.toString(),
                item.association(), MEMBER_DETAIL, null, null, null);
            if (state.addToQueue(member)) {
                added++;
            }
        }
        log.debug("Queued {} member URLs from {}", added, directoryUrl);
        return added;
    }
}
