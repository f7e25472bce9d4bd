package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.application.catalog.AssociationCatalog;
import com.ryuqq.pipeline.application.catalog.AssociationSource;
import com.ryuqq.pipeline.application.orchestrator.PhaseContext;
import com.ryuqq.pipeline.application.orchestrator.PhaseHandler;
import com.ryuqq.pipeline.application.orchestrator.PhaseOutcome;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.state.QueueItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * INIT 단계: 단체 카탈로그에서 시작 URL을 큐에 넣음.
 *
 * <p>우선순위가 "high"인 단체는 10, 나머지는 5로 큐에 들어갑니다.
 * 카탈로그에 없거나 URL이 없는 단체는 경고 후 건너뜁니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InitPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(InitPhaseHandler.class);

    private final AssociationCatalog catalog;

    public InitPhaseHandler(AssociationCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        this.catalog = catalog;
    }

    @Override
    public PhaseOutcome execute(PhaseContext context) {
        PipelineState state = context.state();
        int seeded = 0;
        for (String code : state.getAssociationCodes()) {
            Optional<AssociationSource> source = catalog.find(code);
            if (source.isEmpty()) {
                log.warn("Association {} is not in the catalog", code);
                continue;
            }
            String seedUrl = source.get().seedUrl();
            if (seedUrl == null) {
                log.warn("Association {} has no url or directory_url", code);
                continue;
            }
            if (state.addToQueue(QueueItem.of(seedUrl, source.get().queuePriority(), code, null))) {
                seeded++;
            }
        }
        log.info("Seeded {} URLs for {} associations", seeded, state.getAssociationCodes().size());
        return PhaseOutcome.proceed();
    }
}
