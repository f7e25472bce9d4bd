package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.application.catalog.AssociationCatalog;
import com.ryuqq.pipeline.application.orchestrator.PhaseHandler;
import com.ryuqq.pipeline.core.phase.PipelinePhase;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * 기본 단계 핸들러 구성.
 *
 * <p>INIT부터 MONITOR까지 모든 비종료 단계에 핸들러를 등록합니다.
 * 특정 단계만 바꾸려면 반환된 맵에서 해당 항목을 교체하면 됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class DefaultPhaseHandlers {

    private DefaultPhaseHandlers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Map<PipelinePhase, PhaseHandler> create(AssociationCatalog catalog) {
        return create(catalog, Clock.systemUTC());
    }

    public static Map<PipelinePhase, PhaseHandler> create(AssociationCatalog catalog, Clock clock) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        Map<PipelinePhase, PhaseHandler> handlers = new EnumMap<>(PipelinePhase.class);
        handlers.put(PipelinePhase.INIT, new InitPhaseHandler(catalog));
        handlers.put(PipelinePhase.GATEKEEPER, new GatekeeperPhaseHandler());
        handlers.put(PipelinePhase.DISCOVERY, new DiscoveryPhaseHandler());
        handlers.put(PipelinePhase.CLASSIFICATION, new ClassificationPhaseHandler());
        handlers.put(PipelinePhase.EXTRACTION, new ExtractionPhaseHandler());
        handlers.put(PipelinePhase.ENRICHMENT, new EnrichmentPhaseHandler());
        handlers.put(PipelinePhase.VALIDATION, new ValidationPhaseHandler(clock));
        handlers.put(PipelinePhase.RESOLUTION, new ResolutionPhaseHandler(clock));
        handlers.put(PipelinePhase.GRAPH, new GraphPhaseHandler());
        handlers.put(PipelinePhase.EXPORT, new ExportPhaseHandler());
        handlers.put(PipelinePhase.MONITOR, new MonitorPhaseHandler());
        return handlers;
    }
}
