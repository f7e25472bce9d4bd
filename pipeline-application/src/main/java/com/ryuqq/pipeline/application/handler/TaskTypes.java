package com.ryuqq.pipeline.application.handler;

/**
 * 기본 단계 핸들러가 사용하는 작업 유형 식별자.
 *
 * <p>실제 작업 구현은 외부 협력자이며, 실행기 레지스트리에 이 이름으로 등록됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class TaskTypes {

    public static final String ACCESS_GATEKEEPER = "discovery.access_gatekeeper";
    public static final String SITE_MAPPER = "discovery.site_mapper";
    public static final String LINK_CRAWLER = "discovery.link_crawler";
    public static final String PAGE_CLASSIFIER = "discovery.page_classifier";

    public static final String HTML_PARSER = "extraction.html_parser";
    public static final String EVENT_EXTRACTOR = "extraction.event_extractor";
    public static final String EVENT_PARTICIPANT_EXTRACTOR = "extraction.event_participant_extractor";

    public static final String FIRMOGRAPHIC = "enrichment.firmographic";
    public static final String TECH_STACK = "enrichment.tech_stack";
    public static final String CONTACT_FINDER = "enrichment.contact_finder";

    public static final String CROSSREF = "validation.crossref";
    public static final String SCORER = "validation.scorer";

    public static final String COMPETITOR_SIGNAL_MINER = "intelligence.competitor_signal_miner";
    public static final String RELATIONSHIP_GRAPH_BUILDER = "intelligence.relationship_graph_builder";

    public static final String EXPORT_ACTIVATION = "export.export_activation";

    public static final String SOURCE_MONITOR = "monitoring.source_monitor";

    private TaskTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
