package com.ryuqq.pipeline.application.handler;

import com.ryuqq.pipeline.core.state.QueueItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionPhaseHandlerTest {

    @ParameterizedTest
    @CsvSource({
        "EVENTS_LIST, extraction.event_extractor",
        "EVENT_DETAIL, extraction.event_extractor",
        "SPONSORS_LIST, extraction.event_participant_extractor",
        "EXHIBITORS_LIST, extraction.event_participant_extractor",
        "PARTICIPANTS_LIST, extraction.event_participant_extractor",
        "MEMBER_DETAIL, extraction.html_parser"
    })
    void 페이지_유형별_추출기_선택(String pageType, String expected) {
        QueueItem item = QueueItem.of("https://pma.org/page", 5, "PMA", pageType);

        assertThat(ExtractionPhaseHandler.selectExtractor(item)).isEqualTo(expected);
    }

    @Test
    void 이벤트_유형은_추천_추출기보다_우선() {
        QueueItem item = QueueItem.of("https://pma.org/events", 5)
            .withClassification("EVENTS_LIST", "extraction.pdf_parser");

        assertThat(ExtractionPhaseHandler.selectExtractor(item)).isEqualTo(TaskTypes.EVENT_EXTRACTOR);
    }

    @Test
    void 그_외_유형은_분류_단계_추천_추출기를_사용() {
        QueueItem item = QueueItem.of("https://pma.org/members.pdf", 5)
            .withClassification("MEMBER_DIRECTORY", "extraction.pdf_parser");

        assertThat(ExtractionPhaseHandler.selectExtractor(item)).isEqualTo("extraction.pdf_parser");
    }

    @Test
    void 유형_정보가_없으면_html_parser() {
        QueueItem item = QueueItem.of("https://pma.org/unknown", 5);

        assertThat(ExtractionPhaseHandler.selectExtractor(item)).isEqualTo(TaskTypes.HTML_PARSER);
    }
}
