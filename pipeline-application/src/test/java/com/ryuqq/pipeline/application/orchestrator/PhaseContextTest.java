package com.ryuqq.pipeline.application.orchestrator;

import com.ryuqq.pipeline.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.pipeline.application.config.PipelineConfig;
import com.ryuqq.pipeline.application.state.StateManager;
import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.state.ErrorRecord;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.task.TaskFailure;
import com.ryuqq.pipeline.core.task.TaskResult;
import com.ryuqq.pipeline.core.task.TaskSpawner;
import com.ryuqq.pipeline.core.task.TaskSuccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PhaseContextTest {

    @Mock
    private TaskSpawner spawner;

    private PipelineState state;
    private PipelineConfig config;
    private PhaseContext context;

    @BeforeEach
    void setUp() {
        state = PipelineState.create("job-ctx", List.of("pma"));
        state.transitionTo(PipelinePhase.GATEKEEPER);
        config = new PipelineConfig().withMaxConcurrent(3).withTaskTimeout(Duration.ofSeconds(30));
        context = new PhaseContext(state, spawner, new StateManager(new InMemoryStateStore()), config);
    }

    @Test
    void spawn은_설정된_타임아웃을_사용하고_실패를_오류로_기록() {
        // given
        when(spawner.spawn(eq("discovery.site_mapper"), anyMap(), eq(Duration.ofSeconds(30))))
            .thenReturn(TaskFailure.of("HttpError", "503 Service Unavailable"));

        // when
        TaskResult result = context.spawn("discovery.site_mapper", Map.of("url", "https://pma.org"));

        // then
        assertThat(result).isInstanceOf(TaskFailure.class);
        assertThat(state.getErrors()).hasSize(1);
        ErrorRecord error = state.getErrors().get(0);
        assertThat(error.phase()).isEqualTo(PipelinePhase.GATEKEEPER);
        assertThat(error.agent()).isEqualTo("discovery.site_mapper");
        assertThat(error.errorType()).isEqualTo("HttpError");
        assertThat(error.url()).isEqualTo("https://pma.org");
    }

    @Test
    void spawnMany는_동시_실행_상한을_넘기고_실패한_항목만_기록() {
        // given
        List<Map<String, Object>> payloads = List.of(
            Map.of("url", "https://a.org"),
            Map.of("url", "https://b.org"));
        when(spawner.spawnMany(eq("extraction.html_parser"), anyList(), eq(3), eq(Duration.ofSeconds(30))))
            .thenReturn(List.of(
                TaskSuccess.of(1),
                TaskFailure.timeout(30).withContext(Map.of("task_index", 1))));

        // when
        List<TaskResult> results = context.spawnMany("extraction.html_parser", payloads);

        // then
        assertThat(results).hasSize(2);
        assertThat(state.getErrors()).hasSize(1);
        ErrorRecord error = state.getErrors().get(0);
        assertThat(error.url()).isEqualTo("https://b.org");
        assertThat(error.errorMessage()).isEqualTo("Timeout after 30s");
        assertThat(error.context()).containsEntry("task_index", 1);
        verify(spawner).spawnMany(eq("extraction.html_parser"), anyList(), eq(3), eq(Duration.ofSeconds(30)));
    }

    @Test
    void 성공_결과는_오류를_남기지_않음() {
        // given
        when(spawner.spawn(eq("monitoring.source_monitor"), anyMap(), eq(Duration.ofSeconds(30))))
            .thenReturn(TaskSuccess.of(2));

        // when
        context.spawn("monitoring.source_monitor", Map.of());

        // then
        assertThat(state.getErrors()).isEmpty();
    }
}
