package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.adapter.inmemory.dlq.InMemoryDeadLetterQueue;
import com.ryuqq.pipeline.core.spi.ContractValidator;
import com.ryuqq.pipeline.core.spi.DeadLetterEntry;
import com.ryuqq.pipeline.core.spi.ValidationReport;
import com.ryuqq.pipeline.core.task.TaskFailure;
import com.ryuqq.pipeline.core.task.TaskResult;
import com.ryuqq.pipeline.core.task.TaskSuccess;
import com.ryuqq.pipeline.core.task.UnknownTaskTypeException;
import com.ryuqq.pipeline.testkit.task.ConcurrencyProbe;
import com.ryuqq.pipeline.testkit.task.ScriptedTaskUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * BoundedTaskSpawner 유닛 테스트.
 *
 * <ul>
 *   <li>입력 순서 보존</li>
 *   <li>작업별 타임아웃 격리</li>
 *   <li>예외 → TaskFailure 변환 (task_index / task_ref 포함)</li>
 *   <li>미등록 유형 즉시 실패</li>
 *   <li>동시 실행 상한 준수</li>
 *   <li>DLQ 기록, 권고 계약 검증</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BoundedTaskSpawnerTest {

    private static final String SCRIPTED = "test.scripted";

    @Mock
    private ContractValidator contractValidator;

    private ConcurrencyProbe probe;
    private InMemoryDeadLetterQueue deadLetterQueue;
    private TaskRegistry registry;
    private BoundedTaskSpawner spawner;

    @BeforeEach
    void setUp() {
        probe = new ConcurrencyProbe();
        deadLetterQueue = new InMemoryDeadLetterQueue();
        registry = TaskRegistry.builder()
            .register(SCRIPTED, () -> new ScriptedTaskUnit(probe))
            .build();
        spawner = new BoundedTaskSpawner(registry, new SpawnerConfig(), deadLetterQueue, ContractValidator.acceptAll());
    }

    @AfterEach
    void tearDown() {
        spawner.close();
    }

    // ============================================================
    // 1. 순서 보존
    // ============================================================

    @Test
    void spawnMany_완료_순서와_무관하게_입력_순서로_결과_반환() {
        // given: 앞선 작업일수록 오래 걸림
        List<Map<String, Object>> payloads = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            payloads.add(payload("sleep_ms", (6 - i) * 30, "data", Map.of("index", i)));
        }

        // when
        List<TaskResult> results = spawner.spawnMany(SCRIPTED, payloads, 6, Duration.ofSeconds(5));

        // then
        assertThat(results).hasSize(6);
        for (int i = 0; i < 6; i++) {
            assertThat(results.get(i)).isInstanceOf(TaskSuccess.class);
            assertThat(((TaskSuccess) results.get(i)).data()).containsEntry("index", i);
        }
    }

    @Test
    void spawnMany_빈_입력은_빈_결과() {
        // when
        List<TaskResult> results = spawner.spawnMany(SCRIPTED, List.of(), 3, Duration.ofSeconds(1));

        // then
        assertThat(results).isEmpty();
        assertThat(probe.invocations()).isZero();
    }

    // ============================================================
    // 2. 타임아웃 격리
    // ============================================================

    @Test
    void spawnMany_타임아웃된_작업만_실패하고_나머지는_성공() {
        // given
        List<Map<String, Object>> payloads = List.of(
            payload("url", "https://a.org/fast-1"),
            payload("url", "https://a.org/slow", "sleep_ms", 5_000),
            payload("url", "https://a.org/fast-2")
        );

        // when
        long started = System.nanoTime();
        List<TaskResult> results = spawner.spawnMany(SCRIPTED, payloads, 3, Duration.ofMillis(200));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        // then
        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(2).isSuccess()).isTrue();

        TaskFailure timeout = (TaskFailure) results.get(1);
        assertThat(timeout.errorType()).isEqualTo(TaskFailure.TIMEOUT_ERROR_TYPE);
        assertThat(timeout.error()).startsWith("Timeout after");
        assertThat(timeout.context()).containsEntry("task_index", 1)
            .containsEntry("task_ref", "https://a.org/slow");
        assertThat(elapsedMs).isLessThan(4_000);
    }

    // ============================================================
    // 3. 예외 변환
    // ============================================================

    @Test
    void spawnMany_예외는_실패_결과로_변환되고_컨텍스트_추가() {
        // given
        List<Map<String, Object>> payloads = List.of(
            payload("id", "company-1"),
            payload("throw", "parser exploded"),
            payload("id", "company-3", "fail", "no members found")
        );

        // when
        List<TaskResult> results = spawner.spawnMany(SCRIPTED, payloads, 2, Duration.ofSeconds(5));

        // then
        assertThat(results.get(0).isSuccess()).isTrue();

        TaskFailure thrown = (TaskFailure) results.get(1);
        assertThat(thrown.errorType()).isEqualTo("IllegalStateException");
        assertThat(thrown.error()).isEqualTo("parser exploded");
        assertThat(thrown.context()).containsEntry("task_index", 1).containsEntry("task_ref", "task_1");

        TaskFailure reported = (TaskFailure) results.get(2);
        assertThat(reported.errorType()).isEqualTo(ScriptedTaskUnit.FAILURE_TYPE);
        assertThat(reported.context()).containsEntry("task_ref", "company-3");
    }

    @Test
    void spawn_예외는_실패_결과로_반환() {
        // when
        TaskResult result = spawner.spawn(SCRIPTED, payload("throw", "boom"), Duration.ofSeconds(5));

        // then
        assertThat(result).isInstanceOf(TaskFailure.class);
        assertThat(((TaskFailure) result).errorType()).isEqualTo("IllegalStateException");
        assertThat(result.recordsProcessed()).isZero();
    }

    @Test
    void spawn_타임아웃이_없으면_기본값_사용() {
        // when
        TaskResult result = spawner.spawn(SCRIPTED, payload("records_processed", 4), null);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.recordsProcessed()).isEqualTo(4);
    }

    // ============================================================
    // 4. 미등록 유형
    // ============================================================

    @Test
    void spawnMany_미등록_유형은_실행_전에_실패() {
        // given
        List<Map<String, Object>> payloads = List.of(payload("url", "https://a.org"), payload("url", "https://b.org"));

        // when & then
        assertThatThrownBy(() -> spawner.spawnMany("test.missing", payloads, 2, Duration.ofSeconds(1)))
            .isInstanceOf(UnknownTaskTypeException.class)
            .hasMessageContaining("test.missing");
        assertThat(probe.invocations()).isZero();
    }

    @Test
    void spawn_미등록_유형은_예외() {
        assertThatThrownBy(() -> spawner.spawn("test.missing", Map.of(), Duration.ofSeconds(1)))
            .isInstanceOf(UnknownTaskTypeException.class);
        assertThat(probe.invocations()).isZero();
    }

    @Test
    void spawnMany_동시_실행_상한이_0이하면_예외() {
        assertThatThrownBy(() -> spawner.spawnMany(SCRIPTED, List.of(Map.of()), 0, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 5. 동시 실행 상한
    // ============================================================

    @Test
    void spawnMany_동시_실행_수는_상한을_넘지_않음() {
        // given
        List<Map<String, Object>> payloads = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            payloads.add(payload("sleep_ms", 40));
        }

        // when
        List<TaskResult> results = spawner.spawnMany(SCRIPTED, payloads, 3, Duration.ofSeconds(5));

        // then
        assertThat(results).allMatch(TaskResult::isSuccess);
        assertThat(probe.invocations()).isEqualTo(12);
        assertThat(probe.maxActive()).isLessThanOrEqualTo(3).isPositive();
    }

    @Test
    void spawnMany_인터럽트를_무시하는_작업은_끝날_때까지_슬롯을_점유() {
        // given: 타임아웃보다 오래 busy-wait 하는 작업 3개, 상한 1
        List<Map<String, Object>> payloads = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            payloads.add(payload("spin_ms", 300));
        }

        // when
        List<TaskResult> results = spawner.spawnMany(SCRIPTED, payloads, 1, Duration.ofMillis(50));

        // then
        assertThat(results).hasSize(3).allMatch(result -> !result.isSuccess());
        assertThat(results).allSatisfy(result ->
            assertThat(((TaskFailure) result).errorType()).isEqualTo(TaskFailure.TIMEOUT_ERROR_TYPE));
        assertThat(probe.maxActive()).isEqualTo(1);
    }

    // ============================================================
    // 6. DLQ
    // ============================================================

    @Test
    void spawnMany_실패_결과는_DLQ에_기록() {
        // given
        List<Map<String, Object>> payloads = List.of(
            payload("url", "https://a.org/ok"),
            payload("url", "https://a.org/broken", "throw", "bad html")
        );

        // when
        spawner.spawnMany(SCRIPTED, payloads, 2, Duration.ofSeconds(5));

        // then
        assertThat(deadLetterQueue.count()).isEqualTo(1);
        DeadLetterEntry entry = deadLetterQueue.readAll().get(0);
        assertThat(entry.agentType()).isEqualTo(SCRIPTED);
        assertThat(entry.task()).containsEntry("url", "https://a.org/broken");
        assertThat(entry.error()).isEqualTo("bad html");
        assertThat(entry.context())
            .containsEntry("error_type", "IllegalStateException")
            .containsEntry("task_index", 1)
            .containsEntry("task_ref", "https://a.org/broken");
    }

    @Test
    void spawn_성공은_DLQ에_기록하지_않음() {
        // when
        spawner.spawn(SCRIPTED, payload("url", "https://a.org"));

        // then
        assertThat(deadLetterQueue.count()).isZero();
    }

    // ============================================================
    // 7. 권고 계약 검증
    // ============================================================

    @Test
    void spawn_계약_위반이어도_작업은_실행됨() {
        // given
        Map<String, Object> payload = payload("id", "company-1");
        when(contractValidator.validate(eq(SCRIPTED), anyMap()))
            .thenReturn(ValidationReport.invalid(List.of("url is required")));
        try (BoundedTaskSpawner validating =
                 new BoundedTaskSpawner(registry, new SpawnerConfig(), deadLetterQueue, contractValidator)) {

            // when
            TaskResult result = validating.spawn(SCRIPTED, payload, Duration.ofSeconds(5));

            // then
            assertThat(result.isSuccess()).isTrue();
            assertThat(probe.invocations()).isEqualTo(1);
            verify(contractValidator).validate(eq(SCRIPTED), anyMap());
        }
    }

    // ============================================================
    // 8. 유틸리티
    // ============================================================

    @Test
    void taskRef_url_다음_id_다음_인덱스() {
        assertThat(BoundedTaskSpawner.taskRef(0, Map.of("url", "https://a.org", "id", "x"))).isEqualTo("https://a.org");
        assertThat(BoundedTaskSpawner.taskRef(1, Map.of("id", "x"))).isEqualTo("x");
        assertThat(BoundedTaskSpawner.taskRef(2, Map.of())).isEqualTo("task_2");
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }
}
