package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.spi.ContractValidator;
import com.ryuqq.pipeline.core.spi.DeadLetterQueue;
import com.ryuqq.pipeline.core.spi.ValidationReport;
import com.ryuqq.pipeline.core.task.BatchSummary;
import com.ryuqq.pipeline.core.task.TaskFailure;
import com.ryuqq.pipeline.core.task.TaskResult;
import com.ryuqq.pipeline.core.task.TaskSpawner;
import com.ryuqq.pipeline.core.task.TaskUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 동시 실행 상한이 있는 Task Spawner 구현체.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>작업 유형을 {@link TaskRegistry}에서 해석 (미등록 유형은 실행 전 즉시 실패)</li>
 *   <li>작업별 타임아웃 적용 (초과 시 해당 작업만 취소)</li>
 *   <li>타임아웃과 예외를 {@link TaskFailure}로 변환</li>
 *   <li>실패 결과를 Dead Letter Queue에 기록</li>
 *   <li>계약 검증 (권고 사항, 위반 시 경고 로그만 남김)</li>
 * </ul>
 *
 * <p><strong>spawnMany 처리 흐름:</strong></p>
 * <pre>
 * require(taskType)                → 미등록 유형이면 UnknownTaskTypeException
 *   ↓
 * For each payload (i):
 *   semaphore.acquire()            → 동시 실행 상한 대기
 *   runAsync(execute(payload_i))   → 작업 본문이 실제로 끝날 때 semaphore.release()
 *   ↓
 * join in input order              → results[i] ↔ payloads[i]
 *   ↓
 * 실패 결과에 task_index / task_ref 추가 + DLQ 기록
 *   ↓
 * 배치 요약 로그 (successes / failures / total records)
 * </pre>
 *
 * <p><strong>취소 정책:</strong> 작업 사이의 취소 신호는 없습니다.
 * 한 작업의 실패나 타임아웃은 같은 배치의 다른 작업에 영향을 주지 않습니다.</p>
 *
 * <p><strong>타임아웃과 슬롯:</strong> 타임아웃 결과는 즉시 반환하지만, 인터럽트를 무시하는 작업이
 * 계속 실행 중이면 그 슬롯은 작업이 끝날 때까지 반환되지 않습니다.
 * 따라서 동시 실행 수는 타임아웃 이후에도 maxConcurrent를 넘지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class BoundedTaskSpawner implements TaskSpawner, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedTaskSpawner.class);

    private final TaskRegistry registry;
    private final SpawnerConfig config;
    private final DeadLetterQueue deadLetterQueue;
    private final ContractValidator contractValidator;
    private final ExecutorService workers;

    /**
     * 생성자 (DLQ 미사용, 계약 검증 없음).
     *
     * @param registry 작업 레지스트리
     * @param config 설정
     */
    public BoundedTaskSpawner(TaskRegistry registry, SpawnerConfig config) {
        this(registry, config, DeadLetterQueue.discarding(), ContractValidator.acceptAll());
    }

    /**
     * 생성자.
     *
     * @param registry 작업 레지스트리
     * @param config 설정
     * @param deadLetterQueue 실패 작업 기록소
     * @param contractValidator 계약 검증기 (권고)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BoundedTaskSpawner(
        TaskRegistry registry,
        SpawnerConfig config,
        DeadLetterQueue deadLetterQueue,
        ContractValidator contractValidator
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (deadLetterQueue == null) {
            throw new IllegalArgumentException("deadLetterQueue cannot be null");
        }
        if (contractValidator == null) {
            throw new IllegalArgumentException("contractValidator cannot be null");
        }

        this.registry = registry;
        this.config = config;
        this.deadLetterQueue = deadLetterQueue;
        this.contractValidator = contractValidator;
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    // ============================================================
    // 단일 실행
    // ============================================================

    /**
     * 기본 타임아웃으로 단일 작업 실행.
     */
    public TaskResult spawn(String taskType, Map<String, Object> payload) {
        return spawn(taskType, payload, config.defaultTimeout());
    }

    @Override
    public TaskResult spawn(String taskType, Map<String, Object> payload, Duration timeout) {
        TaskUnit unit = registry.resolve(taskType);
        Map<String, Object> safePayload = payload == null ? Map.of() : payload;
        Duration effectiveTimeout = effectiveTimeout(timeout);

        validateContract(taskType, safePayload);
        TaskResult result = execute(taskType, unit, safePayload, effectiveTimeout, () -> { });

        if (result instanceof TaskFailure failure) {
            pushDeadLetter(taskType, safePayload, failure);
        }
        return result;
    }

    // ============================================================
    // 배치 실행
    // ============================================================

    /**
     * 설정의 동시 실행 상한과 기본 타임아웃으로 배치 실행.
     */
    public List<TaskResult> spawnMany(String taskType, List<Map<String, Object>> payloads) {
        return spawnMany(taskType, payloads, config.maxConcurrent(), config.defaultTimeout());
    }

    @Override
    public List<TaskResult> spawnMany(
        String taskType,
        List<Map<String, Object>> payloads,
        int maxConcurrent,
        Duration timeout
    ) {
        registry.require(taskType);
        if (payloads == null) {
            throw new IllegalArgumentException("payloads cannot be null");
        }
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
        if (payloads.isEmpty()) {
            return List.of();
        }

        Duration effectiveTimeout = effectiveTimeout(timeout);
        Semaphore semaphore = new Semaphore(maxConcurrent);
        List<CompletableFuture<TaskResult>> futures = new ArrayList<>(payloads.size());

        for (int i = 0; i < payloads.size(); i++) {
            Map<String, Object> payload = payloads.get(i) == null ? Map.of() : payloads.get(i);
            try {
                semaphore.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("spawnMany {} interrupted while waiting for a slot at task {}", taskType, i);
                futures.add(CompletableFuture.completedFuture(TaskFailure.from(e)));
                continue;
            }
            Runnable releaseSlot = releaseOnce(semaphore);
            try {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        validateContract(taskType, payload);
                        return execute(taskType, registry.resolve(taskType), payload, effectiveTimeout, releaseSlot);
                    } catch (RuntimeException e) {
                        releaseSlot.run();
                        log.error("Failed to create task {}", taskType, e);
                        return TaskFailure.from(e);
                    }
                }, workers));
            } catch (RuntimeException e) {
                releaseSlot.run();
                log.error("Failed to schedule task {}", taskType, e);
                futures.add(CompletableFuture.completedFuture(TaskFailure.from(e)));
            }
        }

        List<TaskResult> results = new ArrayList<>(payloads.size());
        for (int i = 0; i < futures.size(); i++) {
            TaskResult result = futures.get(i).join();
            if (result instanceof TaskFailure failure) {
                Map<String, Object> payload = payloads.get(i) == null ? Map.of() : payloads.get(i);
                TaskFailure enriched = failure.withContext(taskContext(i, payload));
                pushDeadLetter(taskType, payload, enriched);
                result = enriched;
            }
            results.add(result);
        }

        BatchSummary summary = BatchSummary.of(results);
        log.info("spawnMany {} complete: {} successes, {} failures, {} total records",
            taskType, summary.successes(), summary.failures(), summary.totalRecords());
        return results;
    }

    // ============================================================
    // 내부 처리
    // ============================================================

    /**
     * 작업 하나를 타임아웃 안에서 실행하고 모든 오류를 실패 결과로 변환.
     *
     * <p>onFinish는 작업 본문이 끝날 때 정확히 한 번 호출됩니다.
     * 시작 전에 취소된 작업은 취소 시점에 호출합니다.</p>
     */
    private TaskResult execute(
        String taskType,
        TaskUnit unit,
        Map<String, Object> payload,
        Duration timeout,
        Runnable onFinish
    ) {
        AtomicBoolean started = new AtomicBoolean(false);
        Future<TaskResult> future;
        try {
            future = workers.submit(() -> {
                if (!started.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return unit.execute(payload);
                } finally {
                    onFinish.run();
                }
            });
        } catch (RuntimeException e) {
            onFinish.run();
            log.error("Failed to submit task {}", taskType, e);
            return TaskFailure.from(e);
        }

        try {
            TaskResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return TaskFailure.of("NullResult", "Task returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            cancel(future, started, onFinish);
            log.warn("Task {} timed out after {}s", taskType, timeout.toSeconds());
            return TaskFailure.timeout(timeout.toSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Task {} failed: {}", taskType, cause.toString(), cause);
            return TaskFailure.from(cause);
        } catch (InterruptedException e) {
            cancel(future, started, onFinish);
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted", taskType);
            return TaskFailure.from(e);
        }
    }

    // 실행 중인 작업의 onFinish는 작업 자신의 finally에서 호출됨
    private static void cancel(Future<TaskResult> future, AtomicBoolean started, Runnable onFinish) {
        future.cancel(true);
        if (started.compareAndSet(false, true)) {
            onFinish.run();
        }
    }

    private static Runnable releaseOnce(Semaphore semaphore) {
        AtomicBoolean released = new AtomicBoolean(false);
        return () -> {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        };
    }

    private void validateContract(String taskType, Map<String, Object> payload) {
        try {
            ValidationReport report = contractValidator.validate(taskType, payload);
            if (report != null && !report.valid()) {
                log.warn("Contract violation for {} (advisory): {}", taskType, report.errors());
            }
        } catch (RuntimeException e) {
            log.warn("Contract validation for {} failed (advisory): {}", taskType, e.toString());
        }
    }

    private void pushDeadLetter(String taskType, Map<String, Object> payload, TaskFailure failure) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("error_type", failure.errorType());
        context.putAll(failure.context());
        try {
            deadLetterQueue.push(taskType, payload, failure.error(), context);
        } catch (RuntimeException e) {
            log.warn("Failed to write dead letter for {}: {}", taskType, e.toString());
        }
    }

    private static Map<String, Object> taskContext(int index, Map<String, Object> payload) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("task_index", index);
        context.put("task_ref", taskRef(index, payload));
        return context;
    }

    // payload의 url, 없으면 id, 둘 다 없으면 task_{i}
    static String taskRef(int index, Map<String, Object> payload) {
        Object url = payload.get("url");
        if (url != null && !url.toString().isEmpty()) {
            return url.toString();
        }
        Object id = payload.get("id");
        if (id != null && !id.toString().isEmpty()) {
            return id.toString();
        }
        return "task_" + index;
    }

    private Duration effectiveTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return config.defaultTimeout();
        }
        return timeout;
    }

    /**
     * Spawner 종료 (리소스 정리).
     *
     * <p>실행 중인 작업은 인터럽트합니다.</p>
     */
    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "task-spawner-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
