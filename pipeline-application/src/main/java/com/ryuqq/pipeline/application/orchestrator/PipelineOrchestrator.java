package com.ryuqq.pipeline.application.orchestrator;

import com.ryuqq.pipeline.application.config.PipelineConfig;
import com.ryuqq.pipeline.application.state.StateManager;
import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.state.ErrorRecord;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.task.TaskSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 파이프라인 단계 상태 머신.
 *
 * <p>고정된 단계 순서를 따라 단계마다 하나의 {@link PhaseHandler}를 실행합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * while (현재 단계가 DONE/FAILED가 아님):
 *   handler = handlers[현재 단계]        → 없으면 그대로 진행
 *   outcome = handler.execute(context)
 *     ├─ Abort     → 오류 기록 → FAILED 전이 → 종료
 *     ├─ 예외 발생  → 오류 기록 (agent=orchestrator, traceback) → FAILED 전이 → 종료
 *     └─ Proceed   → 다음 단계로 전이 (전이마다 체크포인트)
 * </pre>
 *
 * <p><strong>재개:</strong> 저장된 상태의 현재 단계부터 그대로 이어서 실행합니다.
 * 이미 끝난 단계는 다시 실행하지 않으며, 중단된 단계의 남은 작업은 큐가 기준이 됩니다.</p>
 *
 * <p><strong>동시성:</strong> 단계는 순차 실행됩니다. 한 인스턴스에서 동시에 여러 작업을 실행하지 마세요.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StateManager stateManager;
    private final TaskSpawner spawner;
    private final Map<PipelinePhase, PhaseHandler> handlers;
    private final PipelineConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param stateManager 상태 관리자
     * @param spawner 작업 실행기
     * @param handlers 단계별 핸들러 (없는 단계는 그대로 진행)
     * @param config 파이프라인 설정
     */
    public PipelineOrchestrator(
        StateManager stateManager,
        TaskSpawner spawner,
        Map<PipelinePhase, PhaseHandler> handlers,
        PipelineConfig config
    ) {
        this(stateManager, spawner, handlers, config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 지정).
     *
     * @throws IllegalArgumentException 의존성이 null이거나 종료 단계에 핸들러가 등록된 경우
     */
    public PipelineOrchestrator(
        StateManager stateManager,
        TaskSpawner spawner,
        Map<PipelinePhase, PhaseHandler> handlers,
        PipelineConfig config,
        Clock clock
    ) {
        if (stateManager == null) {
            throw new IllegalArgumentException("stateManager cannot be null");
        }
        if (spawner == null) {
            throw new IllegalArgumentException("spawner cannot be null");
        }
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        EnumMap<PipelinePhase, PhaseHandler> copy = new EnumMap<>(PipelinePhase.class);
        copy.putAll(handlers);
        for (PipelinePhase phase : copy.keySet()) {
            if (phase.isTerminal()) {
                throw new IllegalArgumentException("Terminal phase cannot have a handler: " + phase);
            }
        }
        this.stateManager = stateManager;
        this.spawner = spawner;
        this.handlers = copy;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 새 작업 실행.
     *
     * @param associationCodes 대상 단체 코드
     * @param jobId 작업 ID (null이면 생성)
     * @return 실행 결과
     */
    public PipelineResult run(List<String> associationCodes, String jobId) {
        PipelineState state = stateManager.createState(associationCodes, jobId);
        log.info("Starting state-machine pipeline: job={}, associations={}", state.getJobId(), associationCodes);
        return execute(state);
    }

    /**
     * 저장된 작업 재개.
     *
     * <p>이미 DONE/FAILED인 작업은 실행 없이 결과만 반환합니다.</p>
     *
     * @param jobId 작업 ID
     * @return 실행 결과 (저장된 상태가 없으면 empty)
     */
    public Optional<PipelineResult> resume(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        Optional<PipelineState> loaded = stateManager.load(jobId);
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        PipelineState state = loaded.get();
        log.info("Resuming job {} from phase {}", jobId, state.getCurrentPhase());
        return Optional.of(execute(state));
    }

    /**
     * 현재 단계부터 상태 머신 실행.
     *
     * @param state 파이프라인 상태
     * @return 실행 결과
     */
    public PipelineResult execute(PipelineState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        PhaseContext context = new PhaseContext(state, spawner, stateManager, config);

        while (!state.getCurrentPhase().isTerminal()) {
            PipelinePhase phase = state.getCurrentPhase();
            log.info("Executing phase: {}", phase);

            PhaseOutcome outcome;
            try {
                outcome = executePhase(phase, context);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                log.error("Phase {} failed for job {}", phase, state.getJobId(), e);
                state.addError(new ErrorRecord(
                    phase,
                    ErrorRecord.ORCHESTRATOR_AGENT,
                    e.getClass().getSimpleName(),
                    String.valueOf(e.getMessage()),
                    null,
                    Map.of("traceback", stackTrace(e)),
                    null
                ));
                stateManager.transitionPhase(state, PipelinePhase.FAILED);
                break;
            }

            if (outcome instanceof PhaseOutcome.Abort abort) {
                log.warn("Phase {} aborted for job {}: {}", phase, state.getJobId(), abort.reason());
                state.addError(ErrorRecord.of(phase, ErrorRecord.ORCHESTRATOR_AGENT, "PhaseAborted", abort.reason()));
                stateManager.transitionPhase(state, PipelinePhase.FAILED);
                break;
            }

            Optional<PipelinePhase> next = phase.next();
            if (next.isEmpty()) {
                break;
            }
            if (!stateManager.transitionPhase(state, next.get())) {
                log.error("Pipeline {} stopped: cannot leave phase {}", state.getJobId(), phase);
                break;
            }
        }

        PipelineResult result = PipelineResult.from(state, clock.instant());
        log.info("Pipeline {} finished at phase {} (success: {}, errors: {})",
            result.jobId(), result.finalPhase(), result.success(), result.errors().size());
        return result;
    }

    private PhaseOutcome executePhase(PipelinePhase phase, PhaseContext context) throws Exception {
        PhaseHandler handler = handlers.get(phase);
        if (handler == null) {
            log.debug("No handler registered for phase {}", phase);
            return PhaseOutcome.proceed();
        }
        PhaseOutcome outcome = handler.execute(context);
        if (outcome == null) {
            throw new IllegalStateException("Handler for phase " + phase + " returned no outcome");
        }
        return outcome;
    }

    private static String stackTrace(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
