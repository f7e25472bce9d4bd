package com.ryuqq.pipeline.application.orchestrator;

import com.ryuqq.pipeline.application.config.PipelineConfig;
import com.ryuqq.pipeline.application.state.StateManager;
import com.ryuqq.pipeline.core.state.ErrorRecord;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.task.TaskFailure;
import com.ryuqq.pipeline.core.task.TaskResult;
import com.ryuqq.pipeline.core.task.TaskSpawner;

import java.util.List;
import java.util.Map;

/**
 * 단계 핸들러 실행 컨텍스트.
 *
 * <p>작업 실행 결과 중 실패는 {@link ErrorRecord}로 상태에 기록됩니다
 * (agent = 작업 유형, url = payload의 url).</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class PhaseContext {

    private final PipelineState state;
    private final TaskSpawner spawner;
    private final StateManager stateManager;
    private final PipelineConfig config;

    public PhaseContext(PipelineState state, TaskSpawner spawner, StateManager stateManager, PipelineConfig config) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (spawner == null) {
            throw new IllegalArgumentException("spawner cannot be null");
        }
        if (stateManager == null) {
            throw new IllegalArgumentException("stateManager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.state = state;
        this.spawner = spawner;
        this.stateManager = stateManager;
        this.config = config;
    }

    public PipelineState state() {
        return state;
    }

    public PipelineConfig config() {
        return config;
    }

    /**
     * 단일 작업 실행 (설정의 작업 타임아웃 적용).
     *
     * @param taskType 작업 유형
     * @param payload 작업 입력
     * @return 작업 결과 (실패는 오류로 기록됨)
     */
    public TaskResult spawn(String taskType, Map<String, Object> payload) {
        TaskResult result = spawner.spawn(taskType, payload, config.taskTimeout());
        if (result instanceof TaskFailure failure) {
            recordFailure(taskType, payload, failure);
        }
        return result;
    }

    /**
     * 여러 작업 병렬 실행 (설정의 동시 실행 상한과 타임아웃 적용).
     *
     * @param taskType 작업 유형
     * @param payloads 작업 입력 목록
     * @return 입력 순서와 같은 순서의 결과 (실패는 오류로 기록됨)
     */
    public List<TaskResult> spawnMany(String taskType, List<Map<String, Object>> payloads) {
        List<TaskResult> results = spawner.spawnMany(taskType, payloads, config.maxConcurrent(), config.taskTimeout());
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) instanceof TaskFailure failure) {
                recordFailure(taskType, payloads.get(i), failure);
            }
        }
        return results;
    }

    /**
     * 현재 상태 체크포인트.
     */
    public void checkpoint() {
        stateManager.checkpoint(state);
    }

    private void recordFailure(String taskType, Map<String, Object> payload, TaskFailure failure) {
        Object url = payload == null ? null : payload.get("url");
        state.addError(new ErrorRecord(
            state.getCurrentPhase(),
            taskType,
            failure.errorType(),
            failure.error(),
            url == null ? null : url.toString(),
            failure.context(),
            null
        ));
    }
}
