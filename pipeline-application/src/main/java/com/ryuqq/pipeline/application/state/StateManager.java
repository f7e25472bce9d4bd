package com.ryuqq.pipeline.application.state;

import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.spi.CheckpointSummary;
import com.ryuqq.pipeline.core.spi.JobInfo;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 파이프라인 상태 영속화 관리자.
 *
 * <p>{@link StateStore}에 전체 상태 스냅샷과 단계별 체크포인트 요약을 기록합니다.</p>
 *
 * <p><strong>체크포인트 규칙:</strong></p>
 * <ul>
 *   <li>전체 상태는 작업당 하나의 최신 스냅샷으로 덮어씀</li>
 *   <li>체크포인트 요약은 단계별로 남김 (관측용)</li>
 *   <li>모든 단계 전이 직후 체크포인트</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    private final StateStore store;

    /**
     * 생성자.
     *
     * @param store 상태 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public StateManager(StateStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * 새 파이프라인 상태 생성 후 저장.
     *
     * @param associationCodes 대상 단체 코드
     * @param jobId 작업 ID (null이면 생성)
     * @return 생성된 상태
     */
    public PipelineState createState(List<String> associationCodes, String jobId) {
        PipelineState state = PipelineState.create(jobId, associationCodes);
        save(state);
        log.info("Created new pipeline state: {}", state.getJobId());
        return state;
    }

    /**
     * 전체 상태 저장 (덮어쓰기).
     */
    public void save(PipelineState state) {
        store.save(state);
        log.debug("Saved state for job {}", state.getJobId());
    }

    /**
     * 저장된 상태 로드.
     *
     * @param jobId 작업 ID
     * @return 상태 (없으면 empty)
     */
    public Optional<PipelineState> load(String jobId) {
        Optional<PipelineState> state = store.load(jobId);
        if (state.isPresent()) {
            log.info("Loaded state for job {}, phase: {}", jobId, state.get().getCurrentPhase());
        } else {
            log.warn("State not found for job {}", jobId);
        }
        return state;
    }

    /**
     * 현재 단계 체크포인트 (전체 상태 + 단계 요약).
     *
     * @param state 파이프라인 상태
     */
    public void checkpoint(PipelineState state) {
        save(state);
        store.writeCheckpoint(CheckpointSummary.of(state));
        log.info("Checkpoint created for job {} at phase {}", state.getJobId(), state.getCurrentPhase());
    }

    /**
     * 단계 전이 후 체크포인트.
     *
     * <p>허용되지 않은 전이는 상태를 바꾸지 않고 false를 반환합니다 (체크포인트 없음).</p>
     *
     * @param state 파이프라인 상태
     * @param next 전이할 단계
     * @return 전이 성공 여부
     */
    public boolean transitionPhase(PipelineState state, PipelinePhase next) {
        if (!state.transitionTo(next)) {
            return false;
        }
        checkpoint(state);
        return true;
    }

    public Optional<CheckpointSummary> latestCheckpoint(String jobId) {
        return store.latestCheckpoint(jobId);
    }

    public List<JobInfo> listJobs(boolean includeCompleted) {
        return store.listJobs(includeCompleted);
    }

    /**
     * 작업의 상태와 체크포인트 모두 삭제.
     *
     * @param jobId 작업 ID
     * @return 삭제된 데이터가 있었으면 true
     */
    public boolean deleteJob(String jobId) {
        boolean deleted = store.delete(jobId);
        log.info("Deleted state for job {} (existed: {})", jobId, deleted);
        return deleted;
    }
}
