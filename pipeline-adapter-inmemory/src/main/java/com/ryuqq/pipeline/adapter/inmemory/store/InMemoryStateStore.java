package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.spi.CheckpointSummary;
import com.ryuqq.pipeline.core.spi.JobInfo;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link StateStore} SPI for testing and dry runs.
 *
 * <p>States are kept as snapshot copies ({@link PipelineState#copy()}), so later
 * mutation of a saved state does not leak into the store, and every load hands out
 * an independent copy.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>states:</strong> ConcurrentHashMap&lt;String, PipelineState&gt; - latest snapshot per job</li>
 *   <li><strong>checkpoints:</strong> ConcurrentHashMap&lt;String, List&lt;CheckpointSummary&gt;&gt; - append-only history per job</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final ConcurrentHashMap<String, PipelineState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<CheckpointSummary>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(PipelineState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        states.put(state.getJobId(), state.copy());
        log.debug("Saved state for job {} at phase {}", state.getJobId(), state.getCurrentPhase());
    }

    @Override
    public Optional<PipelineState> load(String jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        PipelineState state = states.get(jobId);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    @Override
    public void writeCheckpoint(CheckpointSummary checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        checkpoints.computeIfAbsent(checkpoint.jobId(), key -> new CopyOnWriteArrayList<>()).add(checkpoint);
    }

    @Override
    public Optional<CheckpointSummary> latestCheckpoint(String jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        List<CheckpointSummary> history = checkpoints.getOrDefault(jobId, List.of());
        return history.stream().max(Comparator.comparing(CheckpointSummary::timestamp));
    }

    @Override
    public List<JobInfo> listJobs(boolean includeCompleted) {
        List<JobInfo> jobs = new ArrayList<>();
        for (PipelineState state : states.values()) {
            JobInfo info = JobInfo.from(state);
            if (includeCompleted || !info.completed()) {
                jobs.add(info);
            }
        }
        jobs.sort(Comparator.comparing(JobInfo::updatedAt).reversed());
        return jobs;
    }

    @Override
    public boolean delete(String jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        boolean removed = states.remove(jobId) != null;
        removed |= checkpoints.remove(jobId) != null;
        return removed;
    }

    /**
     * Clears all stored data (for testing).
     */
    public void clear() {
        states.clear();
        checkpoints.clear();
    }

    /**
     * Returns the full checkpoint history for a job, oldest first (for testing).
     *
     * @param jobId the job ID
     * @return checkpoint history
     */
    public List<CheckpointSummary> checkpointHistory(String jobId) {
        return List.copyOf(checkpoints.getOrDefault(jobId, List.of()));
    }
}
