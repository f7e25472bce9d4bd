package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.state.PipelineState;

import java.util.List;
import java.util.Optional;

/**
 * Persistent Storage SPI for pipeline run state and phase checkpoints.
 *
 * <p>One full-state document is kept per job id and overwritten on every save.
 * Checkpoint summaries are written separately and retained per phase for observability.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Overwrite, never append: {@link #save(PipelineState)} replaces the latest snapshot</li>
 *   <li>Lossless: a loaded state carries every bucket, counter and timestamp that was saved</li>
 *   <li>Idempotent: saving the same state twice leaves one equivalent snapshot</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Persists the full state, replacing any previous snapshot for its job id.
     *
     * @param state the state to persist
     * @throws IllegalArgumentException if state is null
     * @throws StateStoreException if the underlying storage fails
     */
    void save(PipelineState state);

    /**
     * Loads the latest snapshot for a job.
     *
     * @param jobId the job id
     * @return the state, or empty if the job does not exist
     * @throws IllegalArgumentException if jobId is null or blank
     * @throws StateStoreException if the snapshot exists but cannot be read
     */
    Optional<PipelineState> load(String jobId);

    /**
     * Writes a phase-scoped checkpoint summary.
     *
     * @param checkpoint the checkpoint summary
     * @throws IllegalArgumentException if checkpoint is null
     * @throws StateStoreException if the underlying storage fails
     */
    void writeCheckpoint(CheckpointSummary checkpoint);

    /**
     * Returns the most recent checkpoint summary of a job.
     *
     * @param jobId the job id
     * @return the latest checkpoint, or empty if none was written
     */
    Optional<CheckpointSummary> latestCheckpoint(String jobId);

    /**
     * Lists persisted jobs, most recently updated first.
     *
     * <p>Unreadable snapshots are skipped.</p>
     *
     * @param includeCompleted whether jobs with a completion time are included
     * @return job descriptors sorted by {@code updatedAt} descending
     */
    List<JobInfo> listJobs(boolean includeCompleted);

    /**
     * Deletes the snapshot and every checkpoint of a job.
     *
     * @param jobId the job id
     * @return true if a snapshot existed and was deleted
     */
    boolean delete(String jobId);
}
