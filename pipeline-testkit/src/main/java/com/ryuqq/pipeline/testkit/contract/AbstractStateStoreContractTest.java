package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.spi.CheckpointSummary;
import com.ryuqq.pipeline.core.spi.JobInfo;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.state.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract contract test for {@link StateStore} implementations.
 *
 * <p>Every adapter extends this class and supplies a fresh store through
 * {@link #createStore()}. The scenarios cover what the orchestrator relies on
 * when it checkpoints and resumes a job.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Resume: a saved state loads back with phase, queue, visited URLs and buckets intact</li>
 *   <li>Overwrite: saving the same job twice keeps a single latest snapshot</li>
 *   <li>Checkpoints: the most recent phase checkpoint is returned</li>
 *   <li>Listing: newest first, completed jobs excluded unless requested</li>
 *   <li>Deletion: state and checkpoints are removed together</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryStateStoreContractTest extends AbstractStateStoreContractTest {
 *     {@literal @}Override
 *     protected StateStore createStore() {
 *         return new InMemoryStateStore();
 *     }
 * }
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public abstract class AbstractStateStoreContractTest {

    protected StateStore store;

    /**
     * Creates the store under test. Called before each test.
     *
     * @return an empty store
     */
    protected abstract StateStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    // ============================================================
    // Resume
    // ============================================================

    @Test
    void testSaveAndLoad_ExtractionPhase_ResumesWithQueueAndVisited() {
        // Given
        PipelineState state = PipelineState.create("job-resume", List.of("PMA", "NEMA"));
        advanceTo(state, PipelinePhase.EXTRACTION);
        for (int i = 1; i <= 5; i++) {
            state.addToQueue("https://pma.org/members/" + i, 5);
        }
        state.markVisited("https://pma.org/members/1");
        state.markVisited("https://pma.org/members/2");
        state.addCompany(Map.of("company_name", "Acme Corp", "website", "https://acme.com"));

        // When
        store.save(state);
        Optional<PipelineState> loaded = store.load("job-resume");

        // Then
        assertTrue(loaded.isPresent(), "Saved state should be loadable");
        PipelineState resumed = loaded.get();
        assertEquals(PipelinePhase.EXTRACTION, resumed.getCurrentPhase());
        assertEquals(List.of("PMA", "NEMA"), resumed.getAssociationCodes());
        assertEquals(3, resumed.getCrawlQueue().size(), "Queue should hold the unvisited URLs");
        assertEquals(2, resumed.getVisitedUrls().size());
        assertTrue(resumed.getVisitedUrls().contains("https://pma.org/members/1"));
        assertEquals(1, resumed.getCompanies().size());
        assertEquals("Acme Corp", resumed.getCompanies().get(0).get("company_name"));
        assertEquals(4, resumed.getPhaseHistory().size(), "History should cover INIT through CLASSIFICATION");
        assertEquals(5, resumed.getTotalUrlsDiscovered());
        assertEquals(2, resumed.getTotalPagesFetched());
    }

    @Test
    void testLoad_UnknownJob_ReturnsEmpty() {
        // When
        Optional<PipelineState> loaded = store.load("missing-job");

        // Then
        assertTrue(loaded.isEmpty());
    }

    @Test
    void testSave_LaterMutationOfSavedState_DoesNotChangeSnapshot() {
        // Given
        PipelineState state = PipelineState.create("job-snapshot", List.of("PMA"));
        state.addToQueue("https://pma.org/a", 5);
        store.save(state);

        // When
        state.markVisited("https://pma.org/a");

        // Then
        PipelineState loaded = store.load("job-snapshot").orElseThrow();
        assertEquals(1, loaded.getCrawlQueue().size(), "Snapshot should reflect the state at save time");
        assertTrue(loaded.getVisitedUrls().isEmpty());
    }

    // ============================================================
    // Overwrite
    // ============================================================

    @Test
    void testSave_SameJobTwice_OverwritesWithoutDuplicates() {
        // Given
        PipelineState state = PipelineState.create("job-overwrite", List.of("PMA"));
        store.save(state);

        // When
        state.transitionTo(PipelinePhase.GATEKEEPER);
        state.addToQueue("https://pma.org/directory", 10);
        store.save(state);

        // Then
        PipelineState loaded = store.load("job-overwrite").orElseThrow();
        assertEquals(PipelinePhase.GATEKEEPER, loaded.getCurrentPhase());
        assertEquals(1, loaded.getCrawlQueue().size());
        long listed = store.listJobs(true).stream()
            .filter(job -> job.jobId().equals("job-overwrite"))
            .count();
        assertEquals(1, listed, "A job should be listed once regardless of save count");
    }

    // ============================================================
    // Checkpoints
    // ============================================================

    @Test
    void testLatestCheckpoint_MultiplePhases_ReturnsMostRecent() {
        // Given
        PipelineState state = PipelineState.create("job-checkpoint", List.of("PMA"));
        state.transitionTo(PipelinePhase.GATEKEEPER);
        Instant first = Instant.parse("2024-03-01T10:00:00Z");
        store.writeCheckpoint(new CheckpointSummary("job-checkpoint", PipelinePhase.GATEKEEPER, first, state.summary()));

        state.transitionTo(PipelinePhase.DISCOVERY);
        state.addToQueue("https://pma.org/members/1", 5);
        Instant second = first.plusSeconds(60);
        store.writeCheckpoint(new CheckpointSummary("job-checkpoint", PipelinePhase.DISCOVERY, second, state.summary()));

        // When
        Optional<CheckpointSummary> latest = store.latestCheckpoint("job-checkpoint");

        // Then
        assertTrue(latest.isPresent());
        assertEquals(PipelinePhase.DISCOVERY, latest.get().phase());
        assertEquals(second, latest.get().timestamp());
        assertEquals(1, latest.get().summary().queueSize());
        assertEquals("job-checkpoint", latest.get().summary().jobId());
    }

    @Test
    void testLatestCheckpoint_NoCheckpoints_ReturnsEmpty() {
        // When
        Optional<CheckpointSummary> latest = store.latestCheckpoint("job-without-checkpoints");

        // Then
        assertTrue(latest.isEmpty());
    }

    // ============================================================
    // Listing
    // ============================================================

    @Test
    void testListJobs_NewestFirst_CompletedExcludedByDefault() {
        // Given
        PipelineState older = PipelineState.create("job-older", List.of("PMA"));
        store.save(older);
        sleep(5);

        PipelineState completed = PipelineState.create("job-completed", List.of("NEMA"));
        advanceTo(completed, PipelinePhase.EXPORT);
        completed.transitionTo(PipelinePhase.DONE);
        store.save(completed);
        sleep(5);

        PipelineState newer = PipelineState.create("job-newer", List.of("SOCMA"));
        store.save(newer);

        // When
        List<JobInfo> active = store.listJobs(false);
        List<JobInfo> all = store.listJobs(true);

        // Then
        assertEquals(List.of("job-newer", "job-older"), jobIds(active));
        assertEquals(List.of("job-newer", "job-completed", "job-older"), jobIds(all));
        JobInfo completedInfo = all.get(1);
        assertTrue(completedInfo.completed());
        assertEquals(PipelinePhase.DONE, completedInfo.currentPhase());
        assertEquals(List.of("NEMA"), completedInfo.associationCodes());
    }

    @Test
    void testListJobs_EmptyStore_ReturnsEmptyList() {
        // When
        List<JobInfo> jobs = store.listJobs(true);

        // Then
        assertTrue(jobs.isEmpty());
    }

    // ============================================================
    // Deletion
    // ============================================================

    @Test
    void testDelete_ExistingJob_RemovesStateAndCheckpoints() {
        // Given
        PipelineState state = PipelineState.create("job-delete", List.of("PMA"));
        store.save(state);
        store.writeCheckpoint(CheckpointSummary.of(state));

        // When
        boolean deleted = store.delete("job-delete");

        // Then
        assertTrue(deleted);
        assertTrue(store.load("job-delete").isEmpty());
        assertTrue(store.latestCheckpoint("job-delete").isEmpty());
        assertTrue(store.listJobs(true).isEmpty());
    }

    @Test
    void testDelete_UnknownJob_ReturnsFalse() {
        // When
        boolean deleted = store.delete("missing-job");

        // Then
        assertFalse(deleted);
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * Walks the state forward along the linear phase order up to {@code target}.
     *
     * @param state the state to advance
     * @param target the phase to stop at
     */
    protected static void advanceTo(PipelineState state, PipelinePhase target) {
        while (state.getCurrentPhase() != target) {
            PipelinePhase next = state.getCurrentPhase().next()
                .orElseThrow(() -> new IllegalStateException("Cannot reach " + target));
            assertTrue(state.transitionTo(next), "Transition to " + next + " should be allowed");
        }
    }

    /**
     * Sleeps for the specified duration so consecutive saves get distinct timestamps.
     *
     * @param millis milliseconds to sleep
     */
    protected static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }

    private static List<String> jobIds(List<JobInfo> jobs) {
        return jobs.stream().map(JobInfo::jobId).toList();
    }
}
