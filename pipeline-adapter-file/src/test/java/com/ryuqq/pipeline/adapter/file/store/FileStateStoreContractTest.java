package com.ryuqq.pipeline.adapter.file.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.spi.CheckpointSummary;
import com.ryuqq.pipeline.core.spi.JobInfo;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.spi.StateStoreException;
import com.ryuqq.pipeline.core.state.ErrorRecord;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.core.state.QueueItem;
import com.ryuqq.pipeline.testkit.contract.AbstractStateStoreContractTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests for {@link FileStateStore}.
 *
 * <p>Runs the shared {@link AbstractStateStoreContractTest} scenarios against a temporary
 * directory plus checks on the on-disk layout and format.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class FileStateStoreContractTest extends AbstractStateStoreContractTest {

    @TempDir
    Path directory;

    @Override
    protected StateStore createStore() {
        return new FileStateStore(directory);
    }

    @Test
    void testSave_WritesSnakeCaseJsonWithIsoTimestamps() throws IOException {
        // Given
        PipelineState state = PipelineState.create("job-format", List.of("PMA"));
        state.addToQueue(QueueItem.of("https://pma.org", 10, "PMA", null));

        // When
        store.save(state);

        // Then
        Path file = directory.resolve("job-format.state.json");
        assertTrue(Files.exists(file));
        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals("job-format", json.get("job_id").asText());
        assertEquals("INIT", json.get("current_phase").asText());
        assertEquals(1, json.get("total_urls_discovered").asLong());
        assertEquals("https://pma.org", json.get("crawl_queue").get(0).get("url").asText());
        assertTrue(json.get("created_at").isTextual(), "Timestamps should be ISO-8601 strings");
        assertFalse(Files.exists(directory.resolve("job-format.state.json.tmp")), "Temp file should be moved");
    }

    @Test
    void testSaveLoad_PreservesErrorsQueueDetailsAndNestedRecords() {
        // Given
        PipelineState state = PipelineState.create("job-details", List.of("PMA"));
        state.addToQueue(new QueueItem("https://pma.org/members/acme", 5, 1, "https://pma.org/members",
            "PMA", "MEMBER_DETAIL", null, null, null));
        state.addCompany(Map.of(
            "company_name", "Acme Stamping",
            "contacts", List.of(Map.of("name", "Jane Doe", "email", "jane@acme.com"))));
        state.addError(new ErrorRecord(PipelinePhase.INIT, "extraction.html_parser", "TimeoutException",
            "Timeout after 300s", "https://pma.org/members/acme", Map.of("task_index", 0), null));

        // When
        store.save(state);
        PipelineState loaded = store.load("job-details").orElseThrow();

        // Then
        QueueItem item = loaded.getCrawlQueue().get(0);
        assertEquals("MEMBER_DETAIL", item.pageTypeHint());
        assertEquals("https://pma.org/members", item.sourceUrl());
        assertEquals(1, item.depth());

        ErrorRecord error = loaded.getErrors().get(0);
        assertEquals(PipelinePhase.INIT, error.phase());
        assertEquals("extraction.html_parser", error.agent());
        assertEquals("https://pma.org/members/acme", error.url());
        assertNotNull(error.occurredAt());

        Object contacts = loaded.getCompanies().get(0).get("contacts");
        assertInstanceOf(List.class, contacts);
        assertEquals("jane@acme.com", ((Map<?, ?>) ((List<?>) contacts).get(0)).get("email"));
    }

    @Test
    void testWriteCheckpoint_OneFilePerPhase() {
        // Given
        PipelineState state = PipelineState.create("job-files", List.of("PMA"));
        state.transitionTo(PipelinePhase.GATEKEEPER);

        // When
        store.writeCheckpoint(CheckpointSummary.of(state));
        store.writeCheckpoint(CheckpointSummary.of(state));

        // Then
        assertTrue(Files.exists(directory.resolve("job-files.GATEKEEPER.checkpoint.json")));
        assertTrue(store.latestCheckpoint("job-files").isPresent());
    }

    @Test
    void testLatestCheckpoint_IgnoresOtherJobsSharingPrefix() {
        // Given
        PipelineState other = PipelineState.create("job.extra", List.of("PMA"));
        store.writeCheckpoint(CheckpointSummary.of(other));

        // When & Then
        assertTrue(store.latestCheckpoint("job").isEmpty());
    }

    @Test
    void testListJobs_SkipsCorruptStateFiles() throws IOException {
        // Given
        store.save(PipelineState.create("job-valid", List.of("PMA")));
        Files.writeString(directory.resolve("job-corrupt.state.json"), "{ not json");

        // When
        List<JobInfo> jobs = store.listJobs(true);

        // Then
        assertEquals(1, jobs.size());
        assertEquals("job-valid", jobs.get(0).jobId());
    }

    @Test
    void testLoad_CorruptStateFile_ThrowsStateStoreException() throws IOException {
        // Given
        Files.writeString(directory.resolve("job-corrupt.state.json"), "{ not json");

        // When & Then
        assertThrows(StateStoreException.class, () -> store.load("job-corrupt"));
    }

    @Test
    void testLoad_JobIdWithPathSeparator_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> store.load("../outside"));
    }

    @Test
    void testLoad_NewStoreInstanceOnSameDirectory_SeesSavedState() {
        // Given
        PipelineState state = PipelineState.create("job-restart", List.of("PMA"));
        state.transitionTo(PipelinePhase.GATEKEEPER);
        store.save(state);

        // When
        FileStateStore reopened = new FileStateStore(directory);

        // Then
        assertEquals(PipelinePhase.GATEKEEPER, reopened.load("job-restart").orElseThrow().getCurrentPhase());
    }
}
