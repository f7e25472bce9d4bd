package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.spi.CheckpointSummary;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.state.PipelineState;
import com.ryuqq.pipeline.testkit.contract.AbstractStateStoreContractTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests for {@link InMemoryStateStore}.
 *
 * <p>Runs the shared {@link AbstractStateStoreContractTest} scenarios plus
 * checks on the snapshot copies handed out by {@code load}.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class InMemoryStateStoreContractTest extends AbstractStateStoreContractTest {

    @Override
    protected StateStore createStore() {
        return new InMemoryStateStore();
    }

    @Test
    void testLoad_ReturnsIndependentCopies() {
        // Given
        store.save(PipelineState.create("job-copy", List.of("PMA")));

        // When
        PipelineState first = store.load("job-copy").orElseThrow();
        first.addToQueue("https://pma.org/a", 5);
        PipelineState second = store.load("job-copy").orElseThrow();

        // Then
        assertTrue(second.getCrawlQueue().isEmpty(), "Mutating a loaded state must not alter the store");
    }

    @Test
    void testCheckpointHistory_KeepsEveryCheckpoint() {
        // Given
        InMemoryStateStore inMemory = (InMemoryStateStore) store;
        PipelineState state = PipelineState.create("job-history", List.of("PMA"));

        // When
        inMemory.writeCheckpoint(CheckpointSummary.of(state));
        inMemory.writeCheckpoint(CheckpointSummary.of(state));

        // Then
        assertEquals(2, inMemory.checkpointHistory("job-history").size());
        inMemory.clear();
        assertTrue(inMemory.checkpointHistory("job-history").isEmpty());
    }
}
