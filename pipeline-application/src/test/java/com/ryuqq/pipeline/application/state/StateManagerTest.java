package com.ryuqq.pipeline.application.state;

import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.spi.CheckpointSummary;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.state.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StateManagerTest {

    @Mock
    private StateStore store;

    private StateManager stateManager;

    @BeforeEach
    void setUp() {
        stateManager = new StateManager(store);
    }

    @Test
    void createState는_INIT_상태를_만들고_저장() {
        // when
        PipelineState state = stateManager.createState(List.of("PMA"), "job-1");

        // then
        assertThat(state.getJobId()).isEqualTo("job-1");
        assertThat(state.getCurrentPhase()).isEqualTo(PipelinePhase.INIT);
        verify(store).save(state);
    }

    @Test
    void 허용된_전이는_상태를_저장하고_체크포인트를_남김() {
        // given
        PipelineState state = PipelineState.create("job-2", List.of("PMA"));

        // when
        boolean transitioned = stateManager.transitionPhase(state, PipelinePhase.GATEKEEPER);

        // then
        assertThat(transitioned).isTrue();
        verify(store).save(state);
        ArgumentCaptor<CheckpointSummary> checkpoint = ArgumentCaptor.forClass(CheckpointSummary.class);
        verify(store).writeCheckpoint(checkpoint.capture());
        assertThat(checkpoint.getValue().jobId()).isEqualTo("job-2");
        assertThat(checkpoint.getValue().phase()).isEqualTo(PipelinePhase.GATEKEEPER);
        assertThat(checkpoint.getValue().summary().currentPhase()).isEqualTo(PipelinePhase.GATEKEEPER);
    }

    @Test
    void 허용되지_않은_전이는_체크포인트_없이_false() {
        // given
        PipelineState state = PipelineState.create("job-3", List.of("PMA"));

        // when
        boolean transitioned = stateManager.transitionPhase(state, PipelinePhase.EXTRACTION);

        // then
        assertThat(transitioned).isFalse();
        assertThat(state.getCurrentPhase()).isEqualTo(PipelinePhase.INIT);
        verify(store, never()).save(any());
        verify(store, never()).writeCheckpoint(any());
    }

    @Test
    void 저장된_상태가_없으면_load는_empty() {
        // given
        when(store.load("missing")).thenReturn(Optional.empty());

        // when & then
        assertThat(stateManager.load("missing")).isEmpty();
    }

    @Test
    void deleteJob은_저장소_결과를_그대로_반환() {
        // given
        when(store.delete("job-4")).thenReturn(true);

        // when & then
        assertThat(stateManager.deleteJob("job-4")).isTrue();
    }

    @Test
    void 저장소가_null이면_예외() {
        assertThatThrownBy(() -> new StateManager(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("store cannot be null");
    }
}
