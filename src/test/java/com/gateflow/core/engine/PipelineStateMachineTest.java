package com.gateflow.core.engine;

import com.gateflow.core.PipelineFixtures;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.persistence.DurableWrites;
import com.gateflow.core.persistence.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PipelineStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String KEY = "docsearch-login-pipeline";

    private StateStore store;
    private PipelineStateMachine stateMachine;
    private PipelineState started;

    @BeforeEach
    void setUp() {
        store = mock(StateStore.class);
        when(store.read(anyString(), eq(PipelineState.class))).thenReturn(Optional.empty());
        stateMachine = new PipelineStateMachine(new DurableWrites(store));
        started = PipelineState.started(PipelineFixtures.loginRequest(), T0);
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        void startWritesThrough() {
            stateMachine.start(started);
            verify(store).write(KEY, started);
        }

        @Test
        void gateCompletionIsWritten() {
            var next = started.withGateCompleted(Gate.TEST_CASE_DESIGN, T0.plusSeconds(1));

            assertEquals(next, stateMachine.transition(started, next));
            verify(store).write(KEY, next);
        }

        @Test
        @DisplayName("writing the same progress twice is a no-op")
        void unchangedStateSkipsWrite() {
            var sameButLater = started.withStatus(PipelineStatus.IN_PROGRESS, null, T0.plusSeconds(5));

            assertSame(started, stateMachine.transition(started, sameButLater));
            verify(store, never()).write(anyString(), any());
        }

        @Test
        @DisplayName("a state already stored by an earlier attempt is not rewritten")
        void alreadyStoredSkipsWrite() {
            var next = started.withGateCompleted(Gate.TEST_CASE_DESIGN, T0.plusSeconds(1));
            when(store.read(KEY, PipelineState.class)).thenReturn(Optional.of(next));

            stateMachine.transition(started, next);

            verify(store, never()).write(anyString(), any());
        }

        @Test
        void loadReadsTheStoredState() {
            when(store.read(KEY, PipelineState.class)).thenReturn(Optional.of(started));
            assertEquals(Optional.of(started), stateMachine.load("docsearch", "login"));
        }
    }

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        void gateCannotCompleteWithoutRequiredPredecessor() {
            var skipped = started.withGateCompleted(Gate.ELEMENT_MAPPING, T0);
            assertThrows(IllegalStateException.class, () -> stateMachine.transition(started, skipped));
        }

        @Test
        void completedGatesMustIncrease() {
            var state = new PipelineState(PipelineStatus.IN_PROGRESS, 2, List.of(2, 1), false, null, null,
                    started.request(), T0, T0);
            assertThrows(IllegalStateException.class, () -> PipelineStateMachine.checkInvariants(state));
        }

        @Test
        void optionalDataPreparationMayPrecedeDesign() {
            var state = new PipelineState(PipelineStatus.IN_PROGRESS, 1, List.of(0, 1), true, null, null,
                    started.request(), T0, T0);
            assertDoesNotThrow(() -> PipelineStateMachine.checkInvariants(state));
        }

        @Test
        void currentGateCannotMoveBack() {
            var atTwo = started.withGateCompleted(Gate.TEST_CASE_DESIGN, T0).withGateCompleted(Gate.ELEMENT_MAPPING, T0);
            var back = new PipelineState(PipelineStatus.IN_PROGRESS, 1, List.of(1, 2), false, null, null,
                    started.request(), T0, T0);
            assertThrows(IllegalStateException.class, () -> PipelineStateMachine.checkTransition(atTwo, back));
        }

        @Test
        void noGateCompletesAfterFailure() {
            var design = started.withGateCompleted(Gate.TEST_CASE_DESIGN, T0);
            var failed = design.withGateFailed(Gate.ELEMENT_MAPPING, "low confidence", T0);
            var after = new PipelineState(PipelineStatus.FAILED, 2, List.of(1, 2), false, 2, "low confidence",
                    started.request(), T0, T0);
            assertThrows(IllegalStateException.class, () -> PipelineStateMachine.checkTransition(failed, after));
        }

        @Test
        void terminalStatusIsFinal() {
            var done = started.withStatus(PipelineStatus.SUCCESS, null, T0);
            var reopened = done.withStatus(PipelineStatus.IN_PROGRESS, null, T0);
            assertThrows(IllegalStateException.class, () -> PipelineStateMachine.checkTransition(done, reopened));
        }

        @Test
        void completedGatesCannotBeRewritten() {
            var design = started.withGateCompleted(Gate.TEST_CASE_DESIGN, T0);
            var rewritten = new PipelineState(PipelineStatus.IN_PROGRESS, 1, List.of(0, 1), true, null, null,
                    started.request(), T0, T0);
            assertThrows(IllegalStateException.class, () -> PipelineStateMachine.checkTransition(design, rewritten));
        }
    }
}
