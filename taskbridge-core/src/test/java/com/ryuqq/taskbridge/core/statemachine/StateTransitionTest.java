package com.ryuqq.taskbridge.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.taskbridge.core.statemachine.JobState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToRunning_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, RUNNING));
    }

    @Test
    void validate_PendingToCancelled_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, CANCELLED));
    }

    @Test
    void validate_RunningToEveryExit_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, COMPLETED));
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, FAILED));
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, CANCELLED));
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, CANCELLING));
    }

    @Test
    void transition_CancelFlow_EndsCancelled() {
        // Given
        JobState state = PENDING;

        // When
        state = StateTransition.transition(state, RUNNING);
        state = StateTransition.transition(state, CANCELLING);
        state = StateTransition.transition(state, CANCELLED);

        // Then
        assertEquals(CANCELLED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @ParameterizedTest
    @EnumSource(value = JobState.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void validate_FromTerminal_ThrowsException(JobState terminal) {
        for (JobState target : JobState.values()) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StateTransition.validate(terminal, target)
            );
            assertTrue(exception.getMessage().contains("terminal state"));
        }
    }

    @Test
    void validate_CancellingToCompleted_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(CANCELLING, COMPLETED)
        );
        assertTrue(exception.getMessage().contains("CANCELLING"));
        assertTrue(exception.getMessage().contains("COMPLETED"));
    }

    @Test
    void validate_CancellingToFailed_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(CANCELLING, FAILED));
    }

    @Test
    void validate_PendingToCancelling_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(PENDING, CANCELLING));
    }

    @Test
    void validate_PendingToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(PENDING, COMPLETED));
    }

    @Test
    void validate_RunningToPending_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(RUNNING, PENDING));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, RUNNING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(RUNNING, null));
    }

    @Test
    void isAllowed_DoesNotThrowForForbiddenEdges() {
        assertFalse(StateTransition.isAllowed(COMPLETED, CANCELLED));
        assertFalse(StateTransition.isAllowed(CANCELLING, RUNNING));
        assertTrue(StateTransition.isAllowed(CANCELLING, CANCELLED));
    }

    @Test
    void isActive_OnlyRunningAndCancelling() {
        assertTrue(RUNNING.isActive());
        assertTrue(CANCELLING.isActive());
        assertFalse(PENDING.isActive());
        assertFalse(COMPLETED.isActive());
    }
}
