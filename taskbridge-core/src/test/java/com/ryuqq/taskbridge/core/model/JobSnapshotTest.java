package com.ryuqq.taskbridge.core.model;

import com.ryuqq.taskbridge.core.error.ErrorKind;
import com.ryuqq.taskbridge.core.outcome.Cancelled;
import com.ryuqq.taskbridge.core.outcome.Fail;
import com.ryuqq.taskbridge.core.outcome.Ok;
import com.ryuqq.taskbridge.core.statemachine.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobSnapshot 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class JobSnapshotTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(1);
    private static final Instant T2 = T0.plusSeconds(2);

    private JobSnapshot pending;

    @BeforeEach
    void setUp() {
        pending = JobSnapshot.pending(JobId.of("job-1"), JobKind.SEND_MESSAGE, SessionName.of("main"), T0);
    }

    @Test
    void pending_InitialValues() {
        assertEquals(JobState.PENDING, pending.state());
        assertEquals(0, pending.sequence());
        assertEquals(Progress.none(), pending.progress());
        assertNull(pending.startedAt());
        assertNull(pending.endedAt());
        assertNull(pending.outcome());
    }

    @Test
    void transitionTo_Running_SetsStartedAtAndIncrementsSequence() {
        // When
        JobSnapshot running = pending.transitionTo(JobState.RUNNING, T1);

        // Then
        assertEquals(JobState.RUNNING, running.state());
        assertEquals(T1, running.startedAt());
        assertEquals(1, running.sequence());
        // 원본은 변하지 않음
        assertEquals(JobState.PENDING, pending.state());
    }

    @Test
    void completed_CarriesResultAndEndedAt() {
        // When
        JobSnapshot done = pending.transitionTo(JobState.RUNNING, T1).completed("sent", T2);

        // Then
        assertEquals(JobState.COMPLETED, done.state());
        assertEquals("sent", done.result());
        assertNull(done.error());
        assertEquals(T2, done.endedAt());
        assertEquals(new Ok("sent"), done.outcome());
    }

    @Test
    void failed_CarriesErrorOnly() {
        // Given
        Fail fail = Fail.of(ErrorKind.FATAL_PROTOCOL, "banned");

        // When
        JobSnapshot failed = pending.transitionTo(JobState.RUNNING, T1).failed(fail, T2);

        // Then
        assertEquals(fail, failed.error());
        assertNull(failed.result());
        assertSame(fail, failed.outcome());
    }

    @Test
    void cancelled_FromPending_NeverStarted() {
        JobSnapshot cancelled = pending.cancelled(T1);

        assertEquals(JobState.CANCELLED, cancelled.state());
        assertNull(cancelled.startedAt());
        assertTrue(cancelled.outcome() instanceof Cancelled);
    }

    @Test
    void completed_FromCancelling_ThrowsException() {
        JobSnapshot cancelling = pending.transitionTo(JobState.RUNNING, T1).transitionTo(JobState.CANCELLING, T1);

        assertThrows(IllegalStateException.class, () -> cancelling.completed("late", T2));
    }

    @Test
    void transitionTo_TerminalState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> pending.transitionTo(JobState.COMPLETED, T1));
    }

    @Test
    void withProgress_Backwards_ThrowsException() {
        // Given
        JobSnapshot running = pending.transitionTo(JobState.RUNNING, T1).withProgress(new Progress(3, 10));

        // When & Then
        assertThrows(IllegalStateException.class, () -> running.withProgress(new Progress(2, 10)));
        assertEquals(3, running.withProgress(new Progress(3, 10)).progress().completed());
    }

    @Test
    void withProgress_OnTerminal_ThrowsException() {
        JobSnapshot cancelled = pending.cancelled(T1);

        assertThrows(IllegalStateException.class, () -> cancelled.withProgress(new Progress(1, 1)));
    }

    @Test
    void constructor_ResultOutsideCompleted_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new JobSnapshot(
            JobId.of("job-2"), JobKind.SEND_MESSAGE, SessionName.of("main"), JobState.RUNNING,
            Progress.none(), "value", null, T0, T0, null, 1));
    }

    @Test
    void jobFilter_MatchesKindAndState() {
        assertTrue(JobFilter.all().matches(pending));
        assertTrue(JobFilter.byKind(JobKind.SEND_MESSAGE).matches(pending));
        assertFalse(JobFilter.byKind(JobKind.BULK_SEND).matches(pending));
        assertFalse(new JobFilter(JobKind.SEND_MESSAGE, JobState.RUNNING).matches(pending));
    }
}
