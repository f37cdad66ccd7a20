package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.application.bridge.TaskBridge;
import com.ryuqq.taskbridge.core.model.JobEvent;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.statemachine.JobState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RetentionSweeper 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private TaskBridge bridge;

    @Test
    void 최대_개수를_넘으면_먼저_끝난_Job부터_삭제() {
        JobSnapshot oldest = finished(NOW.minusSeconds(30));
        JobSnapshot middle = finished(NOW.minusSeconds(20));
        JobSnapshot newest = finished(NOW.minusSeconds(10));
        JobSnapshot running = running();
        when(bridge.list(JobFilter.all())).thenReturn(List.of(newest, running, oldest, middle));
        when(bridge.purge(oldest.id())).thenReturn(true);

        int removed = new RetentionSweeper(bridge, new RetentionPolicy(2, 0), CLOCK).sweep();

        assertThat(removed).isEqualTo(1);
        verify(bridge).purge(oldest.id());
        verify(bridge, never()).purge(running.id());
    }

    @Test
    void 보존_기간이_지난_Job_삭제() {
        JobSnapshot expired = finished(NOW.minusSeconds(120));
        JobSnapshot fresh = finished(NOW.minusSeconds(5));
        when(bridge.list(JobFilter.all())).thenReturn(List.of(expired, fresh));
        when(bridge.purge(expired.id())).thenReturn(true);

        int removed = new RetentionSweeper(bridge, new RetentionPolicy(0, 60_000), CLOCK).sweep();

        assertThat(removed).isEqualTo(1);
        verify(bridge, never()).purge(fresh.id());
    }

    @Test
    void 종료_전이_이벤트에서만_정리() {
        RetentionSweeper sweeper = new RetentionSweeper(bridge, new RetentionPolicy(1, 0), CLOCK);
        JobSnapshot pending = JobSnapshot.pending(JobId.generate(), JobKind.SEND_MESSAGE, SessionName.of("main"), NOW);

        sweeper.onEvent(new JobEvent(null, pending));

        verify(bridge, never()).list(any());
    }

    @Test
    void 비활성_정책은_아무것도_하지_않음() {
        assertThat(new RetentionSweeper(bridge, RetentionPolicy.keepAll(), CLOCK).sweep()).isZero();
        verify(bridge, never()).list(any());
    }

    private static JobSnapshot running() {
        return JobSnapshot.pending(JobId.generate(), JobKind.SEND_MESSAGE, SessionName.of("main"), NOW.minusSeconds(60))
            .transitionTo(JobState.RUNNING, NOW.minusSeconds(60));
    }

    private static JobSnapshot finished(Instant endedAt) {
        return running().completed(null, endedAt);
    }
}
