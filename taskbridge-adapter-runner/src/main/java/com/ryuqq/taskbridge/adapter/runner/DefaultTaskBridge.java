package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.application.bridge.JobHandle;
import com.ryuqq.taskbridge.application.bridge.TaskBridge;
import com.ryuqq.taskbridge.application.runtime.WorkerRuntime;
import com.ryuqq.taskbridge.core.error.JobCancelledException;
import com.ryuqq.taskbridge.core.error.JobFailedException;
import com.ryuqq.taskbridge.core.executor.WorkUnit;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.spi.JobListener;
import com.ryuqq.taskbridge.core.statemachine.JobState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * TaskBridge 기본 구현체.
 *
 * <p>dispatch는 새 JobId로 PENDING 스냅샷을 만들어 {@link WorkerRuntime}에 제출하고 즉시 반환합니다.
 * 조회와 대기는 {@link JobLedger}를 통합니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class DefaultTaskBridge implements TaskBridge {

    private final WorkerRuntime runtime;
    private final JobLedger ledger;
    private final Clock clock;

    public DefaultTaskBridge(WorkerRuntime runtime, JobLedger ledger, Clock clock) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.runtime = runtime;
        this.ledger = ledger;
        this.clock = clock;
    }

    @Override
    public <T> JobHandle<T> dispatch(JobKind kind, SessionName session, WorkUnit<T> work) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        Instant now = clock.instant();
        JobSnapshot pending = JobSnapshot.pending(JobId.generate(), kind, session, now);
        runtime.submit(pending, work);
        return JobHandle.of(pending.id(), kind, session, now);
    }

    @Override
    public JobSnapshot poll(JobHandle<?> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        return poll(handle.getJobId());
    }

    @Override
    public JobSnapshot poll(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return ledger.get(id);
    }

    @Override
    public <T> T awaitResult(JobHandle<T> handle, Duration timeout) throws TimeoutException, InterruptedException {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        JobSnapshot terminal = awaitTerminal(handle.getJobId(), timeout);
        if (terminal.state() == JobState.FAILED) {
            throw new JobFailedException(terminal.id(), terminal.error());
        }
        if (terminal.state() == JobState.CANCELLED) {
            throw new JobCancelledException(terminal.id());
        }
        return handle.resultOf(terminal.result());
    }

    @Override
    public JobSnapshot awaitTerminal(JobId id, Duration timeout) throws TimeoutException, InterruptedException {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return ledger.awaitTerminal(id, timeout);
    }

    @Override
    public JobState cancel(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return runtime.requestCancel(id);
    }

    @Override
    public List<JobSnapshot> list(JobFilter filter) {
        return ledger.list(filter == null ? JobFilter.all() : filter);
    }

    @Override
    public boolean purge(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return ledger.purge(id);
    }

    @Override
    public int purgeTerminal() {
        return ledger.purgeTerminal();
    }

    @Override
    public void addListener(JobListener listener) {
        ledger.addListener(listener);
    }

    @Override
    public void removeListener(JobListener listener) {
        ledger.removeListener(listener);
    }
}
