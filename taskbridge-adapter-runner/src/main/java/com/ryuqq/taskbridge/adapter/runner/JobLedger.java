package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.error.InvariantViolationException;
import com.ryuqq.taskbridge.core.model.JobEvent;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.Progress;
import com.ryuqq.taskbridge.core.outcome.Cancelled;
import com.ryuqq.taskbridge.core.outcome.Fail;
import com.ryuqq.taskbridge.core.outcome.Ok;
import com.ryuqq.taskbridge.core.outcome.Outcome;
import com.ryuqq.taskbridge.core.spi.JobListener;
import com.ryuqq.taskbridge.core.spi.JobRegistry;
import com.ryuqq.taskbridge.core.statemachine.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

/**
 * Job 상태 변경의 단일 기록 지점.
 *
 * <p>모든 상태 변경은 이 클래스를 거쳐 {@link JobRegistry}에 기록되고,
 * 기록과 같은 임계 구역 안에서 이벤트가 발행되므로 이벤트 순서는 기록 순서와 같습니다.
 * 종료 상태에 도달하면 대기 중인 {@link #awaitTerminal} 호출이 깨어납니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>종료 상태의 Job은 다시 바뀌지 않습니다 (finish, requestCancel은 no-op).</li>
 *   <li>CANCELLING 상태에서 작업이 끝나면 결과와 무관하게 CANCELLED로 기록합니다.</li>
 * </ul>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class JobLedger {

    private static final Logger log = LoggerFactory.getLogger(JobLedger.class);

    private final JobRegistry registry;
    private final EventDispatcher events;
    private final Clock clock;
    private final ConcurrentHashMap<JobId, CompletableFuture<JobSnapshot>> terminals;
    private final Object lock = new Object();

    public JobLedger(JobRegistry registry, Clock clock) {
        this(registry, new EventDispatcher(), clock);
    }

    public JobLedger(JobRegistry registry, EventDispatcher events, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.events = events;
        this.clock = clock;
        this.terminals = new ConcurrentHashMap<>();
    }

    /**
     * PENDING Job 등록.
     *
     * @param pending PENDING 스냅샷
     * @return 등록된 스냅샷
     * @throws IllegalArgumentException PENDING이 아닌 경우
     * @throws InvariantViolationException 이미 사용된 id인 경우
     */
    public JobSnapshot open(JobSnapshot pending) {
        if (pending == null) {
            throw new IllegalArgumentException("pending cannot be null");
        }
        if (pending.state() != JobState.PENDING) {
            throw new IllegalArgumentException("Only PENDING jobs can be opened (state: " + pending.state() + ")");
        }
        synchronized (lock) {
            registry.register(pending);
            terminals.put(pending.id(), new CompletableFuture<>());
            events.publish(new JobEvent(null, pending));
        }
        return pending;
    }

    /**
     * PENDING → RUNNING 전이.
     *
     * @param id Job ID
     * @return RUNNING 스냅샷, 이미 취소되었거나 삭제되어 시작할 수 없으면 null
     */
    public JobSnapshot tryStart(JobId id) {
        synchronized (lock) {
            if (!registry.contains(id)) {
                return null;
            }
            JobSnapshot current = registry.get(id);
            if (current.state() != JobState.PENDING) {
                return null;
            }
            return apply(current, snapshot -> snapshot.transitionTo(JobState.RUNNING, clock.instant()));
        }
    }

    /**
     * 취소 요청 기록.
     *
     * <p>PENDING은 즉시 CANCELLED, RUNNING은 CANCELLING으로 바뀝니다. 그 외 상태는 그대로입니다.</p>
     *
     * @param id Job ID
     * @return 요청 처리 후 상태
     */
    public JobState requestCancel(JobId id) {
        synchronized (lock) {
            JobSnapshot current = registry.get(id);
            switch (current.state()) {
                case PENDING:
                    return apply(current, snapshot -> snapshot.cancelled(clock.instant())).state();
                case RUNNING:
                    return apply(current, snapshot -> snapshot.transitionTo(JobState.CANCELLING, clock.instant())).state();
                default:
                    return current.state();
            }
        }
    }

    /**
     * 진행률 기록. 종료된 Job에 대한 보고는 무시합니다.
     *
     * @param id Job ID
     * @param progress 새 진행률
     * @throws IllegalStateException 진행률이 뒤로 가는 경우
     */
    public void progress(JobId id, Progress progress) {
        synchronized (lock) {
            JobSnapshot current = registry.get(id);
            if (current.isTerminal()) {
                log.debug("Ignoring progress {} for terminal job {}", progress, id);
                return;
            }
            apply(current, snapshot -> snapshot.withProgress(progress));
        }
    }

    /**
     * 작업 결과 기록.
     *
     * @param id Job ID
     * @param outcome 작업 결과
     * @return 최종 스냅샷 (이미 종료되어 있었다면 기존 스냅샷)
     */
    public JobSnapshot finish(JobId id, Outcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        synchronized (lock) {
            JobSnapshot current = registry.get(id);
            if (current.isTerminal()) {
                log.debug("Job {} already {}, discarding outcome {}", id, current.state(), outcome);
                return current;
            }
            if (current.state() == JobState.CANCELLING || outcome instanceof Cancelled) {
                return apply(current, snapshot -> snapshot.cancelled(clock.instant()));
            }
            if (outcome instanceof Ok) {
                Object value = ((Ok) outcome).value();
                return apply(current, snapshot -> snapshot.completed(value, clock.instant()));
            }
            Fail failure = (Fail) outcome;
            return apply(current, snapshot -> snapshot.failed(failure, clock.instant()));
        }
    }

    /**
     * 종료되지 않은 Job을 즉시 CANCELLED로 기록 (drain 유예 초과 시).
     *
     * @param id Job ID
     * @return 상태가 바뀌었으면 true
     */
    public boolean forceCancel(JobId id) {
        synchronized (lock) {
            if (!registry.contains(id)) {
                return false;
            }
            JobSnapshot current = registry.get(id);
            if (current.isTerminal()) {
                return false;
            }
            apply(current, snapshot -> snapshot.cancelled(clock.instant()));
            return true;
        }
    }

    /**
     * 시작 대기 중인지 확인.
     *
     * <p>시작 전에 취소된 뒤 삭제된 Job은 기록이 없으므로 false입니다.</p>
     *
     * @param id Job ID
     * @return PENDING이면 true
     */
    public boolean isPending(JobId id) {
        synchronized (lock) {
            return registry.contains(id) && registry.get(id).state() == JobState.PENDING;
        }
    }

    public JobSnapshot get(JobId id) {
        return registry.get(id);
    }

    public List<JobSnapshot> list(JobFilter filter) {
        return registry.list(filter);
    }

    /**
     * 종료 상태까지 대기.
     *
     * @param id Job ID
     * @param timeout 최대 대기 시간
     * @return 종료 스냅샷
     * @throws TimeoutException 시간 내에 종료되지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public JobSnapshot awaitTerminal(JobId id, Duration timeout) throws TimeoutException, InterruptedException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        JobSnapshot current = registry.get(id);
        if (current.isTerminal()) {
            return current;
        }
        CompletableFuture<JobSnapshot> terminal = terminals.get(id);
        if (terminal == null) {
            return registry.get(id);
        }
        try {
            return terminal.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new InvariantViolationException("Terminal future of job " + id + " failed", e.getCause());
        }
    }

    /**
     * 종료된 Job 삭제.
     *
     * @param id Job ID
     * @return 삭제했으면 true
     * @throws IllegalStateException 종료되지 않은 Job인 경우
     */
    public boolean purge(JobId id) {
        synchronized (lock) {
            boolean removed = registry.purge(id);
            if (removed) {
                terminals.remove(id);
            }
            return removed;
        }
    }

    /**
     * 종료된 모든 Job 삭제.
     *
     * @return 삭제한 개수
     */
    public int purgeTerminal() {
        int removed = 0;
        for (JobSnapshot snapshot : registry.list(JobFilter.all())) {
            if (snapshot.isTerminal() && purge(snapshot.id())) {
                removed++;
            }
        }
        return removed;
    }

    public void addListener(JobListener listener) {
        events.addListener(listener);
    }

    public void removeListener(JobListener listener) {
        events.removeListener(listener);
    }

    /**
     * 이벤트 전달 종료.
     *
     * @param timeoutMs 대기 중인 이벤트 전달 최대 대기 시간
     */
    public void close(long timeoutMs) {
        events.shutdown(timeoutMs);
    }

    private JobSnapshot apply(JobSnapshot current, UnaryOperator<JobSnapshot> change) {
        JobSnapshot next = registry.update(current.id(), change);
        events.publish(new JobEvent(current.state(), next));
        if (next.isTerminal()) {
            CompletableFuture<JobSnapshot> terminal = terminals.remove(next.id());
            if (terminal != null) {
                terminal.complete(next);
            }
        }
        return next;
    }
}
