package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.application.runtime.WorkerRuntime;
import com.ryuqq.taskbridge.core.error.ErrorKind;
import com.ryuqq.taskbridge.core.error.JobCancelledException;
import com.ryuqq.taskbridge.core.error.JobNotFoundException;
import com.ryuqq.taskbridge.core.error.TaskBridgeException;
import com.ryuqq.taskbridge.core.executor.WorkUnit;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.outcome.Cancelled;
import com.ryuqq.taskbridge.core.outcome.Fail;
import com.ryuqq.taskbridge.core.outcome.Ok;
import com.ryuqq.taskbridge.core.outcome.Outcome;
import com.ryuqq.taskbridge.core.protection.RateLimiter;
import com.ryuqq.taskbridge.core.statemachine.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 전용 스레드 기반 WorkerRuntime 구현체.
 *
 * <p><strong>구조:</strong></p>
 * <ul>
 *   <li>intake 스레드({@code taskbridge-intake}): 제출 큐에서 Job을 꺼내 워커 풀에 넘깁니다.</li>
 *   <li>워커 풀({@code taskbridge-worker-N}): Job을 실행합니다. concurrency가 0이면 무제한입니다.</li>
 * </ul>
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>세션 상태 변경 Job은 {@link SessionGate}로 세션당 하나씩 실행됩니다.</li>
 *   <li>실행 중에는 로그 MDC에 {@code jobId}가 설정됩니다.</li>
 *   <li>작업 예외는 모두 Job의 FAILED 결과로 기록되며 워커 스레드를 종료시키지 않습니다.</li>
 * </ul>
 *
 * <p><strong>drain:</strong> 제출을 막고, 대기 중인 Job은 CANCELLED로, 실행 중인 Job에는 취소를 알린 뒤
 * drainGraceMs 동안 기다립니다. 유예 시간 안에 끝나지 않은 Job은 CANCELLED로 강제 기록됩니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class DedicatedWorkerRuntime implements WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DedicatedWorkerRuntime.class);

    static final String MDC_JOB_ID = "jobId";

    private enum Phase { NEW, RUNNING, DRAINING, TERMINATED }

    private final JobLedger ledger;
    private final RateLimiter rateLimiter;
    private final BackoffCalculator backoff;
    private final RuntimeConfig config;
    private final SessionGate sessionGate;
    private final LinkedBlockingQueue<RunningJob> intake;
    private final ConcurrentHashMap<JobId, RunningJob> active;
    private final Object phaseLock = new Object();

    private volatile Phase phase = Phase.NEW;
    private ExecutorService workers;
    private Thread intakeThread;

    public DedicatedWorkerRuntime(JobLedger ledger, RateLimiter rateLimiter,
                                  BackoffCalculator backoff, RuntimeConfig config) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.ledger = ledger;
        this.rateLimiter = rateLimiter;
        this.backoff = backoff;
        this.config = config;
        this.sessionGate = new SessionGate();
        this.intake = new LinkedBlockingQueue<>();
        this.active = new ConcurrentHashMap<>();
    }

    @Override
    public void start() {
        synchronized (phaseLock) {
            if (phase == Phase.RUNNING) {
                return;
            }
            if (phase != Phase.NEW) {
                throw new IllegalStateException("WorkerRuntime cannot be restarted (phase: " + phase + ")");
            }
            ThreadFactory factory = namedThreads("taskbridge-worker-");
            workers = config.isUnbounded()
                ? Executors.newCachedThreadPool(factory)
                : Executors.newFixedThreadPool(config.concurrency(), factory);
            intakeThread = new Thread(this::intakeLoop, "taskbridge-intake");
            intakeThread.setDaemon(true);
            phase = Phase.RUNNING;
            intakeThread.start();
        }
        log.info("WorkerRuntime started (concurrency: {}, maxRetries: {})",
            config.isUnbounded() ? "unbounded" : config.concurrency(), config.maxRetries());
    }

    @Override
    public void submit(JobSnapshot job, WorkUnit<?> work) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (job.state() != JobState.PENDING) {
            throw new IllegalArgumentException("Only PENDING jobs can be submitted (state: " + job.state() + ")");
        }
        RunningJob runningJob = new RunningJob(job, work, ledger, rateLimiter, backoff, config.maxRetries());
        synchronized (phaseLock) {
            if (phase != Phase.RUNNING) {
                throw new IllegalStateException("WorkerRuntime is not accepting jobs (phase: " + phase + ")");
            }
            ledger.open(job);
            active.put(job.id(), runningJob);
            intake.add(runningJob);
        }
        log.debug("Job {} submitted ({}, session: {})", job.id(), job.kind(), job.session());
    }

    @Override
    public JobState requestCancel(JobId id) {
        JobState state = ledger.requestCancel(id);
        RunningJob runningJob = active.get(id);
        if (runningJob != null) {
            runningJob.requestCancel();
        }
        log.debug("Cancellation requested for job {} (now {})", id, state);
        return state;
    }

    @Override
    public boolean isAccepting() {
        return phase == Phase.RUNNING;
    }

    @Override
    public void drain() {
        synchronized (phaseLock) {
            if (phase == Phase.DRAINING || phase == Phase.TERMINATED) {
                return;
            }
            if (phase == Phase.NEW) {
                phase = Phase.TERMINATED;
                ledger.close(config.drainGraceMs());
                return;
            }
            phase = Phase.DRAINING;
        }
        log.info("Draining WorkerRuntime ({} job(s) in flight)", active.size());
        try {
            intakeThread.interrupt();
            intakeThread.join(config.drainGraceMs());

            List<RunningJob> queued = new ArrayList<>();
            intake.drainTo(queued);
            for (RunningJob runningJob : queued) {
                active.remove(runningJob.jobId());
                ledger.forceCancel(runningJob.jobId());
            }
            for (RunningJob runningJob : active.values()) {
                runningJob.requestCancel();
                try {
                    ledger.requestCancel(runningJob.jobId());
                } catch (JobNotFoundException e) {
                    log.debug("Job {} purged while draining", runningJob.jobId());
                }
            }

            workers.shutdown();
            if (!workers.awaitTermination(config.drainGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("{} job(s) still running after {}ms grace, interrupting", active.size(), config.drainGraceMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Drain interrupted, abandoning remaining jobs");
            workers.shutdownNow();
        } catch (RuntimeException e) {
            log.error("Fault while draining WorkerRuntime", e);
        } finally {
            forceCancelRemaining();
            phase = Phase.TERMINATED;
            ledger.close(config.drainGraceMs());
            log.info("WorkerRuntime terminated");
        }
    }

    private void forceCancelRemaining() {
        int forced = 0;
        for (JobSnapshot snapshot : ledger.list(JobFilter.all())) {
            if (!snapshot.isTerminal() && ledger.forceCancel(snapshot.id())) {
                forced++;
            }
        }
        if (forced > 0) {
            log.warn("Force-cancelled {} job(s) that did not stop in time", forced);
        }
    }

    private void intakeLoop() {
        while (phase == Phase.RUNNING) {
            RunningJob runningJob;
            try {
                runningJob = intake.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                workers.execute(() -> run(runningJob));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected job {}, cancelling", runningJob.jobId());
                active.remove(runningJob.jobId());
                ledger.forceCancel(runningJob.jobId());
            }
        }
        log.debug("Intake loop stopped");
    }

    private void run(RunningJob runningJob) {
        JobId id = runningJob.jobId();
        MDC.put(MDC_JOB_ID, id.getValue());
        boolean gated = false;
        try {
            if (!ledger.isPending(id)) {
                log.debug("Job {} cancelled before start", id);
                return;
            }
            if (runningJob.kind().mutatesSession()) {
                sessionGate.acquire(runningJob.session(), runningJob);
                gated = true;
            }
            if (ledger.tryStart(id) == null) {
                log.debug("Job {} cancelled before start", id);
                return;
            }
            log.debug("Job {} running ({})", id, runningJob.kind());
            Object value = runningJob.work().execute(runningJob);
            record(id, Ok.of(value));
        } catch (JobCancelledException e) {
            log.info("Job {} stopped at cancellation checkpoint", id);
            record(id, Cancelled.requested());
        } catch (TaskBridgeException e) {
            if (e.kind() == ErrorKind.INTERNAL_INVARIANT) {
                log.error("Job {} violated an internal invariant", id, e);
            } else {
                log.warn("Job {} failed ({}): {}", id, e.kind(), e.getMessage());
            }
            record(id, Fail.from(e));
        } catch (Exception e) {
            log.error("Job {} failed with unexpected exception", id, e);
            record(id, Fail.unexpected(e));
        } finally {
            if (gated) {
                sessionGate.release(runningJob.session());
            }
            active.remove(id);
            MDC.remove(MDC_JOB_ID);
        }
    }

    private void record(JobId id, Outcome outcome) {
        try {
            JobSnapshot finished = ledger.finish(id, outcome);
            log.debug("Job {} finished as {}", id, finished.state());
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of job {}", id, e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
