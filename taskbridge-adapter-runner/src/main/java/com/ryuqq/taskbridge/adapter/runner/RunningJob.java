package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.error.JobCancelledException;
import com.ryuqq.taskbridge.core.error.TransientProtocolException;
import com.ryuqq.taskbridge.core.executor.JobContext;
import com.ryuqq.taskbridge.core.executor.ProtocolCall;
import com.ryuqq.taskbridge.core.executor.WorkUnit;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.ProtocolOperation;
import com.ryuqq.taskbridge.core.model.Progress;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.protection.RateLimiter;
import com.ryuqq.taskbridge.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실행 중인 Job 하나의 {@link JobContext} 구현.
 *
 * <p>취소 플래그는 UI 스레드가 세우고 워커 스레드가 checkpoint에서 읽습니다.
 * pause는 취소 요청 시 즉시 깨어납니다.</p>
 *
 * <p>{@link #invoke}는 호출 전 Rate Limiter 순서를 기다리고,
 * {@link TransientProtocolException}은 {@link BackoffCalculator} 간격으로 최대 maxRetries번 재시도합니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
final class RunningJob implements JobContext {

    private static final Logger log = LoggerFactory.getLogger(RunningJob.class);

    private final JobSnapshot submitted;
    private final WorkUnit<?> work;
    private final JobLedger ledger;
    private final RateLimiter rateLimiter;
    private final BackoffCalculator backoff;
    private final int maxRetries;
    private final Object signal = new Object();
    private volatile boolean cancelRequested;

    RunningJob(JobSnapshot submitted, WorkUnit<?> work, JobLedger ledger,
               RateLimiter rateLimiter, BackoffCalculator backoff, int maxRetries) {
        this.submitted = submitted;
        this.work = work;
        this.ledger = ledger;
        this.rateLimiter = rateLimiter;
        this.backoff = backoff;
        this.maxRetries = maxRetries;
    }

    WorkUnit<?> work() {
        return work;
    }

    JobKind kind() {
        return submitted.kind();
    }

    void requestCancel() {
        cancelRequested = true;
        synchronized (signal) {
            signal.notifyAll();
        }
    }

    @Override
    public JobId jobId() {
        return submitted.id();
    }

    @Override
    public SessionName session() {
        return submitted.session();
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelRequested;
    }

    @Override
    public void checkpoint() {
        if (cancelRequested || Thread.currentThread().isInterrupted()) {
            throw new JobCancelledException(jobId());
        }
    }

    @Override
    public void pause(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be non-negative (current: " + millis + ")");
        }
        checkpoint();
        long deadline = System.nanoTime() + millis * 1_000_000L;
        synchronized (signal) {
            long remaining;
            while (!cancelRequested && (remaining = deadline - System.nanoTime()) > 0) {
                try {
                    // 나노초 단위 잔여 시간을 올림
                    signal.wait((remaining + 999_999L) / 1_000_000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new JobCancelledException(jobId());
                }
            }
        }
        checkpoint();
    }

    @Override
    public void awaitTurn(ProtocolOperation operation) {
        awaitTurn(operation, null);
    }

    @Override
    public void awaitTurn(ProtocolOperation operation, RateLimiterConfig override) {
        checkpoint();
        long wait = override == null
            ? rateLimiter.reserve(session(), operation)
            : rateLimiter.reserve(session(), operation, override);
        if (wait > 0) {
            pause(wait);
        }
    }

    @Override
    public <T> T invoke(ProtocolOperation operation, ProtocolCall<T> call) {
        return invoke(operation, null, call);
    }

    @Override
    public <T> T invoke(ProtocolOperation operation, RateLimiterConfig override, ProtocolCall<T> call) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        int attempt = 0;
        while (true) {
            awaitTurn(operation, override);
            try {
                return call.call();
            } catch (TransientProtocolException e) {
                attempt++;
                if (attempt > maxRetries) {
                    log.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delay = backoff.calculate(attempt);
                log.info("{} hit transient failure (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempt, maxRetries + 1, delay, e.getMessage());
                pause(delay);
            }
        }
    }

    @Override
    public void reportProgress(long completed, long total) {
        ledger.progress(jobId(), new Progress(completed, total));
    }
}
