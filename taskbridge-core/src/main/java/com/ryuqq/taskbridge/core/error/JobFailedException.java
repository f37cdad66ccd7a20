package com.ryuqq.taskbridge.core.error;

import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.outcome.Fail;

/**
 * 헤드리스 호출자가 {@code awaitResult}로 실패한 Job을 기다렸을 때 던져지는 예외.
 *
 * <p>원래 실패 정보({@link Fail})를 그대로 담고 있으며, {@link #kind()}는 그 종류를 따릅니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class JobFailedException extends TaskBridgeException {

    private final JobId jobId;
    private final Fail failure;

    public JobFailedException(JobId jobId, Fail failure) {
        super(failure == null ? "Job failed" : failure.kind() + ": " + failure.message());
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        this.jobId = jobId;
        this.failure = failure;
    }

    public JobId getJobId() {
        return jobId;
    }

    public Fail getFailure() {
        return failure;
    }

    @Override
    public ErrorKind kind() {
        return failure.kind();
    }
}
