package com.ryuqq.taskbridge.core.error;

import com.ryuqq.taskbridge.core.model.JobId;

/**
 * 레지스트리에 없는 JobId로 조회/취소를 시도한 경우.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class JobNotFoundException extends TaskBridgeException {

    private final JobId jobId;

    public JobNotFoundException(JobId jobId) {
        super("Job not found: " + (jobId == null ? "null" : jobId.getValue()));
        this.jobId = jobId;
    }

    public JobId getJobId() {
        return jobId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
