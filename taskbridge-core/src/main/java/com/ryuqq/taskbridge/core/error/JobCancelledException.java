package com.ryuqq.taskbridge.core.error;

import com.ryuqq.taskbridge.core.model.JobId;

/**
 * 협조적 취소가 관측되었음을 알리는 예외.
 *
 * <p>작업 단위는 체크포인트에서 이 예외를 던져 실행을 중단합니다.
 * 워커는 이를 실패가 아닌 CANCELLED 종료로 처리합니다.
 * {@code awaitResult}도 취소된 Job에 대해 이 예외를 던집니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class JobCancelledException extends TaskBridgeException {

    private final JobId jobId;

    public JobCancelledException(JobId jobId) {
        super("Job cancelled: " + (jobId == null ? "unknown" : jobId.getValue()));
        this.jobId = jobId;
    }

    public JobId getJobId() {
        return jobId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CANCELLATION;
    }
}
