package com.ryuqq.taskbridge.application.bridge;

import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.SessionName;

import java.time.Instant;

/**
 * 디스패치된 Job의 핸들.
 *
 * <p>Job의 상태를 직접 담지 않습니다. 현재 상태는 {@link TaskBridge#poll(JobHandle)}로,
 * 결과는 {@link TaskBridge#awaitResult(JobHandle, java.time.Duration)}로 조회합니다.
 * 타입 파라미터는 결과 타입을 호출자 쪽에서 유지하기 위한 것입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @param <T> Job 결과 타입
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class JobHandle<T> {

    private final JobId jobId;
    private final JobKind kind;
    private final SessionName session;
    private final Instant dispatchedAt;

    private JobHandle(JobId jobId, JobKind kind, SessionName session, Instant dispatchedAt) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (dispatchedAt == null) {
            throw new IllegalArgumentException("dispatchedAt cannot be null");
        }
        this.jobId = jobId;
        this.kind = kind;
        this.session = session;
        this.dispatchedAt = dispatchedAt;
    }

    /**
     * 핸들 생성.
     *
     * @param jobId Job ID
     * @param kind Job 종류
     * @param session 대상 세션
     * @param dispatchedAt 디스패치 시각
     * @param <T> 결과 타입
     * @return JobHandle
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     */
    public static <T> JobHandle<T> of(JobId jobId, JobKind kind, SessionName session, Instant dispatchedAt) {
        return new JobHandle<>(jobId, kind, session, dispatchedAt);
    }

    /**
     * 종료된 Job의 결과를 이 핸들의 결과 타입으로 변환.
     *
     * @param value Job 스냅샷에 기록된 결과
     * @return 결과 값, 결과가 없으면 null
     */
    public T resultOf(Object value) {
        return (T) value;
    }

    public JobId getJobId() {
        return jobId;
    }

    public JobKind getKind() {
        return kind;
    }

    public SessionName getSession() {
        return session;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobHandle<?> that = (JobHandle<?>) o;
        return jobId.equals(that.jobId);
    }

    @Override
    public int hashCode() {
        return jobId.hashCode();
    }

    @Override
    public String toString() {
        return "JobHandle{jobId=" + jobId.getValue() + ", kind=" + kind + ", session=" + session + "}";
    }
}
