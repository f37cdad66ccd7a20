package com.ryuqq.taskbridge.adapter.runner;

/**
 * 종료된 Job 기록 보존 정책.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 * @param maxTerminalJobs 보존할 종료 Job 최대 개수 (0이면 개수 제한 없음)
 * @param maxAgeMs 종료 후 보존 기간 (밀리초, 0이면 기간 제한 없음)
 */
public record RetentionPolicy(int maxTerminalJobs, long maxAgeMs) {

    /**
     * 기본 정책: 종료 Job 최대 1000개, 기간 제한 없음.
     */
    public RetentionPolicy() {
        this(1000, 0);
    }

    public RetentionPolicy {
        if (maxTerminalJobs < 0) {
            throw new IllegalArgumentException(
                "maxTerminalJobs must be non-negative (current: " + maxTerminalJobs + ")"
            );
        }
        if (maxAgeMs < 0) {
            throw new IllegalArgumentException(
                "maxAgeMs must be non-negative (current: " + maxAgeMs + ")"
            );
        }
    }

    /**
     * 아무것도 삭제하지 않는 정책.
     */
    public static RetentionPolicy keepAll() {
        return new RetentionPolicy(0, 0);
    }

    public boolean isEnabled() {
        return maxTerminalJobs > 0 || maxAgeMs > 0;
    }

    public RetentionPolicy withMaxTerminalJobs(int maxTerminalJobs) {
        return new RetentionPolicy(maxTerminalJobs, maxAgeMs);
    }

    public RetentionPolicy withMaxAgeMs(long maxAgeMs) {
        return new RetentionPolicy(maxTerminalJobs, maxAgeMs);
    }
}
