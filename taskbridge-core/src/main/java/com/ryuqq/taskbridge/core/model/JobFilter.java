package com.ryuqq.taskbridge.core.model;

import com.ryuqq.taskbridge.core.statemachine.JobState;

/**
 * 레지스트리 목록 조회 필터.
 *
 * @param kind 종류 조건 (null이면 전체)
 * @param state 상태 조건 (null이면 전체)
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record JobFilter(JobKind kind, JobState state) {

    private static final JobFilter ALL = new JobFilter(null, null);

    public static JobFilter all() {
        return ALL;
    }

    public static JobFilter byKind(JobKind kind) {
        return new JobFilter(kind, null);
    }

    public static JobFilter byState(JobState state) {
        return new JobFilter(null, state);
    }

    public boolean matches(JobSnapshot snapshot) {
        if (snapshot == null) {
            return false;
        }
        return (kind == null || kind == snapshot.kind())
            && (state == null || state == snapshot.state());
    }
}
