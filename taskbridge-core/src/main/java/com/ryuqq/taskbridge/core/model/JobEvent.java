package com.ryuqq.taskbridge.core.model;

import com.ryuqq.taskbridge.core.statemachine.JobState;

/**
 * Job 변경 알림.
 *
 * <p>상태 전이와 진행률 갱신마다 하나씩 만들어집니다. 진행률만 바뀐 경우 {@code previousState}와
 * 스냅샷의 상태가 같습니다.</p>
 *
 * @param previousState 변경 전 상태 (등록 이벤트는 null)
 * @param snapshot 변경 후 스냅샷
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record JobEvent(JobState previousState, JobSnapshot snapshot) {

    public JobEvent {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
    }

    public JobId jobId() {
        return snapshot.id();
    }

    /**
     * 상태 전이 이벤트인지 확인.
     *
     * @return 상태가 바뀌었으면 true (등록 포함)
     */
    public boolean isTransition() {
        return previousState != snapshot.state();
    }
}
