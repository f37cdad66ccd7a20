package com.ryuqq.taskbridge.core.model;

import com.ryuqq.taskbridge.core.outcome.Cancelled;
import com.ryuqq.taskbridge.core.outcome.Fail;
import com.ryuqq.taskbridge.core.outcome.Ok;
import com.ryuqq.taskbridge.core.outcome.Outcome;
import com.ryuqq.taskbridge.core.statemachine.JobState;
import com.ryuqq.taskbridge.core.statemachine.StateTransition;

import java.time.Instant;

/**
 * Job 상태의 불변 스냅샷.
 *
 * <p>스레드 경계를 넘는 Job 정보는 항상 이 타입입니다. 상태 변경은 새 스냅샷을 만들어
 * 레지스트리의 기존 값을 교체하는 방식으로만 일어나며, 그때마다 {@code sequence}가 1씩 증가합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>result는 COMPLETED에서만, error는 FAILED에서만 존재 (상호 배타)</li>
 *   <li>endedAt은 종료 상태에서만 존재</li>
 *   <li>상태 변경은 {@link StateTransition} 규칙을 따름</li>
 *   <li>progress.completed는 감소하지 않음</li>
 * </ul>
 *
 * @param id Job ID
 * @param kind Job 종류
 * @param session 대상 세션
 * @param state 현재 상태
 * @param progress 진행률
 * @param result 성공 결과 (COMPLETED에서만, null 가능)
 * @param error 실패 정보 (FAILED에서만)
 * @param createdAt 디스패치 시각
 * @param startedAt 실행 시작 시각 (시작 전 null)
 * @param endedAt 종료 시각 (종료 전 null)
 * @param sequence 스냅샷 순번 (0부터 시작)
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record JobSnapshot(
    JobId id,
    JobKind kind,
    SessionName session,
    JobState state,
    Progress progress,
    Object result,
    Fail error,
    Instant createdAt,
    Instant startedAt,
    Instant endedAt,
    long sequence
) {

    public JobSnapshot {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (result != null && state != JobState.COMPLETED) {
            throw new IllegalArgumentException("result is only allowed in COMPLETED (state: " + state + ")");
        }
        if ((error != null) != (state == JobState.FAILED)) {
            throw new IllegalArgumentException("error must be present exactly in FAILED (state: " + state + ")");
        }
        if ((endedAt != null) != state.isTerminal()) {
            throw new IllegalArgumentException("endedAt must be present exactly in terminal states (state: " + state + ")");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
    }

    /**
     * 디스패치 시점의 PENDING 스냅샷 생성.
     *
     * @param id Job ID
     * @param kind Job 종류
     * @param session 대상 세션
     * @param createdAt 생성 시각
     * @return sequence 0의 PENDING 스냅샷
     */
    public static JobSnapshot pending(JobId id, JobKind kind, SessionName session, Instant createdAt) {
        return new JobSnapshot(id, kind, session, JobState.PENDING, Progress.none(),
            null, null, createdAt, null, null, 0);
    }

    /**
     * 비종료 상태(RUNNING, CANCELLING)로 전이.
     *
     * @param next 다음 상태
     * @param now 현재 시각
     * @return 새 스냅샷
     * @throws IllegalArgumentException next가 종료 상태인 경우 (종료는 전용 메서드 사용)
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public JobSnapshot transitionTo(JobState next, Instant now) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Use completed/failed/cancelled for terminal state: " + next);
        }
        StateTransition.validate(state, next);
        Instant started = next == JobState.RUNNING ? now : startedAt;
        return new JobSnapshot(id, kind, session, next, progress, null, null,
            createdAt, started, null, sequence + 1);
    }

    public JobSnapshot completed(Object value, Instant now) {
        StateTransition.validate(state, JobState.COMPLETED);
        return new JobSnapshot(id, kind, session, JobState.COMPLETED, progress, value, null,
            createdAt, startedAt, now, sequence + 1);
    }

    public JobSnapshot failed(Fail failure, Instant now) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        StateTransition.validate(state, JobState.FAILED);
        return new JobSnapshot(id, kind, session, JobState.FAILED, progress, null, failure,
            createdAt, startedAt, now, sequence + 1);
    }

    public JobSnapshot cancelled(Instant now) {
        StateTransition.validate(state, JobState.CANCELLED);
        return new JobSnapshot(id, kind, session, JobState.CANCELLED, progress, null, null,
            createdAt, startedAt, now, sequence + 1);
    }

    /**
     * 진행률 갱신.
     *
     * @param next 새 진행률
     * @return 새 스냅샷
     * @throws IllegalStateException 종료 상태이거나 진행률이 감소하는 경우
     */
    public JobSnapshot withProgress(Progress next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Cannot update progress of terminal job: " + id);
        }
        return new JobSnapshot(id, kind, session, state, progress.advanceTo(next), null, null,
            createdAt, startedAt, null, sequence + 1);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * 종료 결과를 Outcome으로 변환.
     *
     * @return 종료 상태에 해당하는 Outcome, 종료 전이면 null
     */
    public Outcome outcome() {
        switch (state) {
            case COMPLETED:
                return Ok.of(result);
            case FAILED:
                return error;
            case CANCELLED:
                return Cancelled.requested();
            default:
                return null;
        }
    }
}
