package com.ryuqq.taskbridge.core.statemachine;

/**
 * Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──────────────► CANCELLED (시작 전 취소)
 *    │
 *    ▼ (워커 실행 시작)
 * RUNNING
 *    │
 *    ├─► COMPLETED (성공)
 *    ├─► FAILED (실패)
 *    ├─► CANCELLED (체크포인트에서 취소 관측)
 *    └─► CANCELLING (취소 요청)
 *            │
 *            └─► CANCELLED
 *
 * 금지된 전이:
 * - 종료 상태(COMPLETED, FAILED, CANCELLED) → * ❌
 * - CANCELLING → COMPLETED / FAILED ❌
 * - RUNNING → PENDING ❌
 * </pre>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 디스패치됨, 아직 워커가 실행하지 않음.
     */
    PENDING,

    /**
     * 워커에서 실행 중.
     */
    RUNNING,

    /**
     * 취소 요청됨, 다음 체크포인트를 기다리는 중.
     */
    CANCELLING,

    /**
     * 취소 완료.
     */
    CANCELLED,

    /**
     * 성공.
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 워커가 작업 단위를 실행하고 있는 상태인지 확인.
     *
     * @return RUNNING 또는 CANCELLING인 경우 true
     */
    public boolean isActive() {
        return this == RUNNING || this == CANCELLING;
    }
}
