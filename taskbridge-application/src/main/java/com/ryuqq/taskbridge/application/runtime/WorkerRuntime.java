package com.ryuqq.taskbridge.application.runtime;

import com.ryuqq.taskbridge.core.executor.WorkUnit;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.statemachine.JobState;

/**
 * 모든 네트워크 작업이 실행되는 전용 실행 컨텍스트.
 *
 * <p>상호작용 스레드(UI)는 네트워크 호출을 직접 하지 않고 이 런타임에 작업을 넘깁니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #submit}은 즉시 반환하며 호출자를 막지 않음</li>
 *   <li>제출 순서대로 수락하되 완료 순서는 보장하지 않음</li>
 *   <li>같은 세션의 상태 변경 작업은 한 번에 하나만 실행</li>
 *   <li>작업 단위의 예외는 해당 Job의 실패로 기록되고 런타임은 계속 동작</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * runtime.start();
 * runtime.submit(snapshot, work);   // 여러 번
 * runtime.drain();                  // 수락 중단 → 유예 대기 → 남은 Job 강제 취소
 * </pre>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public interface WorkerRuntime {

    /**
     * 런타임 시작. 이미 시작된 경우 아무 일도 하지 않음.
     *
     * @throws IllegalStateException drain 이후 다시 시작하려는 경우
     */
    void start();

    /**
     * PENDING Job을 등록하고 실행 대기열에 넣음.
     *
     * @param job PENDING 상태의 초기 스냅샷
     * @param work 실행할 작업 단위
     * @throws IllegalArgumentException job 또는 work가 null이거나 job이 PENDING이 아닌 경우
     * @throws IllegalStateException 런타임이 수락 중이 아닌 경우 (시작 전 또는 drain 이후)
     * @throws com.ryuqq.taskbridge.core.error.InvariantViolationException 이미 사용된 JobId인 경우
     */
    void submit(JobSnapshot job, WorkUnit<?> work);

    /**
     * 협조적 취소 요청.
     *
     * <p>PENDING이면 실행 없이 즉시 CANCELLED, RUNNING이면 CANCELLING으로 전이합니다.
     * 이미 종료되었거나 CANCELLING이면 아무 일도 하지 않습니다.</p>
     *
     * @param id Job ID
     * @return 요청 처리 직후의 상태
     * @throws com.ryuqq.taskbridge.core.error.JobNotFoundException 등록되지 않은 Job인 경우
     */
    JobState requestCancel(JobId id);

    /**
     * 런타임 종료.
     *
     * <p>새 제출을 거부하고, 실행 중인 Job에 취소를 알린 뒤 유예 시간 동안 기다립니다.
     * 유예 후에도 끝나지 않은 Job은 CANCELLED로 강제 종료합니다.
     * 이 메서드는 예외를 던지지 않으며 여러 번 호출해도 안전합니다.</p>
     */
    void drain();

    /**
     * 새 제출을 받는 중인지 확인.
     *
     * @return start 이후 drain 이전이면 true
     */
    boolean isAccepting();
}
