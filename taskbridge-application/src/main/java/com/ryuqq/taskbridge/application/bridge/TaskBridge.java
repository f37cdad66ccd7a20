package com.ryuqq.taskbridge.application.bridge;

import com.ryuqq.taskbridge.core.executor.WorkUnit;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.spi.JobListener;
import com.ryuqq.taskbridge.core.statemachine.JobState;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 상호작용 스레드와 워커 런타임 사이의 유일한 통로.
 *
 * <p>스레드 경계를 넘는 것은 {@link JobHandle}과 불변 {@link JobSnapshot}뿐입니다.</p>
 *
 * <p><strong>블로킹 여부:</strong></p>
 * <ul>
 *   <li>dispatch, poll, cancel, list, purge: 항상 즉시 반환 (UI 스레드에서 호출 가능)</li>
 *   <li>awaitResult, awaitTerminal: 호출 스레드만 최대 timeout까지 블로킹 (헤드리스 호출자용)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * JobHandle&lt;List&lt;User&gt;&gt; handle = bridge.dispatch(JobKind.PARSE_USERS, session, work);
 *
 * // UI: 타이머에서 폴링
 * JobSnapshot snapshot = bridge.poll(handle);
 *
 * // 헤드리스: 결과 대기 (타임아웃이 나도 Job은 계속 실행)
 * List&lt;User&gt; users = bridge.awaitResult(handle, Duration.ofSeconds(30));
 * </pre>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public interface TaskBridge {

    /**
     * PENDING Job을 만들어 런타임에 제출하고 즉시 핸들을 반환.
     *
     * @param kind Job 종류
     * @param session 대상 세션
     * @param work 작업 단위
     * @param <T> 결과 타입
     * @return 핸들
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     * @throws IllegalStateException 런타임이 수락 중이 아닌 경우
     */
    <T> JobHandle<T> dispatch(JobKind kind, SessionName session, WorkUnit<T> work);

    /**
     * 현재 스냅샷 조회 (비블로킹).
     *
     * @param handle 핸들
     * @return 불변 스냅샷
     * @throws com.ryuqq.taskbridge.core.error.JobNotFoundException purge된 경우
     */
    JobSnapshot poll(JobHandle<?> handle);

    /**
     * ID로 현재 스냅샷 조회 (비블로킹).
     *
     * @param id Job ID
     * @return 불변 스냅샷
     * @throws com.ryuqq.taskbridge.core.error.JobNotFoundException 등록되지 않은 경우
     */
    JobSnapshot poll(JobId id);

    /**
     * 결과 대기.
     *
     * <p>타임아웃은 Job을 취소하지 않습니다.</p>
     *
     * @param handle 핸들
     * @param timeout 최대 대기 시간
     * @param <T> 결과 타입
     * @return COMPLETED Job의 결과
     * @throws TimeoutException timeout 내에 종료되지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트
     * @throws com.ryuqq.taskbridge.core.error.JobFailedException Job이 FAILED로 끝난 경우
     * @throws com.ryuqq.taskbridge.core.error.JobCancelledException Job이 CANCELLED로 끝난 경우
     */
    <T> T awaitResult(JobHandle<T> handle, Duration timeout) throws TimeoutException, InterruptedException;

    /**
     * 종료 상태까지 대기하고 마지막 스냅샷 반환.
     *
     * @param id Job ID
     * @param timeout 최대 대기 시간
     * @return 종료 상태의 스냅샷
     * @throws TimeoutException timeout 내에 종료되지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트
     */
    JobSnapshot awaitTerminal(JobId id, Duration timeout) throws TimeoutException, InterruptedException;

    /**
     * 협조적 취소 요청.
     *
     * @param id Job ID
     * @return 요청 직후 상태 (PENDING이었다면 CANCELLED, RUNNING이었다면 CANCELLING, 종료 상태면 그대로)
     * @throws com.ryuqq.taskbridge.core.error.JobNotFoundException 등록되지 않은 경우
     */
    JobState cancel(JobId id);

    /**
     * 조건에 맞는 Job 목록 (오래된 순).
     *
     * @param filter 필터
     * @return 스냅샷 복사본 목록
     */
    List<JobSnapshot> list(JobFilter filter);

    /**
     * 종료된 Job 기록 삭제.
     *
     * @param id Job ID
     * @return 삭제했으면 true, 없었으면 false
     * @throws IllegalStateException Job이 종료되지 않은 경우
     */
    boolean purge(JobId id);

    /**
     * 모든 종료된 Job 기록 삭제.
     *
     * @return 삭제한 개수
     */
    int purgeTerminal();

    void addListener(JobListener listener);

    void removeListener(JobListener listener);
}
