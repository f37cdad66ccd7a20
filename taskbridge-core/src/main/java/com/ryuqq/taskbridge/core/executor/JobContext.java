package com.ryuqq.taskbridge.core.executor;

import com.ryuqq.taskbridge.core.error.JobCancelledException;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.ProtocolOperation;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.protection.RateLimiterConfig;

/**
 * 실행 중인 Job이 작업 단위에 제공하는 컨텍스트.
 *
 * <p><strong>체크포인트:</strong></p>
 * <ul>
 *   <li>{@link #checkpoint()}: 취소 요청이 있으면 {@link JobCancelledException}</li>
 *   <li>{@link #pause(long)}: 대기 중에도 취소 요청을 관측</li>
 *   <li>{@link #invoke}: 호출 직전과 레이트 리밋 대기 중에 취소 요청을 관측</li>
 * </ul>
 *
 * <p>이미 시작된 프로토콜 호출은 중단하지 않습니다. 취소는 그 호출이 끝난 뒤
 * 다음 체크포인트에서 반영됩니다.</p>
 *
 * <p>구현체는 해당 Job을 실행하는 스레드에서만 사용됩니다.
 * 단, {@link #isCancellationRequested()}는 어느 스레드에서 바뀐 값도 즉시 보여야 합니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public interface JobContext {

    JobId jobId();

    SessionName session();

    /**
     * 취소가 요청되었는지 확인.
     *
     * @return 취소 요청 여부
     */
    boolean isCancellationRequested();

    /**
     * 취소 체크포인트.
     *
     * @throws JobCancelledException 취소가 요청된 경우
     */
    void checkpoint();

    /**
     * 취소 가능한 대기.
     *
     * @param millis 대기 시간 (0이면 체크포인트만 수행)
     * @throws IllegalArgumentException millis가 음수인 경우
     * @throws JobCancelledException 대기 전 또는 대기 중 취소가 요청된 경우
     */
    void pause(long millis);

    /**
     * 레이트 리미터 차례를 기다림 (기본 설정).
     *
     * @param operation 호출 종류
     * @throws JobCancelledException 대기 중 취소가 요청된 경우
     */
    void awaitTurn(ProtocolOperation operation);

    /**
     * 레이트 리미터 차례를 기다림 (호출별 설정).
     *
     * @param operation 호출 종류
     * @param override 적용할 설정
     * @throws JobCancelledException 대기 중 취소가 요청된 경우
     */
    void awaitTurn(ProtocolOperation operation, RateLimiterConfig override);

    /**
     * 레이트 리밋과 일시적 오류 재시도를 적용해 프로토콜 호출.
     *
     * <p>체크포인트 → 차례 대기 → 호출 순서로 진행하며,
     * {@code TransientProtocolException}은 백오프 후 재시도 한도까지 반복합니다.</p>
     *
     * @param operation 호출 종류
     * @param call 실제 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    <T> T invoke(ProtocolOperation operation, ProtocolCall<T> call);

    /**
     * {@link #invoke(ProtocolOperation, ProtocolCall)}와 같으나 호출별 레이트 리밋 설정을 사용.
     *
     * @param operation 호출 종류
     * @param override 적용할 설정
     * @param call 실제 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    <T> T invoke(ProtocolOperation operation, RateLimiterConfig override, ProtocolCall<T> call);

    /**
     * 진행률 보고.
     *
     * @param completed 처리한 항목 수 (감소 불가)
     * @param total 전체 항목 수 또는 -1
     */
    void reportProgress(long completed, long total);
}
