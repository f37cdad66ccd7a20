package com.ryuqq.taskbridge.core.executor;

/**
 * 외부 프로토콜 클라이언트에 대한 한 번의 호출.
 *
 * <p>{@link JobContext#invoke}가 레이트 리밋과 재시도를 적용해 실행합니다.</p>
 *
 * @param <T> 호출 결과 타입
 * @author TaskBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProtocolCall<T> {

    T call();
}
