package com.ryuqq.taskbridge.core.error;

/**
 * TaskBridge 예외 계층의 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorKind}를 하나씩 가지며,
 * 워커는 이를 그대로 Job의 {@code Fail} 결과로 옮깁니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public abstract class TaskBridgeException extends RuntimeException {

    protected TaskBridgeException(String message) {
        super(message);
    }

    protected TaskBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 오류 종류.
     *
     * @return 이 예외의 ErrorKind
     */
    public abstract ErrorKind kind();
}
