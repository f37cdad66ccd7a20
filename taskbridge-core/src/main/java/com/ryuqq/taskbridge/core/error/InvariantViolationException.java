package com.ryuqq.taskbridge.core.error;

/**
 * 내부 불변식 위반 (예: 레지스트리 식별자 중복). 프로그래밍 결함을 의미합니다.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class InvariantViolationException extends TaskBridgeException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL_INVARIANT;
    }
}
