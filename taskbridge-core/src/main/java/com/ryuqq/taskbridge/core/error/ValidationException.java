package com.ryuqq.taskbridge.core.error;

/**
 * 입력 검증 실패. 퍼사드 호출자에게 동기적으로 전달되며 Job은 생성되지 않습니다.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class ValidationException extends TaskBridgeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
