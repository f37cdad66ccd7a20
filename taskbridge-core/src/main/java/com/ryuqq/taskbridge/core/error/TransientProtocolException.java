package com.ryuqq.taskbridge.core.error;

/**
 * 일시적 프로토콜 오류 (연결 끊김, flood wait 등). 호출 단위로 재시도됩니다.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class TransientProtocolException extends TaskBridgeException {

    public TransientProtocolException(String message) {
        super(message);
    }

    public TransientProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT_PROTOCOL;
    }
}
