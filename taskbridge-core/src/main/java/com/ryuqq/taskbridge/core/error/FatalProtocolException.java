package com.ryuqq.taskbridge.core.error;

/**
 * 영구적 프로토콜 오류 (인증 실패, 차단 등). 재시도 없이 Job을 실패시킵니다.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public class FatalProtocolException extends TaskBridgeException {

    public FatalProtocolException(String message) {
        super(message);
    }

    public FatalProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FATAL_PROTOCOL;
    }
}
