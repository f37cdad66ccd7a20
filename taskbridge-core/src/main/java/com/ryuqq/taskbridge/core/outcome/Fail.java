package com.ryuqq.taskbridge.core.outcome;

import com.ryuqq.taskbridge.core.error.ErrorKind;
import com.ryuqq.taskbridge.core.error.TaskBridgeException;

/**
 * 실패 결과.
 *
 * <p>모든 실패는 {@link ErrorKind}와 사람이 읽을 수 있는 메시지를 함께 가집니다.
 * 원인 예외는 스레드 경계를 넘지 않도록 문자열로만 보관합니다.</p>
 *
 * @param kind 오류 종류
 * @param message 오류 메시지
 * @param cause 원인 설명 (선택, null 가능)
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record Fail(
    ErrorKind kind,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 비어 있는 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(ErrorKind kind, String message) {
        return new Fail(kind, message, null);
    }

    public static Fail of(ErrorKind kind, String message, String cause) {
        return new Fail(kind, message, cause);
    }

    /**
     * TaskBridge 예외를 Fail로 변환.
     *
     * @param exception 변환할 예외
     * @return 예외의 종류와 메시지를 담은 Fail
     */
    public static Fail from(TaskBridgeException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        return new Fail(exception.kind(), messageOf(exception), causeOf(exception));
    }

    /**
     * 분류되지 않은 예외를 내부 불변식 위반으로 변환.
     *
     * @param throwable 변환할 예외
     * @return INTERNAL_INVARIANT 종류의 Fail
     */
    public static Fail unexpected(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        return new Fail(ErrorKind.INTERNAL_INVARIANT,
            "Unexpected " + throwable.getClass().getSimpleName() + ": " + messageOf(throwable),
            causeOf(throwable));
    }

    private static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    private static String causeOf(Throwable throwable) {
        Throwable cause = throwable.getCause();
        return cause == null ? null : cause.getClass().getName() + ": " + cause.getMessage();
    }
}
