package com.ryuqq.taskbridge.core.error;

/**
 * 2단계 인증 비밀번호가 필요한 계정에 비밀번호 없이 로그인을 시도한 경우.
 *
 * <p>세션 상태는 {@code AWAITING_PASSWORD}로 바뀌고, 호출자는 비밀번호를 포함해 다시 인증해야 합니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class PasswordRequiredException extends FatalProtocolException {

    public PasswordRequiredException() {
        super("Two-step verification password is required");
    }
}
