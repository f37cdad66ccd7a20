package com.ryuqq.taskbridge.core.model;

/**
 * 세션 슬롯의 연결/인증 상태.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public enum SessionStatus {

    /** 슬롯만 예약되었고 아직 연결 전. */
    UNAUTHENTICATED,

    /** 인증 코드 발송 완료, 코드 입력 대기. */
    AWAITING_CODE,

    /** 2단계 인증 비밀번호 입력 대기. */
    AWAITING_PASSWORD,

    AUTHENTICATED,

    DISCONNECTED,

    ERROR;

    /**
     * 같은 이름으로 세션을 다시 만들 수 있는 상태인지 확인.
     *
     * @return DISCONNECTED 또는 ERROR이면 true
     */
    public boolean isReusable() {
        return this == DISCONNECTED || this == ERROR;
    }
}
