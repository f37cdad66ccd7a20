package com.ryuqq.taskbridge.core.model;

/**
 * 외부 프로토콜 클라이언트에 대한 개별 호출 종류.
 *
 * <p>레이트 리미터는 (세션, ProtocolOperation) 쌍마다 마지막 호출 시각을 기록합니다.
 * 단건 전송과 대량 전송은 모두 {@link #SEND_MESSAGE} 키를 공유합니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public enum ProtocolOperation {
    CONNECT,
    SEND_CODE,
    SIGN_IN,
    SEND_MESSAGE,
    GET_PARTICIPANTS,
    GET_DIALOGS,
    CHECK_PHONE,
    INVITE,
    DISCONNECT
}
