package com.ryuqq.taskbridge.application.dispatcher;

import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.model.SessionStatus;

/**
 * 세션 슬롯의 읽기 전용 요약.
 *
 * @param name 세션 이름
 * @param status 현재 상태
 * @param autoRespond 자동 응답 활성화 여부
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record SessionView(SessionName name, SessionStatus status, boolean autoRespond) {
}
