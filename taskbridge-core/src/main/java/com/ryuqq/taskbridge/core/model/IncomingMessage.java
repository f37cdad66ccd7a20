package com.ryuqq.taskbridge.core.model;

/**
 * 외부 클라이언트가 전달하는 수신 메시지.
 *
 * @param senderId 발신자 ID
 * @param chatId 메시지가 속한 대화 ID
 * @param text 본문
 * @param privateChat 1:1 대화 여부
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record IncomingMessage(long senderId, long chatId, String text, boolean privateChat) {
}
