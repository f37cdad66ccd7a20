package com.ryuqq.taskbridge.core.model;

/**
 * 계정의 대화 목록 항목.
 *
 * @param id 대화 ID
 * @param name 대화 이름
 * @param type 엔티티 종류 (예: user, chat, channel)
 * @param unreadCount 읽지 않은 메시지 수
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record Dialog(long id, String name, String type, int unreadCount) {
}
