package com.ryuqq.taskbridge.application.dispatcher;

import com.ryuqq.taskbridge.core.model.User;

import java.util.List;

/**
 * 여러 채팅의 참가자 수집 결과.
 *
 * @param users 중복 제거된 사용자 목록 (처음 발견된 순서)
 * @param perChat 채팅별 결과. 성공 값은 그 채팅에서 받은 사용자 수
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record ParseResult(List<User> users, BulkSummary<Integer> perChat) {

    public ParseResult {
        if (users == null) {
            throw new IllegalArgumentException("users cannot be null");
        }
        if (perChat == null) {
            throw new IllegalArgumentException("perChat cannot be null");
        }
        users = List.copyOf(users);
    }
}
