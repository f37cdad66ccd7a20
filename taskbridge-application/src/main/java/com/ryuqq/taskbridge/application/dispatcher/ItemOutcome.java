package com.ryuqq.taskbridge.application.dispatcher;

import com.ryuqq.taskbridge.core.outcome.Fail;

import java.time.Instant;

/**
 * 대량 작업의 항목 하나에 대한 결과.
 *
 * @param item 항목 (대상, 전화번호, 사용자, 채팅)
 * @param status 성공/실패
 * @param value 성공 시 값 (값이 없는 작업은 null)
 * @param error 실패 시 오류 (성공이면 null)
 * @param finishedAt 항목 처리 완료 시각
 * @param <R> 항목 결과 타입
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record ItemOutcome<R>(String item, ItemStatus status, R value, Fail error, Instant finishedAt) {

    public ItemOutcome {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (finishedAt == null) {
            throw new IllegalArgumentException("finishedAt cannot be null");
        }
        if ((status == ItemStatus.FAILED) != (error != null)) {
            throw new IllegalArgumentException("error must be present exactly when status is FAILED");
        }
    }

    public static <R> ItemOutcome<R> succeeded(String item, R value, Instant finishedAt) {
        return new ItemOutcome<>(item, ItemStatus.SUCCEEDED, value, null, finishedAt);
    }

    public static <R> ItemOutcome<R> failed(String item, Fail error, Instant finishedAt) {
        return new ItemOutcome<>(item, ItemStatus.FAILED, null, error, finishedAt);
    }

    public boolean isSucceeded() {
        return status == ItemStatus.SUCCEEDED;
    }
}
