package com.ryuqq.taskbridge.application.dispatcher;

import java.util.List;

/**
 * 대량 작업 결과 요약.
 *
 * <p>항목별 결과를 입력 순서대로 담습니다. 일부 실패가 있어도 나머지 항목은 계속 처리되므로
 * 성공/실패 개수를 함께 확인해야 합니다.</p>
 *
 * @param items 항목별 결과 (입력 순서)
 * @param <R> 항목 결과 타입
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record BulkSummary<R>(List<ItemOutcome<R>> items) {

    public BulkSummary {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        items = List.copyOf(items);
    }

    public int total() {
        return items.size();
    }

    public long succeeded() {
        return items.stream().filter(ItemOutcome::isSucceeded).count();
    }

    public long failed() {
        return total() - succeeded();
    }

    public boolean isAllSucceeded() {
        return failed() == 0;
    }

    /**
     * 실패한 항목만 추림.
     *
     * @return 실패 항목 목록
     */
    public List<ItemOutcome<R>> failures() {
        return items.stream().filter(item -> !item.isSucceeded()).toList();
    }
}
