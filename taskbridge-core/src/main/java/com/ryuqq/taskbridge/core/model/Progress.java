package com.ryuqq.taskbridge.core.model;

/**
 * Job 진행률.
 *
 * <p>completed는 단조 증가합니다. total이 {@link #UNKNOWN_TOTAL}이면 전체 개수를 모르는 상태입니다.</p>
 *
 * @param completed 처리한 항목 수 (0 이상)
 * @param total 전체 항목 수 또는 {@link #UNKNOWN_TOTAL}
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record Progress(long completed, long total) {

    public static final long UNKNOWN_TOTAL = -1;

    private static final Progress NONE = new Progress(0, UNKNOWN_TOTAL);

    public Progress {
        if (completed < 0) {
            throw new IllegalArgumentException("completed must be non-negative (current: " + completed + ")");
        }
        if (total < UNKNOWN_TOTAL) {
            throw new IllegalArgumentException("total must be -1 or non-negative (current: " + total + ")");
        }
    }

    public static Progress none() {
        return NONE;
    }

    public boolean hasTotal() {
        return total != UNKNOWN_TOTAL;
    }

    /**
     * 진행률 갱신.
     *
     * @param next 새 진행률
     * @return next
     * @throws IllegalStateException completed가 감소하는 경우
     */
    public Progress advanceTo(Progress next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (next.completed < completed) {
            throw new IllegalStateException(
                String.format("Progress cannot go backwards: %d → %d", completed, next.completed));
        }
        return next;
    }
}
