package com.ryuqq.taskbridge.core.outcome;

/**
 * 취소 결과.
 *
 * @param reason 취소 사유 (예: "cancel requested", "drain")
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record Cancelled(String reason) implements Outcome {

    public Cancelled {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static Cancelled requested() {
        return new Cancelled("cancel requested");
    }
}
