package com.ryuqq.taskbridge.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 작업 단위가 반환한 값 (반환값이 없는 작업은 null)
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record Ok(Object value) implements Outcome {

    private static final Ok EMPTY = new Ok(null);

    /**
     * 값 없는 성공.
     *
     * @return 값이 null인 Ok
     */
    public static Ok empty() {
        return EMPTY;
    }

    public static Ok of(Object value) {
        return value == null ? EMPTY : new Ok(value);
    }
}
