package com.ryuqq.taskbridge.core.outcome;

/**
 * 작업 단위 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨 (결과값 포함)</li>
 *   <li>{@link Fail}: 실패 (오류 종류와 메시지 포함)</li>
 *   <li>{@link Cancelled}: 협조적 취소로 종료됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 세 경우 외의 구현을 허용하지 않습니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail, Cancelled {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 결과가 취소인지 확인.
     *
     * @return 취소 여부
     */
    default boolean isCancelled() {
        return this instanceof Cancelled;
    }
}
