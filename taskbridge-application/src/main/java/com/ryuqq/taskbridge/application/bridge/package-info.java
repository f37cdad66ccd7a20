/**
 * Task bridge port.
 *
 * <p>{@link com.ryuqq.taskbridge.application.bridge.TaskBridge}는 동기 호출을
 * 비블로킹 제출과 {@link com.ryuqq.taskbridge.application.bridge.JobHandle}로 바꿉니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.taskbridge.application.bridge;
