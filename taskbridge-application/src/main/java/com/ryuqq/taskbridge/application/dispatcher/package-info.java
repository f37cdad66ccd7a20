/**
 * Dispatcher facade and its result types.
 *
 * <p>{@link com.ryuqq.taskbridge.application.dispatcher.Dispatcher}는 사용자 연산을 검증하고
 * Job으로 바꾸며, 대량 작업 결과를
 * {@link com.ryuqq.taskbridge.application.dispatcher.BulkSummary}로 정리합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.taskbridge.application.dispatcher;
