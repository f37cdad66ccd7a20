package com.ryuqq.taskbridge.application.dispatcher;

/**
 * 대량 작업 항목별 처리 결과.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public enum ItemStatus {
    SUCCEEDED,
    FAILED
}
