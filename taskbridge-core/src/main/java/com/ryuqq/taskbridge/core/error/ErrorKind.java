package com.ryuqq.taskbridge.core.error;

/**
 * 오류 분류.
 *
 * <p>모든 Job 실패는 이 중 하나의 종류와 사람이 읽을 수 있는 메시지를 함께 가집니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 제출 전 입력 검증 실패. Job이 생성되지 않음. */
    VALIDATION,

    /** 일시적 네트워크/레이트 리밋 오류. 제한된 횟수만큼 재시도. */
    TRANSIENT_PROTOCOL,

    /** 인증 실패, 영구 차단 등. 재시도 없이 즉시 실패. */
    FATAL_PROTOCOL,

    /** 협조적 취소의 정상 결과. 실패로 기록하지 않음. */
    CANCELLATION,

    /** 프로그래밍 결함. 최고 심각도로 로깅. */
    INTERNAL_INVARIANT;

    /**
     * 재시도 대상인지 확인.
     *
     * @return TRANSIENT_PROTOCOL이면 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT_PROTOCOL;
    }
}
