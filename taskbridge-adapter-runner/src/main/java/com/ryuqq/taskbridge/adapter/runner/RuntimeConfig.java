package com.ryuqq.taskbridge.adapter.runner;

/**
 * DedicatedWorkerRuntime 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행할 수 있는 Job 수 (0이면 제한 없음, 기본 0)</li>
 *   <li>maxRetries: 일시적 프로토콜 오류의 호출당 최대 재시도 횟수 (기본 3)</li>
 *   <li>drainGraceMs: drain 시 실행 중인 Job을 기다리는 유예 시간 (기본 5000ms)</li>
 *   <li>maxBulkItems: 대량 작업 한 건의 최대 항목 수 (기본 1000)</li>
 * </ul>
 *
 * <p>세션 상태 변경 Job은 concurrency와 관계없이 세션당 하나씩만 실행됩니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 * @param concurrency 동시 실행 한도 (0 이상, 0은 무제한)
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param drainGraceMs drain 유예 시간 (밀리초, 0 이상)
 * @param maxBulkItems 대량 작업 최대 항목 수 (1 이상)
 */
public record RuntimeConfig(
    int concurrency,
    int maxRetries,
    long drainGraceMs,
    int maxBulkItems
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=0(무제한), maxRetries=3, drainGraceMs=5000ms, maxBulkItems=1000</p>
     */
    public RuntimeConfig() {
        this(0, 3, 5000, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RuntimeConfig {
        if (concurrency < 0) {
            throw new IllegalArgumentException(
                "concurrency must be non-negative (current: " + concurrency + ")"
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (drainGraceMs < 0) {
            throw new IllegalArgumentException(
                "drainGraceMs must be non-negative (current: " + drainGraceMs + ")"
            );
        }
        if (maxBulkItems <= 0) {
            throw new IllegalArgumentException(
                "maxBulkItems must be positive (current: " + maxBulkItems + ")"
            );
        }
    }

    public boolean isUnbounded() {
        return concurrency == 0;
    }

    public RuntimeConfig withConcurrency(int concurrency) {
        return new RuntimeConfig(concurrency, maxRetries, drainGraceMs, maxBulkItems);
    }

    public RuntimeConfig withMaxRetries(int maxRetries) {
        return new RuntimeConfig(concurrency, maxRetries, drainGraceMs, maxBulkItems);
    }

    public RuntimeConfig withDrainGraceMs(long drainGraceMs) {
        return new RuntimeConfig(concurrency, maxRetries, drainGraceMs, maxBulkItems);
    }

    public RuntimeConfig withMaxBulkItems(int maxBulkItems) {
        return new RuntimeConfig(concurrency, maxRetries, drainGraceMs, maxBulkItems);
    }
}
