package com.ryuqq.taskbridge.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>같은 세션의 같은 종류 호출 사이 간격을 제어합니다.</p>
 * <ul>
 *   <li>minDelayMs: 연속 호출 사이 최소 간격. 항상 보장됨</li>
 *   <li>jitterMs: 최소 간격 위에 더해지는 무작위 지연 상한 (가산만 가능)</li>
 *   <li>maxDelayMs: 한 번의 대기 시간 상한. minDelayMs 이상이어야 함</li>
 * </ul>
 *
 * @param minDelayMs 최소 간격 (밀리초, 0 이상)
 * @param maxDelayMs 최대 대기 (밀리초, minDelayMs 이상)
 * @param jitterMs 지터 상한 (밀리초, 0 이상)
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record RateLimiterConfig(long minDelayMs, long maxDelayMs, long jitterMs) {

    private static final RateLimiterConfig NONE = new RateLimiterConfig(0, 0, 0);

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if minDelayMs or jitterMs is negative
     * @throws IllegalArgumentException if maxDelayMs is less than minDelayMs
     */
    public RateLimiterConfig {
        if (minDelayMs < 0) {
            throw new IllegalArgumentException("minDelayMs must be non-negative (current: " + minDelayMs + ")");
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= minDelayMs (max: " + maxDelayMs + ", min: " + minDelayMs + ")");
        }
        if (jitterMs < 0) {
            throw new IllegalArgumentException("jitterMs must be non-negative (current: " + jitterMs + ")");
        }
    }

    /**
     * 기본 설정 (최소 1초, 지터 0.5초, 최대 5초).
     */
    public RateLimiterConfig() {
        this(1000, 5000, 500);
    }

    /**
     * 지연 없는 설정.
     *
     * @return 모든 값이 0인 설정
     */
    public static RateLimiterConfig none() {
        return NONE;
    }

    /**
     * 고정 간격 설정 (지터 없음).
     *
     * @param delayMs 최소 간격이자 최대 대기
     * @return 설정
     */
    public static RateLimiterConfig fixed(long delayMs) {
        return new RateLimiterConfig(delayMs, delayMs, 0);
    }

    public RateLimiterConfig withMinDelayMs(long newMinDelayMs) {
        return new RateLimiterConfig(newMinDelayMs, Math.max(maxDelayMs, newMinDelayMs), jitterMs);
    }

    public RateLimiterConfig withMaxDelayMs(long newMaxDelayMs) {
        return new RateLimiterConfig(minDelayMs, newMaxDelayMs, jitterMs);
    }

    public RateLimiterConfig withJitterMs(long newJitterMs) {
        return new RateLimiterConfig(minDelayMs, maxDelayMs, newJitterMs);
    }
}
