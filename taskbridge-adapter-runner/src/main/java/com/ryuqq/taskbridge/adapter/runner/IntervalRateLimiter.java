package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.model.ProtocolOperation;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.protection.RateLimiter;
import com.ryuqq.taskbridge.core.protection.RateLimiterConfig;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.LongUnaryOperator;

/**
 * (세션, 호출 종류)별 최소 간격 Rate Limiter.
 *
 * <p>키마다 마지막으로 예약된 호출 시각(나노초)을 기억하고, 다음 호출을 그 시각으로부터
 * 최소 {@code minDelayMs} 뒤로 예약합니다.</p>
 *
 * <p><strong>대기 시간 계산:</strong></p>
 * <pre>
 * base  = max(0, minDelay - (now - lastReserved))
 * delay = max(base, min(base + random(0, jitter), maxDelay))
 * </pre>
 * <p>jitter는 base 위에만 더해지므로 최소 간격을 줄이지 않습니다. 키의 첫 호출은 base가 0입니다.</p>
 *
 * <p>예약은 {@link ConcurrentHashMap#compute}로 키 단위 원자적으로 이루어지므로,
 * 같은 키에 동시에 예약해도 예약 시각 사이 간격은 항상 minDelay 이상입니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class IntervalRateLimiter implements RateLimiter {

    private final RateLimiterConfig config;
    private final LongSupplier clockNanos;
    private final LongUnaryOperator jitterSource;
    private final ConcurrentHashMap<Key, Long> lastReservedAt;

    /**
     * 기본 시계와 난수로 생성.
     *
     * @param config 기본 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public IntervalRateLimiter(RateLimiterConfig config) {
        this(config, System::nanoTime, bound -> ThreadLocalRandom.current().nextLong(bound + 1));
    }

    /**
     * 시계와 jitter 공급원을 주입해 생성.
     *
     * @param config 기본 설정
     * @param clockNanos 단조 증가 시계 (나노초)
     * @param jitterSource 상한(밀리초)을 받아 [0, 상한] 범위 값을 돌려주는 함수
     */
    IntervalRateLimiter(RateLimiterConfig config, LongSupplier clockNanos, LongUnaryOperator jitterSource) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clockNanos == null) {
            throw new IllegalArgumentException("clockNanos cannot be null");
        }
        if (jitterSource == null) {
            throw new IllegalArgumentException("jitterSource cannot be null");
        }
        this.config = config;
        this.clockNanos = clockNanos;
        this.jitterSource = jitterSource;
        this.lastReservedAt = new ConcurrentHashMap<>();
    }

    @Override
    public long reserve(SessionName session, ProtocolOperation operation) {
        return reserve(session, operation, config);
    }

    @Override
    public long reserve(SessionName session, ProtocolOperation operation, RateLimiterConfig override) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        RateLimiterConfig effective = override == null ? config : override;
        AtomicLong delayNanos = new AtomicLong();
        lastReservedAt.compute(new Key(session, operation), (key, last) -> {
            long now = clockNanos.getAsLong();
            long minNanos = TimeUnit.MILLISECONDS.toNanos(effective.minDelayMs());
            long base = last == null ? 0 : Math.max(0, minNanos - (now - last));
            long jitter = effective.jitterMs() > 0
                ? TimeUnit.MILLISECONDS.toNanos(jitterSource.applyAsLong(effective.jitterMs()))
                : 0;
            long wait = Math.max(base, Math.min(base + jitter, TimeUnit.MILLISECONDS.toNanos(effective.maxDelayMs())));
            delayNanos.set(wait);
            return now + wait;
        });
        // 밀리초 올림: 예약 시각보다 일찍 깨어나지 않도록
        return (delayNanos.get() + 999_999L) / 1_000_000L;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    private static final class Key {
        private final SessionName session;
        private final ProtocolOperation operation;

        Key(SessionName session, ProtocolOperation operation) {
            this.session = session;
            this.operation = operation;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return session.equals(key.session) && operation == key.operation;
        }

        @Override
        public int hashCode() {
            return Objects.hash(session, operation);
        }
    }
}
