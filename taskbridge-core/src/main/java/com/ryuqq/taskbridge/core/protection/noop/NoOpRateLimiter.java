package com.ryuqq.taskbridge.core.protection.noop;

import com.ryuqq.taskbridge.core.model.ProtocolOperation;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.protection.RateLimiter;
import com.ryuqq.taskbridge.core.protection.RateLimiterConfig;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>항상 즉시 통과시킵니다. 레이트 리밋 없이 실행하거나 테스트에서 지연을 없앨 때 사용합니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    @Override
    public long reserve(SessionName session, ProtocolOperation operation) {
        return 0;
    }

    @Override
    public long reserve(SessionName session, ProtocolOperation operation, RateLimiterConfig override) {
        return 0;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return RateLimiterConfig.none();
    }
}
