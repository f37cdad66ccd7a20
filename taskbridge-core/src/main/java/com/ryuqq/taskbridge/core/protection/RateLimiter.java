package com.ryuqq.taskbridge.core.protection;

import com.ryuqq.taskbridge.core.model.ProtocolOperation;
import com.ryuqq.taskbridge.core.model.SessionName;

/**
 * Rate Limiter SPI.
 *
 * <p>외부 서비스의 어뷰징 탐지를 피하기 위해 같은 세션에서 같은 종류의 호출이
 * 최소 간격 이상 떨어지도록 강제합니다.</p>
 *
 * <p>Limiter는 직접 잠들지 않습니다. {@link #reserve}로 다음 차례를 예약하고
 * 기다려야 할 시간을 돌려주면, 호출한 작업 단위가 취소 가능한 방식으로 그만큼 대기합니다.
 * 따라서 대기는 호출한 작업 단위만 멈추고 런타임 전체를 멈추지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * long waitMs = limiter.reserve(session, ProtocolOperation.SEND_MESSAGE);
 * context.pause(waitMs);   // 취소 체크포인트 포함
 * client.sendMessage(target, text);
 * }</pre>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 기본 설정으로 다음 호출 시각 예약.
     *
     * @param session 세션
     * @param operation 호출 종류
     * @return 호출 전에 기다려야 할 시간 (밀리초, 0 이상)
     */
    long reserve(SessionName session, ProtocolOperation operation);

    /**
     * 호출별 설정으로 다음 호출 시각 예약 (예: 대량 전송의 delay_cfg).
     *
     * @param session 세션
     * @param operation 호출 종류
     * @param override 이 호출에 적용할 설정
     * @return 호출 전에 기다려야 할 시간 (밀리초, 0 이상)
     */
    long reserve(SessionName session, ProtocolOperation operation, RateLimiterConfig override);

    /**
     * 기본 설정 조회.
     *
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig();
}
