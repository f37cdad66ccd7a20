package com.ryuqq.taskbridge.core.model;

/**
 * 세션 생성에 필요한 API 자격 증명.
 *
 * <p>코어는 이 값을 해석하지 않고 {@code ProtocolClientFactory}에 그대로 전달합니다.
 * {@link #toString()}은 apiHash를 마스킹합니다.</p>
 *
 * @param apiId API ID (양수)
 * @param apiHash API Hash
 * @param phone 인증 코드를 받을 전화번호
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record SessionCredentials(int apiId, String apiHash, String phone) {

    public SessionCredentials {
        if (apiId <= 0) {
            throw new IllegalArgumentException("apiId must be positive (current: " + apiId + ")");
        }
        if (apiHash == null || apiHash.isBlank()) {
            throw new IllegalArgumentException("apiHash cannot be null or blank");
        }
        if (phone == null || phone.isBlank()) {
            throw new IllegalArgumentException("phone cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "SessionCredentials{apiId=" + apiId + ", apiHash=***, phone=" + phone + "}";
    }
}
