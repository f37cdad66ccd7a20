package com.ryuqq.taskbridge.core.model;

/**
 * 세션 슬롯의 고유 키.
 *
 * <p>세션 이름은 세션 자격 증명 파일명과 레이트 리미터 키로 함께 사용되므로
 * 공백과 경로 구분자를 허용하지 않습니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class SessionName {

    private static final int MAX_LENGTH = 128;

    private final String value;

    private SessionName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("SessionName length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "SessionName contains invalid characters (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * SessionName 생성.
     *
     * @param value 세션 이름
     * @return SessionName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionName of(String value) {
        return new SessionName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionName that = (SessionName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
