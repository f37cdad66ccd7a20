package com.ryuqq.taskbridge.core.model;

/**
 * 채팅 참가자 정보.
 *
 * @param id 사용자 ID
 * @param firstName 이름 (null 가능)
 * @param lastName 성 (null 가능)
 * @param username 사용자명 (null 가능)
 * @param phone 전화번호 (비공개인 경우 null)
 * @param bot 봇 계정 여부
 * @author TaskBridge Team
 * @since 1.0.0
 */
public record User(
    long id,
    String firstName,
    String lastName,
    String username,
    String phone,
    boolean bot
) {

    /**
     * 표시용 이름 (이름 + 성, 공백 정리).
     *
     * @return 표시 이름, 둘 다 없으면 빈 문자열
     */
    public String displayName() {
        String first = firstName == null ? "" : firstName;
        String last = lastName == null ? "" : lastName;
        return (first + " " + last).trim();
    }
}
