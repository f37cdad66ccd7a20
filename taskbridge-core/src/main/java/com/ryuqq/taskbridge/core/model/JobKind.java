package com.ryuqq.taskbridge.core.model;

/**
 * Job 종류 태그.
 *
 * <p>세션 연결 상태를 바꾸는 종류({@link #mutatesSession()}가 true)는
 * 같은 세션에서 동시에 하나만 실행됩니다. 나머지는 읽기 계열로 취급되어
 * 같은 세션에서 겹쳐 실행될 수 있습니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public enum JobKind {

    SESSION_CREATE(true),
    SESSION_AUTHORIZE(true),
    SESSION_DISCONNECT(true),
    SEND_MESSAGE(false),
    BULK_SEND(false),
    PARSE_USERS(false),
    LIST_DIALOGS(false),
    VERIFY_PHONE(false),
    INVITE(false),
    AUTO_RESPOND_TOGGLE(true);

    private final boolean mutatesSession;

    JobKind(boolean mutatesSession) {
        this.mutatesSession = mutatesSession;
    }

    /**
     * 세션 상태 변경 계열인지 확인.
     *
     * @return 연결/인증/핸들러 등록처럼 세션 상태를 바꾸면 true
     */
    public boolean mutatesSession() {
        return mutatesSession;
    }
}
