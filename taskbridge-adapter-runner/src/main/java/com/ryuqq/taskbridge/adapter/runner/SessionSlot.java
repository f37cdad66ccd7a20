package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.error.FatalProtocolException;
import com.ryuqq.taskbridge.core.model.SessionCredentials;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.model.SessionStatus;
import com.ryuqq.taskbridge.core.spi.ProtocolClient;

/**
 * 세션 하나의 소유 슬롯.
 *
 * <p>프로토콜 클라이언트는 슬롯이 소유하고 워커 스레드에서만 호출됩니다.
 * 상태 필드는 UI 스레드가 읽을 수 있도록 volatile입니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
final class SessionSlot {

    private final SessionName name;
    private volatile SessionCredentials credentials;
    private volatile SessionStatus status = SessionStatus.UNAUTHENTICATED;
    private volatile ProtocolClient client;
    private volatile ProtocolClient.Registration autoResponder;

    SessionSlot(SessionName name) {
        this.name = name;
    }

    SessionName name() {
        return name;
    }

    SessionStatus status() {
        return status;
    }

    void status(SessionStatus status) {
        this.status = status;
    }

    SessionCredentials credentials() {
        return credentials;
    }

    /**
     * 재사용 슬롯 초기화 (새 자격 증명으로).
     */
    void reset(SessionCredentials credentials) {
        this.credentials = credentials;
        this.status = SessionStatus.UNAUTHENTICATED;
        this.client = null;
        this.autoResponder = null;
    }

    ProtocolClient client() {
        return client;
    }

    void attach(ProtocolClient client) {
        this.client = client;
    }

    /**
     * 연결된 클라이언트 반환.
     *
     * @throws FatalProtocolException 아직 연결되지 않은 경우
     */
    ProtocolClient requireClient() {
        ProtocolClient current = client;
        if (current == null) {
            throw new FatalProtocolException("Session " + name + " is not connected");
        }
        return current;
    }

    /**
     * 인증된 클라이언트 반환.
     *
     * @throws FatalProtocolException 인증되지 않은 경우
     */
    ProtocolClient requireAuthorizedClient() {
        if (status != SessionStatus.AUTHENTICATED) {
            throw new FatalProtocolException("Session " + name + " is not authenticated (status: " + status + ")");
        }
        return requireClient();
    }

    ProtocolClient.Registration autoResponder() {
        return autoResponder;
    }

    void autoResponder(ProtocolClient.Registration registration) {
        this.autoResponder = registration;
    }

    boolean isAutoResponding() {
        return autoResponder != null;
    }
}
