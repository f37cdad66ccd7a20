package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.model.IncomingMessage;
import com.ryuqq.taskbridge.core.spi.ProtocolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 개인 메시지 자동 응답기.
 *
 * <p>개인 채팅으로 들어온 메시지에만 응답하며, 응답은 직접 보내지 않고
 * {@link ReplySender}를 통해 SEND_MESSAGE Job으로 제출합니다.
 * 그래서 응답도 Rate Limiter를 거치고 Job 목록에 나타납니다.</p>
 *
 * <p>템플릿의 {@code {sender}}는 보낸 사람 ID로 치환됩니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
final class AutoResponder {

    private static final Logger log = LoggerFactory.getLogger(AutoResponder.class);

    static final String SENDER_PLACEHOLDER = "{sender}";

    /**
     * 응답 제출 경로.
     */
    @FunctionalInterface
    interface ReplySender {
        void send(String session, String target, String text);
    }

    private final ReplySender sender;

    AutoResponder(ReplySender sender) {
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        this.sender = sender;
    }

    /**
     * 자동 응답 시작. 이미 켜져 있으면 새 템플릿으로 교체합니다.
     *
     * @param slot 인증된 세션 슬롯
     * @param client 세션 클라이언트
     * @param template 응답 템플릿
     */
    void enable(SessionSlot slot, ProtocolClient client, String template) {
        disable(slot);
        ProtocolClient.Registration registration =
            client.onIncomingMessage(message -> onMessage(slot, template, message));
        slot.autoResponder(registration);
        log.info("Auto-responder enabled for session {}", slot.name());
    }

    /**
     * 자동 응답 중지. 켜져 있지 않으면 아무것도 하지 않습니다.
     *
     * @param slot 세션 슬롯
     */
    void disable(SessionSlot slot) {
        ProtocolClient.Registration registration = slot.autoResponder();
        if (registration == null) {
            return;
        }
        slot.autoResponder(null);
        registration.cancel();
        log.info("Auto-responder disabled for session {}", slot.name());
    }

    void onMessage(SessionSlot slot, String template, IncomingMessage message) {
        if (!message.privateChat()) {
            return;
        }
        String target = String.valueOf(message.senderId());
        try {
            sender.send(slot.name().getValue(), target, render(template, message));
        } catch (RuntimeException e) {
            log.warn("Auto-reply to {} on session {} was not dispatched: {}",
                target, slot.name(), e.getMessage());
        }
    }

    static String render(String template, IncomingMessage message) {
        return template.replace(SENDER_PLACEHOLDER, String.valueOf(message.senderId()));
    }
}
