package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.application.dispatcher.SessionView;
import com.ryuqq.taskbridge.core.error.ValidationException;
import com.ryuqq.taskbridge.core.model.SessionCredentials;
import com.ryuqq.taskbridge.core.model.SessionName;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 세션 슬롯 모음.
 *
 * <p>이름별로 슬롯 하나만 존재합니다. DISCONNECTED 또는 ERROR 상태의 슬롯은
 * 같은 이름으로 다시 만들 때 재사용됩니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
final class SessionPool {

    private final ConcurrentHashMap<SessionName, SessionSlot> slots = new ConcurrentHashMap<>();

    /**
     * 새 세션 슬롯 예약.
     *
     * @param name 세션 이름
     * @param credentials 자격 증명
     * @return 예약된 슬롯
     * @throws ValidationException 사용 중인 세션 이름인 경우
     */
    SessionSlot reserve(SessionName name, SessionCredentials credentials) {
        SessionSlot slot = slots.compute(name, (key, existing) -> {
            if (existing != null && !existing.status().isReusable()) {
                throw new ValidationException(
                    "Session already exists: " + name + " (status: " + existing.status() + ")");
            }
            SessionSlot reserved = existing != null ? existing : new SessionSlot(name);
            reserved.reset(credentials);
            return reserved;
        });
        return slot;
    }

    /**
     * 세션 슬롯 조회.
     *
     * @param name 세션 이름
     * @return 슬롯
     * @throws ValidationException 없는 세션인 경우
     */
    SessionSlot require(SessionName name) {
        SessionSlot slot = slots.get(name);
        if (slot == null) {
            throw new ValidationException("Unknown session: " + name);
        }
        return slot;
    }

    List<SessionSlot> all() {
        return new ArrayList<>(slots.values());
    }

    List<SessionView> views() {
        List<SessionView> views = new ArrayList<>();
        for (SessionSlot slot : slots.values()) {
            views.add(new SessionView(slot.name(), slot.status(), slot.isAutoResponding()));
        }
        views.sort(Comparator.comparing(view -> view.name().getValue()));
        return views;
    }
}
