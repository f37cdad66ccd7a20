package com.ryuqq.taskbridge.testkit.fake;

import com.ryuqq.taskbridge.core.model.SessionCredentials;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.spi.ProtocolClient;
import com.ryuqq.taskbridge.core.spi.ProtocolClientFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ProtocolClientFactory} handing out {@link FakeProtocolClient}s.
 *
 * <p>Tests can {@link #preset} a scripted client for a session before creating it;
 * otherwise a fresh unscripted client is returned.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public class FakeProtocolClientFactory implements ProtocolClientFactory {

    private final Map<SessionName, FakeProtocolClient> clients = new ConcurrentHashMap<>();

    public FakeProtocolClientFactory preset(SessionName session, FakeProtocolClient client) {
        clients.put(session, client);
        return this;
    }

    @Override
    public ProtocolClient create(SessionName session, SessionCredentials credentials) {
        return clients.computeIfAbsent(session, name -> new FakeProtocolClient());
    }

    /**
     * Returns the client created or preset for a session.
     *
     * @param session session name
     * @return the client, or null if none
     */
    public FakeProtocolClient client(SessionName session) {
        return clients.get(session);
    }
}
