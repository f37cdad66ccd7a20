package com.ryuqq.taskbridge.core.spi;

import com.ryuqq.taskbridge.core.model.SessionCredentials;
import com.ryuqq.taskbridge.core.model.SessionName;

/**
 * Creates a {@link ProtocolClient} for a session slot.
 *
 * <p>Loading of stored session files happens inside the factory; the core only hands over
 * the name and credentials.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProtocolClientFactory {

    /**
     * Creates an unconnected client.
     *
     * @param session session name, also the key of its stored credentials
     * @param credentials API credentials
     * @return a new client
     */
    ProtocolClient create(SessionName session, SessionCredentials credentials);
}
