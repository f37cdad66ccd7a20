package com.ryuqq.taskbridge.core.spi;

import com.ryuqq.taskbridge.core.model.Dialog;
import com.ryuqq.taskbridge.core.model.IncomingMessage;
import com.ryuqq.taskbridge.core.model.User;

import java.util.List;
import java.util.function.Consumer;

/**
 * Messaging protocol client SPI.
 *
 * <p>One instance belongs to exactly one session slot. The core never inspects its internals
 * and only calls it from worker threads.</p>
 *
 * <p><strong>Error Contract:</strong></p>
 * <ul>
 *   <li>Network hiccups and flood waits: throw {@code TransientProtocolException}</li>
 *   <li>Authentication failures and bans: throw {@code FatalProtocolException}</li>
 *   <li>Two-step verification needed: throw {@code PasswordRequiredException}</li>
 * </ul>
 * <p>Any other exception is treated as an internal defect of the client.</p>
 *
 * <p><strong>Thread Safety:</strong> read-class calls (participants, dialogs, phone checks,
 * sends) may arrive concurrently from different jobs. Connection-state calls (connect,
 * sign-in, disconnect, handler registration) are never concurrent for one client.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public interface ProtocolClient {

    /**
     * Opens the network connection.
     */
    void connect();

    /**
     * Returns whether the stored session is already authorized.
     *
     * @return true if no sign-in is needed
     */
    boolean isAuthorized();

    /**
     * Requests a login code for the given phone number.
     *
     * @param phone phone number in international format
     */
    void sendCodeRequest(String phone);

    /**
     * Signs in with a login code and optional two-step password.
     *
     * @param code the received login code
     * @param password two-step password, or null
     */
    void signIn(String code, String password);

    /**
     * Sends a text message.
     *
     * @param target username, phone or numeric id of the recipient
     * @param text message text
     */
    void sendMessage(String target, String text);

    /**
     * Lists participants of a chat.
     *
     * @param chat chat username or id
     * @param limit maximum number of users
     * @return participants, at most {@code limit}
     */
    List<User> getParticipants(String chat, int limit);

    /**
     * Lists the account's dialogs.
     *
     * @param limit maximum number of dialogs
     * @return dialogs, at most {@code limit}
     */
    List<Dialog> getDialogs(int limit);

    /**
     * Checks whether a phone number belongs to a registered account.
     *
     * @param phone phone number
     * @return true if registered
     */
    boolean checkPhone(String phone);

    /**
     * Invites a user to a chat.
     *
     * @param chat chat username or id
     * @param user username or id of the user
     */
    void inviteToChat(String chat, String user);

    /**
     * Closes the connection. Calling it on a closed client has no effect.
     */
    void disconnect();

    /**
     * Subscribes to incoming messages.
     *
     * @param listener called on the client's own thread for each incoming message
     * @return a registration that removes the listener
     */
    Registration onIncomingMessage(Consumer<IncomingMessage> listener);

    /**
     * Handle returned by {@link #onIncomingMessage(Consumer)}.
     */
    @FunctionalInterface
    interface Registration {

        /**
         * Removes the listener. Idempotent.
         */
        void cancel();
    }
}
