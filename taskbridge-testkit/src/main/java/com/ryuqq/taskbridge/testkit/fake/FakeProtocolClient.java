package com.ryuqq.taskbridge.testkit.fake;

import com.ryuqq.taskbridge.core.error.FatalProtocolException;
import com.ryuqq.taskbridge.core.error.PasswordRequiredException;
import com.ryuqq.taskbridge.core.error.TransientProtocolException;
import com.ryuqq.taskbridge.core.model.Dialog;
import com.ryuqq.taskbridge.core.model.IncomingMessage;
import com.ryuqq.taskbridge.core.model.ProtocolOperation;
import com.ryuqq.taskbridge.core.model.User;
import com.ryuqq.taskbridge.core.spi.ProtocolClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Scriptable {@link ProtocolClient} double.
 *
 * <p>Records every call with its start and end time and keeps a gauge of concurrently running
 * connection-state calls, so tests can assert pacing and mutation exclusivity.</p>
 *
 * <p><strong>Scripting:</strong></p>
 * <ul>
 *   <li>{@link #latency(ProtocolOperation, long)}: each call of the operation takes that long</li>
 *   <li>{@link #failOn(ProtocolOperation, String, RuntimeException)}: every call with that argument fails</li>
 *   <li>{@link #failNext(ProtocolOperation, RuntimeException...)}: the next calls fail once each, in order</li>
 *   <li>{@link #requirePassword(String)} / {@link #expectCode(String)}: sign-in behavior</li>
 * </ul>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public class FakeProtocolClient implements ProtocolClient {

    private static final Set<ProtocolOperation> MUTATIONS = EnumSet.of(
        ProtocolOperation.CONNECT, ProtocolOperation.SEND_CODE,
        ProtocolOperation.SIGN_IN, ProtocolOperation.DISCONNECT);

    private final Map<ProtocolOperation, Long> latencies = Collections.synchronizedMap(new EnumMap<>(ProtocolOperation.class));
    private final Map<String, RuntimeException> failuresByArgument = new ConcurrentHashMap<>();
    private final Map<ProtocolOperation, ConcurrentLinkedDeque<RuntimeException>> nextFailures = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final List<Consumer<IncomingMessage>> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, List<User>> participants = new ConcurrentHashMap<>();
    private final Set<String> registeredPhones = ConcurrentHashMap.newKeySet();
    private final List<Dialog> dialogs = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlightMutations = new AtomicInteger();
    private final AtomicInteger maxConcurrentMutations = new AtomicInteger();

    private volatile boolean authorized;
    private volatile boolean connected;
    private volatile String expectedCode;
    private volatile String requiredPassword;

    // ========== scripting ==========

    public FakeProtocolClient latency(ProtocolOperation operation, long millis) {
        latencies.put(operation, millis);
        return this;
    }

    public FakeProtocolClient failOn(ProtocolOperation operation, String argument, RuntimeException failure) {
        failuresByArgument.put(key(operation, argument), failure);
        return this;
    }

    public FakeProtocolClient failNext(ProtocolOperation operation, RuntimeException... failures) {
        ConcurrentLinkedDeque<RuntimeException> queue =
            nextFailures.computeIfAbsent(operation, op -> new ConcurrentLinkedDeque<>());
        Collections.addAll(queue, failures);
        return this;
    }

    public FakeProtocolClient authorized(boolean value) {
        this.authorized = value;
        return this;
    }

    public FakeProtocolClient expectCode(String code) {
        this.expectedCode = code;
        return this;
    }

    public FakeProtocolClient requirePassword(String password) {
        this.requiredPassword = password;
        return this;
    }

    public FakeProtocolClient participants(String chat, List<User> users) {
        participants.put(chat, List.copyOf(users));
        return this;
    }

    public FakeProtocolClient registeredPhones(String... phones) {
        Collections.addAll(registeredPhones, phones);
        return this;
    }

    public FakeProtocolClient dialogs(List<Dialog> values) {
        dialogs.addAll(values);
        return this;
    }

    /**
     * Delivers an incoming message to every subscribed listener on the calling thread.
     *
     * @param message message to deliver
     */
    public void deliver(IncomingMessage message) {
        for (Consumer<IncomingMessage> listener : listeners) {
            listener.accept(message);
        }
    }

    // ========== ProtocolClient ==========

    @Override
    public void connect() {
        run(ProtocolOperation.CONNECT, "", "");
        connected = true;
    }

    @Override
    public boolean isAuthorized() {
        return authorized;
    }

    @Override
    public void sendCodeRequest(String phone) {
        run(ProtocolOperation.SEND_CODE, phone, "");
    }

    @Override
    public void signIn(String code, String password) {
        run(ProtocolOperation.SIGN_IN, code, password == null ? "" : "***");
        if (expectedCode != null && !expectedCode.equals(code)) {
            throw new FatalProtocolException("Invalid login code");
        }
        if (requiredPassword != null) {
            if (password == null) {
                throw new PasswordRequiredException();
            }
            if (!requiredPassword.equals(password)) {
                throw new FatalProtocolException("Invalid two-step password");
            }
        }
        authorized = true;
    }

    @Override
    public void sendMessage(String target, String text) {
        run(ProtocolOperation.SEND_MESSAGE, target, text);
    }

    @Override
    public List<User> getParticipants(String chat, int limit) {
        run(ProtocolOperation.GET_PARTICIPANTS, chat, String.valueOf(limit));
        List<User> users = participants.get(chat);
        if (users == null) {
            throw new FatalProtocolException("Chat not found: " + chat);
        }
        return users.stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public List<Dialog> getDialogs(int limit) {
        run(ProtocolOperation.GET_DIALOGS, "", String.valueOf(limit));
        return dialogs.stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public boolean checkPhone(String phone) {
        run(ProtocolOperation.CHECK_PHONE, phone, "");
        return registeredPhones.contains(phone);
    }

    @Override
    public void inviteToChat(String chat, String user) {
        run(ProtocolOperation.INVITE, user, chat);
    }

    @Override
    public void disconnect() {
        run(ProtocolOperation.DISCONNECT, "", "");
        connected = false;
    }

    @Override
    public Registration onIncomingMessage(Consumer<IncomingMessage> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ========== inspection ==========

    public List<Call> calls() {
        return new ArrayList<>(calls);
    }

    public List<Call> calls(ProtocolOperation operation) {
        return calls.stream().filter(call -> call.operation() == operation).collect(Collectors.toList());
    }

    public int maxConcurrentMutations() {
        return maxConcurrentMutations.get();
    }

    public int listenerCount() {
        return listeners.size();
    }

    public boolean isConnected() {
        return connected;
    }

    // ========== internals ==========

    private void run(ProtocolOperation operation, String argument, String detail) {
        boolean mutation = MUTATIONS.contains(operation);
        if (mutation) {
            int now = inFlightMutations.incrementAndGet();
            maxConcurrentMutations.accumulateAndGet(now, Math::max);
        }
        Instant startedAt = Instant.now();
        try {
            long latency = latencies.getOrDefault(operation, 0L);
            if (latency > 0) {
                sleep(latency);
            }
            RuntimeException failure = nextFailure(operation, argument);
            calls.add(new Call(operation, argument, detail, startedAt, Instant.now(), failure == null));
            if (failure != null) {
                throw failure;
            }
        } finally {
            if (mutation) {
                inFlightMutations.decrementAndGet();
            }
        }
    }

    private RuntimeException nextFailure(ProtocolOperation operation, String argument) {
        ConcurrentLinkedDeque<RuntimeException> queue = nextFailures.get(operation);
        if (queue != null) {
            RuntimeException scripted = queue.pollFirst();
            if (scripted != null) {
                return scripted;
            }
        }
        return failuresByArgument.get(key(operation, argument));
    }

    private static String key(ProtocolOperation operation, String argument) {
        return operation.name() + ':' + argument;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProtocolException("Interrupted during simulated network call", e);
        }
    }

    /**
     * Recorded call.
     *
     * @param operation operation
     * @param argument main argument (target, phone, chat, user, code)
     * @param detail secondary argument (text, limit, chat)
     * @param startedAt call start
     * @param finishedAt call end
     * @param succeeded whether the call returned normally
     */
    public record Call(
        ProtocolOperation operation,
        String argument,
        String detail,
        Instant startedAt,
        Instant finishedAt,
        boolean succeeded
    ) {
    }
}
