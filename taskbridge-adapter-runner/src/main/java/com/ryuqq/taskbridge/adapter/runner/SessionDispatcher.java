package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.application.bridge.JobHandle;
import com.ryuqq.taskbridge.application.bridge.TaskBridge;
import com.ryuqq.taskbridge.application.dispatcher.BulkSummary;
import com.ryuqq.taskbridge.application.dispatcher.Dispatcher;
import com.ryuqq.taskbridge.application.dispatcher.ItemOutcome;
import com.ryuqq.taskbridge.application.dispatcher.ParseResult;
import com.ryuqq.taskbridge.application.dispatcher.SessionView;
import com.ryuqq.taskbridge.application.runtime.WorkerRuntime;
import com.ryuqq.taskbridge.core.error.JobCancelledException;
import com.ryuqq.taskbridge.core.error.PasswordRequiredException;
import com.ryuqq.taskbridge.core.error.TaskBridgeException;
import com.ryuqq.taskbridge.core.error.ValidationException;
import com.ryuqq.taskbridge.core.executor.JobContext;
import com.ryuqq.taskbridge.core.model.Dialog;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.ProtocolOperation;
import com.ryuqq.taskbridge.core.model.SessionCredentials;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.model.SessionStatus;
import com.ryuqq.taskbridge.core.model.User;
import com.ryuqq.taskbridge.core.outcome.Fail;
import com.ryuqq.taskbridge.core.protection.RateLimiterConfig;
import com.ryuqq.taskbridge.core.spi.JobListener;
import com.ryuqq.taskbridge.core.spi.JobRegistry;
import com.ryuqq.taskbridge.core.spi.ProtocolClient;
import com.ryuqq.taskbridge.core.spi.ProtocolClientFactory;
import com.ryuqq.taskbridge.core.statemachine.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 세션 기반 Dispatcher 구현체.
 *
 * <p>facade 연산마다 입력을 동기적으로 검증한 뒤, 프로토콜 호출을 담은 작업을
 * {@link TaskBridge}로 제출하고 즉시 {@link JobHandle}을 반환합니다.
 * 입력 오류만 {@link ValidationException}으로 호출자에게 던져지고,
 * 실행 중 오류는 모두 Job의 error로 보고됩니다.</p>
 *
 * <p>대량 작업은 항목마다 checkpoint와 Rate Limiter 대기를 거치며,
 * 항목 실패는 기록만 하고 나머지 항목을 계속 처리합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * SessionDispatcher dispatcher = SessionDispatcher.create(
 *     new InMemoryJobRegistry(), clientFactory, new RateLimiterConfig(), new RuntimeConfig(), new RetentionPolicy());
 *
 * JobHandle<SessionStatus> created = dispatcher.createSession("main", credentials);
 * // UI 타이머에서 dispatcher.getJobStatus(created.getJobId()) 로 상태 확인
 * }</pre>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class SessionDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(SessionDispatcher.class);

    private final TaskBridge bridge;
    private final WorkerRuntime runtime;
    private final ProtocolClientFactory clientFactory;
    private final RuntimeConfig config;
    private final Clock clock;
    private final SessionPool sessions;
    private final AutoResponder autoResponder;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public SessionDispatcher(TaskBridge bridge, WorkerRuntime runtime, ProtocolClientFactory clientFactory,
                             RuntimeConfig config, Clock clock) {
        if (bridge == null) {
            throw new IllegalArgumentException("bridge cannot be null");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (clientFactory == null) {
            throw new IllegalArgumentException("clientFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.bridge = bridge;
        this.runtime = runtime;
        this.clientFactory = clientFactory;
        this.config = config;
        this.clock = clock;
        this.sessions = new SessionPool();
        this.autoResponder = new AutoResponder(this::sendMessage);
    }

    /**
     * 기본 구성요소로 시작된 Dispatcher 생성.
     *
     * @param registry Job 저장소
     * @param clientFactory 세션별 프로토콜 클라이언트 생성기
     * @param rateLimits 기본 호출 간격
     * @param config 런타임 설정
     * @param retention 종료 Job 보존 정책
     * @return 실행 중인 Dispatcher
     */
    public static SessionDispatcher create(JobRegistry registry, ProtocolClientFactory clientFactory,
                                           RateLimiterConfig rateLimits, RuntimeConfig config,
                                           RetentionPolicy retention) {
        if (retention == null) {
            throw new IllegalArgumentException("retention cannot be null");
        }
        Clock clock = Clock.systemUTC();
        JobLedger ledger = new JobLedger(registry, clock);
        DedicatedWorkerRuntime runtime = new DedicatedWorkerRuntime(
            ledger, new IntervalRateLimiter(rateLimits), new BackoffCalculator(), config);
        runtime.start();
        DefaultTaskBridge bridge = new DefaultTaskBridge(runtime, ledger, clock);
        if (retention.isEnabled()) {
            bridge.addListener(new RetentionSweeper(bridge, retention, clock));
        }
        return new SessionDispatcher(bridge, runtime, clientFactory, config, clock);
    }

    public static SessionDispatcher create(JobRegistry registry, ProtocolClientFactory clientFactory) {
        return create(registry, clientFactory, new RateLimiterConfig(), new RuntimeConfig(), new RetentionPolicy());
    }

    // ---- sessions ----

    @Override
    public JobHandle<SessionStatus> createSession(String name, SessionCredentials credentials) {
        SessionName session = sessionName(name);
        if (credentials == null) {
            throw new ValidationException("credentials cannot be null");
        }
        SessionSlot slot = sessions.reserve(session, credentials);
        try {
            return bridge.dispatch(JobKind.SESSION_CREATE, session, context -> connect(context, slot));
        } catch (RuntimeException e) {
            slot.status(SessionStatus.DISCONNECTED);
            throw e;
        }
    }

    private SessionStatus connect(JobContext context, SessionSlot slot) {
        try {
            ProtocolClient client = clientFactory.create(slot.name(), slot.credentials());
            slot.attach(client);
            context.invoke(ProtocolOperation.CONNECT, () -> {
                client.connect();
                return null;
            });
            if (client.isAuthorized()) {
                slot.status(SessionStatus.AUTHENTICATED);
                return SessionStatus.AUTHENTICATED;
            }
            context.invoke(ProtocolOperation.SEND_CODE, () -> {
                client.sendCodeRequest(slot.credentials().phone());
                return null;
            });
            slot.status(SessionStatus.AWAITING_CODE);
            return SessionStatus.AWAITING_CODE;
        } catch (JobCancelledException e) {
            releaseClient(slot);
            slot.status(SessionStatus.DISCONNECTED);
            throw e;
        } catch (RuntimeException e) {
            releaseClient(slot);
            slot.status(SessionStatus.ERROR);
            throw e;
        }
    }

    /**
     * 생성에 실패한 세션의 클라이언트 연결 해제.
     *
     * <p>슬롯은 다음 생성 때 재사용되므로 연결이 남아 있으면 소유자가 없어집니다.
     * 해제 실패는 기록만 하고 원래 오류를 그대로 전달합니다.</p>
     */
    private void releaseClient(SessionSlot slot) {
        ProtocolClient client = slot.client();
        if (client == null) {
            return;
        }
        slot.attach(null);
        try {
            client.disconnect();
        } catch (RuntimeException e) {
            log.warn("Failed to disconnect client of session {} after failed create: {}", slot.name(), e.getMessage());
        }
    }

    @Override
    public JobHandle<SessionStatus> authorizeSession(String name, String code, String password) {
        SessionSlot slot = sessions.require(sessionName(name));
        requireText(code, "code");
        String secondFactor = password == null || password.isBlank() ? null : password;
        return bridge.dispatch(JobKind.SESSION_AUTHORIZE, slot.name(), context -> {
            ProtocolClient client = slot.requireClient();
            try {
                context.invoke(ProtocolOperation.SIGN_IN, () -> {
                    client.signIn(code, secondFactor);
                    return null;
                });
            } catch (PasswordRequiredException e) {
                slot.status(SessionStatus.AWAITING_PASSWORD);
                throw e;
            }
            slot.status(SessionStatus.AUTHENTICATED);
            return SessionStatus.AUTHENTICATED;
        });
    }

    @Override
    public JobHandle<SessionStatus> disconnectSession(String name) {
        SessionSlot slot = sessions.require(sessionName(name));
        return dispatchDisconnect(slot);
    }

    private JobHandle<SessionStatus> dispatchDisconnect(SessionSlot slot) {
        return bridge.dispatch(JobKind.SESSION_DISCONNECT, slot.name(), context -> {
            autoResponder.disable(slot);
            ProtocolClient client = slot.client();
            if (client != null) {
                context.invoke(ProtocolOperation.DISCONNECT, () -> {
                    client.disconnect();
                    return null;
                });
            }
            slot.status(SessionStatus.DISCONNECTED);
            return SessionStatus.DISCONNECTED;
        });
    }

    @Override
    public List<SessionView> listSessions() {
        return sessions.views();
    }

    // ---- messaging ----

    @Override
    public JobHandle<Void> sendMessage(String session, String target, String text) {
        SessionSlot slot = sessions.require(sessionName(session));
        requireText(target, "target");
        requireText(text, "text");
        return bridge.dispatch(JobKind.SEND_MESSAGE, slot.name(), context -> {
            ProtocolClient client = slot.requireAuthorizedClient();
            context.invoke(ProtocolOperation.SEND_MESSAGE, () -> {
                client.sendMessage(target, text);
                return null;
            });
            context.reportProgress(1, 1);
            return null;
        });
    }

    @Override
    public JobHandle<BulkSummary<Void>> bulkSend(String session, List<String> targets, String text,
                                                 RateLimiterConfig delay) {
        SessionSlot slot = sessions.require(sessionName(session));
        List<String> items = requireItems(targets, "targets");
        requireText(text, "text");
        return bridge.dispatch(JobKind.BULK_SEND, slot.name(), context -> {
            ProtocolClient client = slot.requireAuthorizedClient();
            return runBulk(context, items, target -> {
                context.invoke(ProtocolOperation.SEND_MESSAGE, delay, () -> {
                    client.sendMessage(target, text);
                    return null;
                });
                return null;
            });
        });
    }

    // ---- discovery ----

    @Override
    public JobHandle<List<User>> getParticipants(String session, String chat, int limit) {
        SessionSlot slot = sessions.require(sessionName(session));
        requireText(chat, "chat");
        requirePositive(limit, "limit");
        return bridge.dispatch(JobKind.PARSE_USERS, slot.name(), context -> {
            ProtocolClient client = slot.requireAuthorizedClient();
            List<User> users = context.invoke(ProtocolOperation.GET_PARTICIPANTS,
                () -> client.getParticipants(chat, limit));
            context.reportProgress(1, 1);
            return List.copyOf(users);
        });
    }

    @Override
    public JobHandle<ParseResult> parseUsers(String session, List<String> chats, int limit) {
        SessionSlot slot = sessions.require(sessionName(session));
        List<String> items = requireItems(chats, "chats");
        requirePositive(limit, "limit");
        return bridge.dispatch(JobKind.PARSE_USERS, slot.name(), context -> {
            ProtocolClient client = slot.requireAuthorizedClient();
            Map<Long, User> unique = new LinkedHashMap<>();
            BulkSummary<Integer> perChat = runBulk(context, items, chat -> {
                List<User> users = context.invoke(ProtocolOperation.GET_PARTICIPANTS,
                    () -> client.getParticipants(chat, limit));
                for (User user : users) {
                    unique.putIfAbsent(user.id(), user);
                }
                return users.size();
            });
            return new ParseResult(new ArrayList<>(unique.values()), perChat);
        });
    }

    @Override
    public JobHandle<List<Dialog>> listDialogs(String session, int limit) {
        SessionSlot slot = sessions.require(sessionName(session));
        requirePositive(limit, "limit");
        return bridge.dispatch(JobKind.LIST_DIALOGS, slot.name(), context -> {
            ProtocolClient client = slot.requireAuthorizedClient();
            return List.copyOf(context.invoke(ProtocolOperation.GET_DIALOGS, () -> client.getDialogs(limit)));
        });
    }

    // ---- bulk checks ----

    @Override
    public JobHandle<BulkSummary<Boolean>> verifyPhone(String session, List<String> numbers) {
        SessionSlot slot = sessions.require(sessionName(session));
        List<String> items = requireItems(numbers, "numbers");
        return bridge.dispatch(JobKind.VERIFY_PHONE, slot.name(), context -> {
            ProtocolClient client = slot.requireAuthorizedClient();
            return runBulk(context, items,
                number -> context.invoke(ProtocolOperation.CHECK_PHONE, () -> client.checkPhone(number)));
        });
    }

    @Override
    public JobHandle<BulkSummary<Void>> inviteUsers(String session, String chat, List<String> users) {
        SessionSlot slot = sessions.require(sessionName(session));
        requireText(chat, "chat");
        List<String> items = requireItems(users, "users");
        return bridge.dispatch(JobKind.INVITE, slot.name(), context -> {
            ProtocolClient client = slot.requireAuthorizedClient();
            return runBulk(context, items, user -> {
                context.invoke(ProtocolOperation.INVITE, () -> {
                    client.inviteToChat(chat, user);
                    return null;
                });
                return null;
            });
        });
    }

    // ---- auto-responder ----

    @Override
    public JobHandle<Boolean> toggleAutoRespond(String session, boolean enabled, String template) {
        SessionSlot slot = sessions.require(sessionName(session));
        if (enabled) {
            requireText(template, "template");
        }
        return bridge.dispatch(JobKind.AUTO_RESPOND_TOGGLE, slot.name(), context -> {
            if (enabled) {
                autoResponder.enable(slot, slot.requireAuthorizedClient(), template);
            } else {
                autoResponder.disable(slot);
            }
            return enabled;
        });
    }

    // ---- jobs ----

    @Override
    public JobState cancelJob(JobId id) {
        return bridge.cancel(id);
    }

    @Override
    public JobSnapshot getJobStatus(JobId id) {
        return bridge.poll(id);
    }

    @Override
    public <T> T awaitResult(JobHandle<T> handle, Duration timeout) throws TimeoutException, InterruptedException {
        return bridge.awaitResult(handle, timeout);
    }

    @Override
    public List<JobSnapshot> listJobs(JobKind kind, JobState state) {
        return bridge.list(new JobFilter(kind, state));
    }

    @Override
    public boolean purgeJob(JobId id) {
        return bridge.purge(id);
    }

    @Override
    public int purgeTerminal() {
        return bridge.purgeTerminal();
    }

    @Override
    public void addListener(JobListener listener) {
        bridge.addListener(listener);
    }

    @Override
    public void removeListener(JobListener listener) {
        bridge.removeListener(listener);
    }

    /**
     * 연결된 세션을 모두 끊고 런타임을 drain합니다. 실패는 로그만 남깁니다.
     */
    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<JobHandle<SessionStatus>> disconnects = new ArrayList<>();
        for (SessionSlot slot : sessions.all()) {
            if (slot.client() == null || slot.status() == SessionStatus.DISCONNECTED) {
                continue;
            }
            try {
                disconnects.add(dispatchDisconnect(slot));
            } catch (RuntimeException e) {
                log.warn("Could not dispatch disconnect for session {}: {}", slot.name(), e.getMessage());
            }
        }
        log.info("Shutting down: disconnecting {} session(s)", disconnects.size());

        long deadline = System.nanoTime() + config.drainGraceMs() * 1_000_000L;
        for (JobHandle<SessionStatus> handle : disconnects) {
            long remainingMs = Math.max(0, (deadline - System.nanoTime()) / 1_000_000L);
            try {
                bridge.awaitTerminal(handle.getJobId(), Duration.ofMillis(remainingMs));
            } catch (TimeoutException e) {
                log.warn("Disconnect of session {} did not finish in time", handle.getSession());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for disconnects");
                break;
            } catch (RuntimeException e) {
                log.warn("Disconnect of session {} failed: {}", handle.getSession(), e.getMessage());
            }
        }

        try {
            runtime.drain();
        } catch (RuntimeException e) {
            log.error("Fault while draining runtime during shutdown", e);
        }
    }

    /**
     * 항목별 작업 실행.
     */
    @FunctionalInterface
    interface ItemAction<R> {
        R apply(String item);
    }

    /**
     * 항목마다 checkpoint 후 action을 실행하고 결과를 모읍니다.
     * 항목 실패는 기록하고 다음 항목으로 진행하며, 취소만 전체를 중단합니다.
     */
    <R> BulkSummary<R> runBulk(JobContext context, List<String> items, ItemAction<R> action) {
        List<ItemOutcome<R>> outcomes = new ArrayList<>(items.size());
        context.reportProgress(0, items.size());
        for (int i = 0; i < items.size(); i++) {
            context.checkpoint();
            String item = items.get(i);
            try {
                R value = action.apply(item);
                outcomes.add(ItemOutcome.succeeded(item, value, clock.instant()));
            } catch (JobCancelledException e) {
                throw e;
            } catch (TaskBridgeException e) {
                log.warn("Item {} of job {} failed ({}): {}", item, context.jobId(), e.kind(), e.getMessage());
                outcomes.add(ItemOutcome.failed(item, Fail.from(e), clock.instant()));
            } catch (RuntimeException e) {
                log.error("Item {} of job {} failed with unexpected exception", item, context.jobId(), e);
                outcomes.add(ItemOutcome.failed(item, Fail.unexpected(e), clock.instant()));
            }
            context.reportProgress(i + 1, items.size());
        }
        return new BulkSummary<>(outcomes);
    }

    // ---- validation ----

    private static SessionName sessionName(String name) {
        requireText(name, "session name");
        try {
            return SessionName.of(name.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " cannot be blank");
        }
    }

    private static void requirePositive(int value, String field) {
        if (value <= 0) {
            throw new ValidationException(field + " must be positive (current: " + value + ")");
        }
    }

    private List<String> requireItems(List<String> values, String field) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException(field + " cannot be empty");
        }
        if (values.size() > config.maxBulkItems()) {
            throw new ValidationException(field + " exceeds the bulk limit of " + config.maxBulkItems()
                + " (current: " + values.size() + ")");
        }
        for (String value : values) {
            requireText(value, field + " entry");
        }
        return List.copyOf(values);
    }
}
