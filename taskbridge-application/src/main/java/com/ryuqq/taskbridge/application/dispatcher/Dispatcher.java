package com.ryuqq.taskbridge.application.dispatcher;

import com.ryuqq.taskbridge.application.bridge.JobHandle;
import com.ryuqq.taskbridge.core.model.Dialog;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.SessionCredentials;
import com.ryuqq.taskbridge.core.model.SessionStatus;
import com.ryuqq.taskbridge.core.model.User;
import com.ryuqq.taskbridge.core.protection.RateLimiterConfig;
import com.ryuqq.taskbridge.core.spi.JobListener;
import com.ryuqq.taskbridge.core.statemachine.JobState;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * UI와 헤드리스 호출자가 사용하는 작업 퍼사드.
 *
 * <p>각 연산은 입력을 검증한 뒤 Job 하나를 디스패치하고 즉시 핸들을 반환합니다.
 * 입력이 잘못되면 {@link com.ryuqq.taskbridge.core.error.ValidationException}을 동기적으로 던지며
 * 이 경우 Job은 생성되지 않습니다. 그 밖의 실패는 모두 Job의 오류로 보고됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * JobHandle&lt;SessionStatus&gt; created = dispatcher.createSession("main", credentials);
 * // ... 인증 코드 수신
 * dispatcher.authorizeSession("main", "12345", null);
 *
 * JobHandle&lt;BulkSummary&lt;Void&gt;&gt; bulk =
 *     dispatcher.bulkSend("main", List.of("@a", "@b"), "hello", RateLimiterConfig.fixed(2000));
 * </pre>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * 세션 슬롯을 만들고 연결.
     *
     * <p>저장된 세션이 이미 인증되어 있으면 AUTHENTICATED, 아니면 인증 코드를 요청하고 AWAITING_CODE로 끝납니다.</p>
     *
     * @param name 세션 이름
     * @param credentials API 자격 증명
     * @return 최종 세션 상태를 결과로 갖는 핸들
     */
    JobHandle<SessionStatus> createSession(String name, SessionCredentials credentials);

    /**
     * 인증 코드(와 선택적 2단계 비밀번호)로 로그인.
     *
     * @param name 세션 이름
     * @param code 인증 코드
     * @param password 2단계 비밀번호 (없으면 null)
     * @return 최종 세션 상태를 결과로 갖는 핸들
     */
    JobHandle<SessionStatus> authorizeSession(String name, String code, String password);

    /**
     * 연결 종료.
     *
     * @param name 세션 이름
     * @return DISCONNECTED를 결과로 갖는 핸들
     */
    JobHandle<SessionStatus> disconnectSession(String name);

    JobHandle<Void> sendMessage(String session, String target, String text);

    /**
     * 여러 대상에게 같은 메시지 전송.
     *
     * <p>항목마다 레이트 리미터 차례를 기다리며, 한 항목의 실패는 나머지를 멈추지 않습니다.</p>
     *
     * @param session 세션 이름
     * @param targets 대상 목록
     * @param text 본문
     * @param delay 전송 간격 설정 (null이면 기본 설정)
     * @return 항목별 결과 요약을 결과로 갖는 핸들
     */
    JobHandle<BulkSummary<Void>> bulkSend(String session, List<String> targets, String text, RateLimiterConfig delay);

    JobHandle<List<User>> getParticipants(String session, String chat, int limit);

    /**
     * 여러 채팅의 참가자를 모아 중복 제거.
     *
     * @param session 세션 이름
     * @param chats 채팅 목록
     * @param limit 채팅당 최대 사용자 수
     * @return 수집 결과를 갖는 핸들
     */
    JobHandle<ParseResult> parseUsers(String session, List<String> chats, int limit);

    JobHandle<List<Dialog>> listDialogs(String session, int limit);

    /**
     * 전화번호 가입 여부 확인.
     *
     * @param session 세션 이름
     * @param numbers 전화번호 목록
     * @return 번호별 가입 여부를 갖는 핸들
     */
    JobHandle<BulkSummary<Boolean>> verifyPhone(String session, List<String> numbers);

    JobHandle<BulkSummary<Void>> inviteUsers(String session, String chat, List<String> users);

    /**
     * 자동 응답 켜기/끄기.
     *
     * <p>켜져 있으면 1:1 대화로 들어온 메시지마다 템플릿 응답을 SEND_MESSAGE Job으로 보냅니다.
     * 템플릿의 {@code {sender}}는 발신자 ID로 치환됩니다.</p>
     *
     * @param session 세션 이름
     * @param enabled 활성화 여부
     * @param template 응답 템플릿 (활성화 시 필수)
     * @return 적용 후 활성화 여부를 갖는 핸들
     */
    JobHandle<Boolean> toggleAutoRespond(String session, boolean enabled, String template);

    List<SessionView> listSessions();

    JobState cancelJob(JobId id);

    JobSnapshot getJobStatus(JobId id);

    /**
     * Job 결과 대기 (UI 스레드가 아닌 호출자 전용).
     *
     * <p>시간이 초과되어도 Job은 계속 실행됩니다.</p>
     *
     * @param handle Job 핸들
     * @param timeout 최대 대기 시간
     * @param <T> 결과 타입
     * @return 결과 값
     * @throws TimeoutException 시간 내에 종료되지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트된 경우
     * @throws com.ryuqq.taskbridge.core.error.JobFailedException Job이 실패한 경우
     * @throws com.ryuqq.taskbridge.core.error.JobCancelledException Job이 취소된 경우
     */
    <T> T awaitResult(JobHandle<T> handle, Duration timeout) throws TimeoutException, InterruptedException;

    /**
     * Job 목록.
     *
     * @param kind 종류 조건 (null이면 전체)
     * @param state 상태 조건 (null이면 전체)
     * @return 스냅샷 목록
     */
    List<JobSnapshot> listJobs(JobKind kind, JobState state);

    boolean purgeJob(JobId id);

    int purgeTerminal();

    void addListener(JobListener listener);

    void removeListener(JobListener listener);

    /**
     * 모든 세션의 연결을 끊고 런타임을 종료.
     *
     * <p>예외를 던지지 않으며, 실패는 로그로만 남깁니다.</p>
     */
    void shutdown();
}
