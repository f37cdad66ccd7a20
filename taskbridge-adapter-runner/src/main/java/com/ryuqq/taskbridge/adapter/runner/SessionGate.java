package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.error.JobCancelledException;
import com.ryuqq.taskbridge.core.executor.JobContext;
import com.ryuqq.taskbridge.core.model.SessionName;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 세션 상태 변경 Job 직렬화 게이트.
 *
 * <p>세션마다 공정(fair) 세마포어 하나를 두어, 같은 세션의 상태 변경 Job이
 * 도착 순서대로 한 번에 하나씩만 실행되도록 합니다.
 * 대기는 짧은 간격으로 나누어 수행되며 매 간격마다 Job 취소 여부를 확인합니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class SessionGate {

    private static final long POLL_INTERVAL_MS = 20;

    private final ConcurrentHashMap<SessionName, Semaphore> permits = new ConcurrentHashMap<>();

    /**
     * 세션 게이트 획득.
     *
     * @param session 세션
     * @param context 대기 중인 Job의 컨텍스트 (취소 확인용)
     * @throws JobCancelledException 대기 중 Job이 취소되거나 스레드가 인터럽트된 경우
     */
    public void acquire(SessionName session, JobContext context) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        Semaphore semaphore = permits.computeIfAbsent(session, key -> new Semaphore(1, true));
        try {
            while (true) {
                context.checkpoint();
                if (semaphore.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException(context.jobId());
        }
    }

    /**
     * 세션 게이트 반환.
     *
     * @param session 세션
     * @throws IllegalStateException 획득한 적 없는 세션인 경우
     */
    public void release(SessionName session) {
        Semaphore semaphore = permits.get(session);
        if (semaphore == null) {
            throw new IllegalStateException("Gate was never acquired for session: " + session);
        }
        semaphore.release();
    }
}
