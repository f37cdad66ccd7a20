package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.model.JobEvent;
import com.ryuqq.taskbridge.core.spi.JobListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Job 이벤트 전달기.
 *
 * <p>전용 스레드 하나({@code taskbridge-events})가 발행 순서대로 리스너를 호출합니다.
 * 단일 스레드이므로 같은 Job의 이벤트는 상태 변경 순서대로 전달됩니다.</p>
 *
 * <p>리스너 예외는 로그로만 남기고 다음 리스너로 넘어갑니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;

    public EventDispatcher() {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "taskbridge-events");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(JobListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(JobListener listener) {
        listeners.remove(listener);
    }

    /**
     * 이벤트 발행 (비블로킹).
     *
     * <p>종료 후 발행된 이벤트는 버려집니다.</p>
     *
     * @param event 이벤트
     */
    public void publish(JobEvent event) {
        if (listeners.isEmpty()) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("Event for job {} dropped after shutdown", event.jobId());
        }
    }

    private void deliver(JobEvent event) {
        for (JobListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on event for job {} ({})",
                    listener, event.jobId(), event.snapshot().state(), e);
            }
        }
    }

    /**
     * 대기 중인 이벤트를 전달한 뒤 종료.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     */
    public void shutdown(long timeoutMs) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Event delivery did not finish within {}ms, dropping remaining events", timeoutMs);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
