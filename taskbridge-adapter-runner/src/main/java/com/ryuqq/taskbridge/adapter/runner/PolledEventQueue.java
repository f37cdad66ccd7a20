package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.model.JobEvent;
import com.ryuqq.taskbridge.core.spi.JobListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 화면 스레드가 자기 타이머로 꺼내 가는 이벤트 버퍼.
 *
 * <p>이벤트 스레드는 {@link #onEvent}로 넣기만 하고, 화면 스레드는 주기적으로
 * {@link #drain()} 또는 {@link #drainTo(Consumer)}를 호출합니다.
 * 용량을 넘으면 가장 오래된 이벤트부터 버립니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class PolledEventQueue implements JobListener {

    private static final Logger log = LoggerFactory.getLogger(PolledEventQueue.class);

    private final int capacity;
    private final ArrayDeque<JobEvent> buffer;
    private long dropped;

    public PolledEventQueue() {
        this(10_000);
    }

    public PolledEventQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>();
    }

    @Override
    public synchronized void onEvent(JobEvent event) {
        if (buffer.size() == capacity) {
            buffer.pollFirst();
            if (dropped++ == 0) {
                log.warn("Event queue full (capacity {}), dropping oldest events", capacity);
            }
        }
        buffer.addLast(event);
    }

    /**
     * 쌓인 이벤트를 모두 꺼냄.
     *
     * @return 도착 순서의 이벤트 목록
     */
    public synchronized List<JobEvent> drain() {
        List<JobEvent> events = new ArrayList<>(buffer);
        buffer.clear();
        return events;
    }

    /**
     * 쌓인 이벤트를 꺼내 handler에 넘김. handler는 잠금 밖에서 호출됩니다.
     *
     * @param handler 이벤트 처리기
     * @return 처리한 이벤트 수
     */
    public int drainTo(Consumer<JobEvent> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        List<JobEvent> events = drain();
        events.forEach(handler);
        return events.size();
    }

    public synchronized int size() {
        return buffer.size();
    }

    public synchronized long droppedCount() {
        return dropped;
    }
}
