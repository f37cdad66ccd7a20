package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.application.bridge.TaskBridge;
import com.ryuqq.taskbridge.core.model.JobEvent;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.spi.JobListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 종료 전이마다 {@link RetentionPolicy}를 넘는 종료 Job 기록을 삭제하는 리스너.
 *
 * <p>기간을 넘긴 기록을 먼저 지우고, 남은 기록이 최대 개수를 넘으면 가장 먼저 끝난 것부터 지웁니다.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public final class RetentionSweeper implements JobListener {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final TaskBridge bridge;
    private final RetentionPolicy policy;
    private final Clock clock;

    public RetentionSweeper(TaskBridge bridge, RetentionPolicy policy, Clock clock) {
        if (bridge == null) {
            throw new IllegalArgumentException("bridge cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.bridge = bridge;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public void onEvent(JobEvent event) {
        if (event.isTransition() && event.snapshot().isTerminal()) {
            sweep();
        }
    }

    /**
     * 정책에 따라 종료 Job 기록 삭제.
     *
     * @return 삭제한 개수
     */
    public int sweep() {
        if (!policy.isEnabled()) {
            return 0;
        }
        List<JobSnapshot> terminal = new ArrayList<>();
        for (JobSnapshot snapshot : bridge.list(JobFilter.all())) {
            if (snapshot.isTerminal()) {
                terminal.add(snapshot);
            }
        }
        terminal.sort(Comparator.comparing(JobSnapshot::endedAt));

        List<JobSnapshot> expired = new ArrayList<>();
        if (policy.maxAgeMs() > 0) {
            Instant cutoff = clock.instant().minusMillis(policy.maxAgeMs());
            for (JobSnapshot snapshot : terminal) {
                if (snapshot.endedAt().isBefore(cutoff)) {
                    expired.add(snapshot);
                }
            }
            terminal.removeAll(expired);
        }
        if (policy.maxTerminalJobs() > 0 && terminal.size() > policy.maxTerminalJobs()) {
            expired.addAll(terminal.subList(0, terminal.size() - policy.maxTerminalJobs()));
        }

        int removed = 0;
        for (JobSnapshot snapshot : expired) {
            if (bridge.purge(snapshot.id())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Retention sweep purged {} terminal job(s)", removed);
        }
        return removed;
    }
}
