package com.ryuqq.taskbridge.testkit.contract;

import com.ryuqq.taskbridge.core.error.ErrorKind;
import com.ryuqq.taskbridge.core.error.InvariantViolationException;
import com.ryuqq.taskbridge.core.error.JobNotFoundException;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.model.Progress;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.core.outcome.Fail;
import com.ryuqq.taskbridge.core.spi.JobRegistry;
import com.ryuqq.taskbridge.core.statemachine.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract suite for {@link JobRegistry} implementations.
 *
 * <p>Subclass it in the adapter's test sources and return a fresh registry from
 * {@link #createRegistry()}:</p>
 * <pre>
 * class InMemoryJobRegistryContractTest extends AbstractJobRegistryContractTest {
 *     {@literal @}Override
 *     protected JobRegistry createRegistry() {
 *         return new InMemoryJobRegistry();
 *     }
 * }
 * </pre>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public abstract class AbstractJobRegistryContractTest {

    protected static final SessionName SESSION = SessionName.of("contract");

    protected JobRegistry registry;

    /**
     * Creates the registry under test. Called before every test.
     *
     * @return an empty registry
     */
    protected abstract JobRegistry createRegistry();

    @BeforeEach
    void setUpRegistry() {
        registry = createRegistry();
    }

    @Test
    void register_후_get은_같은_스냅샷을_반환() {
        // given
        JobSnapshot snapshot = pending(JobKind.SEND_MESSAGE);

        // when
        registry.register(snapshot);

        // then
        assertThat(registry.get(snapshot.id())).isEqualTo(snapshot);
        assertThat(registry.contains(snapshot.id())).isTrue();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void 같은_id를_두_번_등록하면_불변식_위반() {
        // given
        JobSnapshot snapshot = pending(JobKind.SEND_MESSAGE);
        registry.register(snapshot);

        // when & then
        assertThatThrownBy(() -> registry.register(snapshot))
            .isInstanceOf(InvariantViolationException.class)
            .satisfies(e -> assertThat(((InvariantViolationException) e).kind()).isEqualTo(ErrorKind.INTERNAL_INVARIANT));
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void purge된_id도_재사용할_수_없음() {
        // given
        JobSnapshot snapshot = pending(JobKind.SEND_MESSAGE);
        registry.register(snapshot);
        registry.update(snapshot.id(), current -> current.cancelled(Instant.now()));
        assertThat(registry.purge(snapshot.id())).isTrue();

        // when & then
        assertThatThrownBy(() -> registry.register(snapshot))
            .isInstanceOf(InvariantViolationException.class);
        assertThat(registry.contains(snapshot.id())).isFalse();
    }

    @Test
    void 없는_Job_조회는_JobNotFoundException() {
        assertThatThrownBy(() -> registry.get(JobId.generate()))
            .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> registry.update(JobId.generate(), current -> current))
            .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void 종료되지_않은_Job은_purge_불가() {
        // given
        JobSnapshot snapshot = pending(JobKind.BULK_SEND);
        registry.register(snapshot);

        // when & then
        assertThatThrownBy(() -> registry.purge(snapshot.id()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("non-terminal");
        assertThat(registry.contains(snapshot.id())).isTrue();
    }

    @Test
    void 실패한_Job은_purge_가능() {
        // given
        JobSnapshot snapshot = failed(JobKind.INVITE);
        registry.register(snapshot);

        // when
        boolean removed = registry.purge(snapshot.id());

        // then
        assertThat(removed).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    void 없는_Job의_purge는_false() {
        assertThat(registry.purge(JobId.generate())).isFalse();
    }

    @Test
    void update는_새_스냅샷을_저장하고_반환() {
        // given
        JobSnapshot snapshot = pending(JobKind.PARSE_USERS);
        registry.register(snapshot);

        // when
        JobSnapshot running = registry.update(snapshot.id(),
            current -> current.transitionTo(JobState.RUNNING, Instant.now()));

        // then
        assertThat(running.state()).isEqualTo(JobState.RUNNING);
        assertThat(registry.get(snapshot.id())).isEqualTo(running);
    }

    @Test
    void update_함수가_예외를_던지면_기존_스냅샷_유지() {
        // given
        JobSnapshot snapshot = pending(JobKind.PARSE_USERS);
        registry.register(snapshot);

        // when
        assertThatThrownBy(() -> registry.update(snapshot.id(),
            current -> current.completed("x", Instant.now())))
            .isInstanceOf(IllegalStateException.class);

        // then
        assertThat(registry.get(snapshot.id())).isEqualTo(snapshot);
    }

    @Test
    void update로_id를_바꿀_수_없음() {
        // given
        JobSnapshot snapshot = pending(JobKind.PARSE_USERS);
        registry.register(snapshot);

        // when & then
        assertThatThrownBy(() -> registry.update(snapshot.id(), current -> pending(JobKind.PARSE_USERS)))
            .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void list는_종류와_상태로_필터링하고_등록순으로_반환() {
        // given
        JobSnapshot first = pending(JobKind.SEND_MESSAGE);
        JobSnapshot second = pending(JobKind.BULK_SEND);
        JobSnapshot third = pending(JobKind.SEND_MESSAGE);
        registry.register(first);
        registry.register(second);
        registry.register(third);
        registry.update(third.id(), current -> current.cancelled(Instant.now()));

        // when
        List<JobSnapshot> all = registry.list(JobFilter.all());
        List<JobSnapshot> sends = registry.list(JobFilter.byKind(JobKind.SEND_MESSAGE));
        List<JobSnapshot> pendingSends = registry.list(new JobFilter(JobKind.SEND_MESSAGE, JobState.PENDING));

        // then
        assertThat(all).extracting(JobSnapshot::id).containsExactly(first.id(), second.id(), third.id());
        assertThat(sends).extracting(JobSnapshot::id).containsExactly(first.id(), third.id());
        assertThat(pendingSends).extracting(JobSnapshot::id).containsExactly(first.id());
    }

    @Test
    void list는_복사본을_반환() {
        // given
        registry.register(pending(JobKind.SEND_MESSAGE));
        List<JobSnapshot> listed = registry.list(JobFilter.all());

        // when
        registry.register(pending(JobKind.SEND_MESSAGE));

        // then
        assertThat(listed).hasSize(1);
    }

    @Test
    void 진행률_갱신은_동시에_호출해도_유실되지_않음() throws InterruptedException {
        // given
        JobSnapshot snapshot = pending(JobKind.BULK_SEND);
        registry.register(snapshot);
        registry.update(snapshot.id(), current -> current.transitionTo(JobState.RUNNING, Instant.now()));
        int threads = 8;
        int perThread = 100;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger errors = new AtomicInteger();

        // when
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        registry.update(snapshot.id(), current -> current.withProgress(
                            new Progress(current.progress().completed() + 1, Progress.UNKNOWN_TOTAL)));
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        JobSnapshot result = registry.get(snapshot.id());
        assertThat(errors).hasValue(0);
        assertThat(result.progress().completed()).isEqualTo(threads * perThread);
        assertThat(result.sequence()).isEqualTo(1 + threads * perThread);
    }

    @Test
    void 동시_등록은_모두_보존됨() throws InterruptedException {
        // given
        int count = 500;
        List<JobSnapshot> snapshots = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            snapshots.add(pending(JobKind.VERIFY_PHONE));
        }
        ExecutorService executor = Executors.newFixedThreadPool(8);

        // when
        for (JobSnapshot snapshot : snapshots) {
            executor.submit(() -> registry.register(snapshot));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(registry.size()).isEqualTo(count);
    }

    /**
     * Creates a PENDING snapshot with a fresh id.
     *
     * @param kind job kind
     * @return snapshot
     */
    protected JobSnapshot pending(JobKind kind) {
        return JobSnapshot.pending(JobId.generate(), kind, SESSION, Instant.now());
    }

    /**
     * Creates a FAILED snapshot with a fresh id.
     *
     * @param kind job kind
     * @return snapshot
     */
    protected JobSnapshot failed(JobKind kind) {
        Instant now = Instant.now();
        return pending(kind)
            .transitionTo(JobState.RUNNING, now)
            .failed(Fail.of(ErrorKind.FATAL_PROTOCOL, "contract failure"), now);
    }
}
