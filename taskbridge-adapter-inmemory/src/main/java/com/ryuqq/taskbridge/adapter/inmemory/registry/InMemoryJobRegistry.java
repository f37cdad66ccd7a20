package com.ryuqq.taskbridge.adapter.inmemory.registry;

import com.ryuqq.taskbridge.core.error.InvariantViolationException;
import com.ryuqq.taskbridge.core.error.JobNotFoundException;
import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.spi.JobRegistry;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link JobRegistry} SPI.
 *
 * <p>Snapshots are immutable, so the map values can be handed out directly; every mutation
 * replaces the value through {@link ConcurrentHashMap#compute}, which serializes writers per key.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>jobs:</strong> ConcurrentHashMap&lt;JobId, Entry&gt; - current snapshot plus registration order (O(1) access)</li>
 *   <li><strong>issuedIds:</strong> concurrent key set - every id ever registered, kept after purge</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>{@code issuedIds} grows with every registered job (one UUID string per job)</li>
 * </ul>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public class InMemoryJobRegistry implements JobRegistry {

    private final ConcurrentHashMap<JobId, Entry> jobs;
    private final Set<JobId> issuedIds;
    private final AtomicLong registrationCounter;

    /**
     * Creates an empty registry.
     */
    public InMemoryJobRegistry() {
        this.jobs = new ConcurrentHashMap<>();
        this.issuedIds = ConcurrentHashMap.newKeySet();
        this.registrationCounter = new AtomicLong();
    }

    @Override
    public void register(JobSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (!issuedIds.add(snapshot.id())) {
            throw new InvariantViolationException("Duplicate job id: " + snapshot.id().getValue());
        }
        jobs.put(snapshot.id(), new Entry(registrationCounter.incrementAndGet(), snapshot));
    }

    @Override
    public JobSnapshot get(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Entry entry = jobs.get(id);
        if (entry == null) {
            throw new JobNotFoundException(id);
        }
        return entry.snapshot;
    }

    @Override
    public boolean contains(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return jobs.containsKey(id);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Ordered by registration order, which matches dispatch order.</p>
     */
    @Override
    public List<JobSnapshot> list(JobFilter filter) {
        JobFilter effective = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
                .filter(entry -> effective.matches(entry.snapshot))
                .sorted(Comparator.comparingLong(entry -> entry.order))
                .map(entry -> entry.snapshot)
                .collect(Collectors.toList());
    }

    @Override
    public JobSnapshot update(JobId id, UnaryOperator<JobSnapshot> change) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (change == null) {
            throw new IllegalArgumentException("change cannot be null");
        }
        Entry updated = jobs.compute(id, (key, current) -> {
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            JobSnapshot next = change.apply(current.snapshot);
            if (next == null) {
                throw new InvariantViolationException("Update returned null snapshot for job: " + id.getValue());
            }
            if (!next.id().equals(id)) {
                throw new InvariantViolationException(
                    "Update changed job id: " + id.getValue() + " → " + next.id().getValue());
            }
            return new Entry(current.order, next);
        });
        return updated.snapshot;
    }

    @Override
    public boolean purge(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        AtomicBoolean removed = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, current) -> {
            if (!current.snapshot.isTerminal()) {
                throw new IllegalStateException(
                    "Cannot purge non-terminal job: " + id.getValue() + " (state: " + current.snapshot.state() + ")");
            }
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    @Override
    public int size() {
        return jobs.size();
    }

    /**
     * Clears all jobs, keeping the issued-id history.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        jobs.clear();
    }

    /**
     * Registered snapshot with its registration order.
     */
    private static final class Entry {
        private final long order;
        private final JobSnapshot snapshot;

        Entry(long order, JobSnapshot snapshot) {
            this.order = order;
            this.snapshot = snapshot;
        }
    }
}
