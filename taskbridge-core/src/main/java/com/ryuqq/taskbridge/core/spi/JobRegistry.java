package com.ryuqq.taskbridge.core.spi;

import com.ryuqq.taskbridge.core.model.JobFilter;
import com.ryuqq.taskbridge.core.model.JobId;
import com.ryuqq.taskbridge.core.model.JobSnapshot;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Job registry SPI.
 *
 * <p>Index of every in-flight and finished job, keyed by {@link JobId}.</p>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>Never holds two jobs with the same id</li>
 *   <li>An id that was ever registered can never be registered again, even after purge</li>
 *   <li>Only terminal jobs can be purged</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: every mutation is internally synchronized</li>
 *   <li>Copy-on-read: returned snapshots are immutable; returned lists are copies</li>
 *   <li>Non-blocking: no method waits on I/O or on a job</li>
 * </ul>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
public interface JobRegistry {

    /**
     * Registers a new job.
     *
     * @param snapshot initial snapshot
     * @throws IllegalArgumentException if snapshot is null
     * @throws com.ryuqq.taskbridge.core.error.InvariantViolationException if the id is already known
     */
    void register(JobSnapshot snapshot);

    /**
     * Returns the current snapshot of a job.
     *
     * @param id job id
     * @return current snapshot
     * @throws IllegalArgumentException if id is null
     * @throws com.ryuqq.taskbridge.core.error.JobNotFoundException if no such job is registered
     */
    JobSnapshot get(JobId id);

    /**
     * Returns whether a job is currently registered.
     *
     * @param id job id
     * @return true if registered and not purged
     */
    boolean contains(JobId id);

    /**
     * Lists jobs matching the filter, oldest first.
     *
     * @param filter kind/state filter
     * @return a new list of snapshots
     */
    List<JobSnapshot> list(JobFilter filter);

    /**
     * Atomically replaces a job's snapshot.
     *
     * <p>The function runs while the registry holds the job's lock and must be fast.
     * Exceptions it throws propagate and leave the stored snapshot unchanged.</p>
     *
     * @param id job id
     * @param change function computing the new snapshot from the current one
     * @return the stored new snapshot
     * @throws com.ryuqq.taskbridge.core.error.JobNotFoundException if no such job is registered
     * @throws com.ryuqq.taskbridge.core.error.InvariantViolationException if the function changes the id
     */
    JobSnapshot update(JobId id, UnaryOperator<JobSnapshot> change);

    /**
     * Removes a terminal job.
     *
     * @param id job id
     * @return true if removed, false if not registered
     * @throws IllegalStateException if the job is not terminal
     */
    boolean purge(JobId id);

    /**
     * Number of registered jobs.
     *
     * @return count
     */
    int size();
}
