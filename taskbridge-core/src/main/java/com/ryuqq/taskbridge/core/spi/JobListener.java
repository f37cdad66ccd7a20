package com.ryuqq.taskbridge.core.spi;

import com.ryuqq.taskbridge.core.model.JobEvent;

/**
 * Observer of job changes.
 *
 * <p>Events of one job arrive in increasing {@code sequence} order. No ordering is
 * guaranteed across different jobs. Delivery happens on a notification thread, never on
 * the thread that dispatched the job, so listeners that touch UI state must hand the event
 * over to their own thread.</p>
 *
 * <p>An exception thrown by a listener is logged and does not affect other listeners
 * or the job.</p>
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface JobListener {

    void onEvent(JobEvent event);
}
