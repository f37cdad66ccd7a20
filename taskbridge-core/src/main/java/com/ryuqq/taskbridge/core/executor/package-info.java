/**
 * Work-unit contracts.
 *
 * <p>A {@link com.ryuqq.taskbridge.core.executor.WorkUnit} is the code a job runs;
 * {@link com.ryuqq.taskbridge.core.executor.JobContext} is what it gets to observe
 * cancellation, pace its calls and report progress.</p>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.core.executor;
