/**
 * Work-unit outcomes.
 *
 * <p>{@link com.ryuqq.taskbridge.core.outcome.Outcome} is sealed over
 * {@link com.ryuqq.taskbridge.core.outcome.Ok},
 * {@link com.ryuqq.taskbridge.core.outcome.Fail} and
 * {@link com.ryuqq.taskbridge.core.outcome.Cancelled}. The worker converts whatever a work
 * unit returns or throws into one of them; nothing else crosses the thread boundary.</p>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.core.outcome;
