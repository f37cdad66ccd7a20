/**
 * Error taxonomy.
 *
 * <p>Every exception here is unchecked and carries an
 * {@link com.ryuqq.taskbridge.core.error.ErrorKind}. Only
 * {@link com.ryuqq.taskbridge.core.error.ValidationException} reaches the caller of a
 * dispatcher operation directly; the rest are caught at the work-unit boundary and
 * recorded as the job's failure.</p>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.core.error;
