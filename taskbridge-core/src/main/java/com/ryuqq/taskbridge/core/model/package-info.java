/**
 * Core value types.
 *
 * <p>Identifiers ({@link com.ryuqq.taskbridge.core.model.JobId},
 * {@link com.ryuqq.taskbridge.core.model.SessionName}), the immutable
 * {@link com.ryuqq.taskbridge.core.model.JobSnapshot} that is the only job representation
 * shared between threads, and the plain data returned by protocol calls.</p>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.core.model;
