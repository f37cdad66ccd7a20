/**
 * Job state machine package.
 *
 * <p>This package implements the lifecycle rules every job follows between dispatch
 * and its terminal state.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskbridge.core.statemachine.JobState} - Job lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.taskbridge.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING (worker picks the job up)
 * PENDING → CANCELLED (cancel before start)
 * RUNNING → COMPLETED | FAILED | CANCELLED
 * RUNNING → CANCELLING (cancel requested)
 * CANCELLING → CANCELLED (checkpoint reached)
 *
 * Forbidden:
 * - COMPLETED / FAILED / CANCELLED → * (terminal state)
 * - CANCELLING → COMPLETED | FAILED
 * </pre>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.core.statemachine;
