/**
 * Thread-backed runtime adapter.
 *
 * <p>Wires the worker runtime, task bridge and session dispatcher:</p>
 * <ul>
 *   <li>{@link com.ryuqq.taskbridge.adapter.runner.DedicatedWorkerRuntime}: intake thread plus worker pool</li>
 *   <li>{@link com.ryuqq.taskbridge.adapter.runner.DefaultTaskBridge}: dispatch, poll, await, cancel</li>
 *   <li>{@link com.ryuqq.taskbridge.adapter.runner.SessionDispatcher}: user-facing operations as jobs</li>
 *   <li>{@link com.ryuqq.taskbridge.adapter.runner.IntervalRateLimiter}: per-session call spacing</li>
 * </ul>
 *
 * <p>Start with {@link com.ryuqq.taskbridge.adapter.runner.SessionDispatcher#create}.</p>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.adapter.runner;
