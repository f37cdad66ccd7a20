/**
 * Call pacing.
 *
 * <p>{@link com.ryuqq.taskbridge.core.protection.RateLimiter} keeps consecutive calls of the
 * same {@link com.ryuqq.taskbridge.core.model.ProtocolOperation} on the same session at least
 * {@code minDelayMs} apart. Jitter is only ever added on top of the minimum.</p>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.core.protection;
