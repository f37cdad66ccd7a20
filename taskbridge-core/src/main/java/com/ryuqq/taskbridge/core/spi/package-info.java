/**
 * Service provider interfaces.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskbridge.core.spi.ProtocolClient} - external messaging capability, one per session</li>
 *   <li>{@link com.ryuqq.taskbridge.core.spi.ProtocolClientFactory} - creates clients for new sessions</li>
 *   <li>{@link com.ryuqq.taskbridge.core.spi.JobRegistry} - index of jobs (task registry)</li>
 *   <li>{@link com.ryuqq.taskbridge.core.spi.JobListener} - job change observer</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.core.spi;
