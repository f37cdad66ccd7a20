/**
 * In-memory job registry.
 *
 * <p>Provides {@link com.ryuqq.taskbridge.adapter.inmemory.registry.InMemoryJobRegistry},
 * the default task registry used by the runner.</p>
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.adapter.inmemory.registry;
