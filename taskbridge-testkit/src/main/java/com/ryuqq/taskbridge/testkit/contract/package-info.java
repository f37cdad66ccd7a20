/**
 * Reusable SPI contract suites.
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.testkit.contract;
