/**
 * Test doubles for the protocol client SPI.
 *
 * @since 1.0.0
 * @author TaskBridge Team
 */
package com.ryuqq.taskbridge.testkit.fake;
