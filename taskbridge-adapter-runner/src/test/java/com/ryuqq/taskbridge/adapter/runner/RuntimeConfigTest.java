package com.ryuqq.taskbridge.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RuntimeConfig / RetentionPolicy 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class RuntimeConfigTest {

    @Test
    void defaultConstructor() {
        RuntimeConfig config = new RuntimeConfig();

        assertEquals(0, config.concurrency());
        assertTrue(config.isUnbounded());
        assertEquals(3, config.maxRetries());
        assertEquals(5000, config.drainGraceMs());
        assertEquals(1000, config.maxBulkItems());
    }

    @Test
    void withMethods_ReturnNewInstance() {
        RuntimeConfig config = new RuntimeConfig();

        RuntimeConfig changed = config.withConcurrency(4).withMaxRetries(1).withDrainGraceMs(100).withMaxBulkItems(10);

        assertEquals(new RuntimeConfig(4, 1, 100, 10), changed);
        assertFalse(changed.isUnbounded());
        assertEquals(new RuntimeConfig(), config);
    }

    @Test
    void invalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new RuntimeConfig(-1, 3, 5000, 1000));
        assertThrows(IllegalArgumentException.class, () -> new RuntimeConfig(0, -1, 5000, 1000));
        assertThrows(IllegalArgumentException.class, () -> new RuntimeConfig(0, 3, -1, 1000));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new RuntimeConfig(0, 3, 5000, 0));
        assertTrue(e.getMessage().contains("maxBulkItems"));
    }

    @Test
    void retentionPolicy_DefaultsAndKeepAll() {
        assertTrue(new RetentionPolicy().isEnabled());
        assertEquals(1000, new RetentionPolicy().maxTerminalJobs());
        assertFalse(RetentionPolicy.keepAll().isEnabled());
        assertTrue(RetentionPolicy.keepAll().withMaxAgeMs(1000).isEnabled());
        assertThrows(IllegalArgumentException.class, () -> new RetentionPolicy(-1, 0));
    }
}
