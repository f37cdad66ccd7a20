package com.ryuqq.taskbridge.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobId 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class JobIdTest {

    @Test
    void generate_ProducesDistinctIds() {
        // Given
        Set<JobId> ids = new HashSet<>();

        // When
        for (int i = 0; i < 1000; i++) {
            ids.add(JobId.generate());
        }

        // Then
        assertEquals(1000, ids.size());
    }

    @Test
    void of_SameValue_AreEqual() {
        assertEquals(JobId.of("job-1"), JobId.of("job-1"));
        assertEquals(JobId.of("job-1").hashCode(), JobId.of("job-1").hashCode());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> JobId.of(" "));
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> JobId.of("a".repeat(65)));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> JobId.of("job/1"));
    }
}
