package com.ryuqq.timeguard.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobId Value Object 테스트.
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
class JobIdTest {

    @Test
    void of_ValidValue_CreatesJobId() {
        // Given
        String value = "scan_1700000000000_abc123xyz";

        // When
        JobId jobId = JobId.of(value);

        // Then
        assertEquals(value, jobId.getValue());
        assertEquals(value, jobId.toString());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> JobId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> JobId.of("   ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> JobId.of(value));
    }

    @Test
    void of_CallerSuppliedValueWithAnyCharacters_KeptVerbatim() {
        // Given
        String value = "req:42/a.b @tenant#7";

        // When
        JobId jobId = JobId.of(value);

        // Then
        assertEquals(value, jobId.getValue());
    }

    @Test
    void of_MaxLengthValue_CreatesJobId() {
        // Given
        String value = "a".repeat(255);

        // When & Then
        assertEquals(255, JobId.of(value).getValue().length());
    }

    @Test
    void generate_ProducesPrefixedUniqueValues() {
        // Given
        Set<JobId> ids = new HashSet<>();

        // When
        for (int i = 0; i < 100; i++) {
            ids.add(JobId.generate());
        }

        // Then
        assertEquals(100, ids.size());
        assertTrue(ids.iterator().next().getValue().startsWith("scan-"));
    }

    @Test
    void equals_SameValue_AreEqual() {
        // Given
        JobId first = JobId.of("scan-1");
        JobId second = JobId.of("scan-1");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, JobId.of("scan-2"));
    }
}
