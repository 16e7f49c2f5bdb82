package com.ryuqq.olympus.core.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Guid 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
class GuidTest {

    @Test
    void generate_ProducesUniqueUuidValues() {
        // When
        Guid first = Guid.generate();
        Guid second = Guid.generate();

        // Then
        assertNotEquals(first, second);
        assertEquals(4, UUID.fromString(first.getValue()).version());
    }

    @Test
    void of_AcceptsAlphanumericHyphenAndUnderscore() {
        // When
        Guid guid = Guid.of("order-2024_01");

        // Then
        assertEquals("order-2024_01", guid.getValue());
        assertEquals("Guid{order-2024_01}", guid.toString());
    }

    @Test
    void of_Uuid_UsesCanonicalForm() {
        // Given
        UUID uuid = UUID.fromString("123e4567-e89b-42d3-a456-426614174000");

        // When & Then
        assertEquals(Guid.of("123e4567-e89b-42d3-a456-426614174000"), Guid.of(uuid));
    }

    @Test
    void of_InvalidValues_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Guid.of((String) null));
        assertThrows(IllegalArgumentException.class, () -> Guid.of("  "));
        assertThrows(IllegalArgumentException.class, () -> Guid.of("has space"));
        assertThrows(IllegalArgumentException.class, () -> Guid.of("a".repeat(256)));
        assertThrows(IllegalArgumentException.class, () -> Guid.of((UUID) null));
    }

    @Test
    void of_MaxLength_IsAccepted() {
        assertDoesNotThrow(() -> Guid.of("a".repeat(255)));
    }

    @Test
    void equality_IsByValue() {
        assertEquals(Guid.of("abc"), Guid.of("abc"));
        assertEquals(Guid.of("abc").hashCode(), Guid.of("abc").hashCode());
        assertNotEquals(Guid.of("abc"), Guid.of("abd"));
    }
}
