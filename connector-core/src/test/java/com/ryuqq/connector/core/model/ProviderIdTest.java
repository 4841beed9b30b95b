package com.ryuqq.connector.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProviderId Value Object 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class ProviderIdTest {

    @Test
    void of_ValidValue_CreatesProviderId() {
        // Given
        String value = "github";

        // When
        ProviderId provider = ProviderId.of(value);

        // Then
        assertEquals(value, provider.getValue());
        assertEquals(value, provider.toString());
    }

    @Test
    void of_ValueWithHyphenAndDigits_CreatesProviderId() {
        assertEquals("google-calendar2", ProviderId.of("google-calendar2").getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ProviderId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_UppercaseValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ProviderId.of("GitHub")
        );
        assertTrue(exception.getMessage().contains("lowercase"));
    }

    @Test
    void of_LeadingHyphen_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProviderId.of("-slack"));
    }

    @Test
    void of_ValueExceeds64Characters_ThrowsException() {
        // Given
        String value = "a".repeat(65);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ProviderId.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 64"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(ProviderId.of("slack"), ProviderId.of("slack"));
        assertEquals(ProviderId.of("slack").hashCode(), ProviderId.of("slack").hashCode());
        assertNotEquals(ProviderId.of("slack"), ProviderId.of("github"));
    }
}
