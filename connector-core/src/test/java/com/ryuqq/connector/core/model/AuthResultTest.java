package com.ryuqq.connector.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AuthResult 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class AuthResultTest {

    @Test
    void success_WithoutAccessToken_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> AuthResult.success(null, null, null, List.of()));
    }

    @Test
    void failure_WithoutError_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> AuthResult.failure(" "));
    }

    @Test
    void toString_DoesNotExposeTokens() {
        // Given
        AuthResult result = AuthResult.success("access-xyz", "refresh-xyz", null, List.of("repo"));

        // Then
        assertFalse(result.toString().contains("access-xyz"));
        assertFalse(result.toString().contains("refresh-xyz"));
        assertTrue(result.toString().contains("repo"));
    }
}
