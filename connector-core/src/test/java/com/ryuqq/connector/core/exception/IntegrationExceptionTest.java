package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.outcome.FailureKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 예외 분류 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class IntegrationExceptionTest {

    private static final ProviderId GITHUB = ProviderId.of("github");

    @Test
    void retryability_FollowsTaxonomy() {
        Instant retryAt = Instant.parse("2026-01-01T00:00:30Z");

        assertFalse(new AuthenticationException(GITHUB, "expired").isRetryable());
        assertFalse(new ValidationException(GITHUB, "bad signature").isRetryable());
        assertTrue(new CircuitOpenException(OperationKey.of(GITHUB, "issues.list"), retryAt).isRetryable());
        assertTrue(new RateLimitedException(GITHUB, retryAt).isRetryable());
        assertTrue(new VendorCallException(GITHUB, FailureKind.SERVER_ERROR, 502, "HTTP 502").isRetryable());
        assertFalse(new VendorCallException(GITHUB, FailureKind.CLIENT_ERROR, 404, "HTTP 404").isRetryable());
    }

    @Test
    void circuitOpenException_CarriesKeyAndRetryAt() {
        // Given
        OperationKey key = OperationKey.of(GITHUB, "issues.list");
        Instant retryAt = Instant.parse("2026-01-01T00:00:30Z");

        // When
        CircuitOpenException exception = new CircuitOpenException(key, retryAt);

        // Then
        assertEquals(key, exception.getKey());
        assertEquals(GITHUB, exception.getProvider());
        assertEquals(retryAt, exception.getRetryAt());
        assertTrue(exception.getMessage().contains("github:issues.list"));
    }

    @Test
    void rateLimitedException_NullResetTime_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitedException(GITHUB, null));
    }
}
