package com.ryuqq.connector.core.protection.noop;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOp 보호 구현 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class NoOpProtectionTest {

    private static final ProviderId GITHUB = ProviderId.of("github");
    private static final OperationKey KEY = OperationKey.of(GITHUB, "issues.list");

    @Test
    void noOpCircuitBreaker_AlwaysAllows() {
        // Given
        NoOpCircuitBreaker breaker = new NoOpCircuitBreaker();

        // When
        for (int i = 0; i < 10; i++) {
            breaker.recordFailure(KEY, FailureKind.SERVER_ERROR);
        }

        // Then
        assertTrue(breaker.tryAcquire(KEY));
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState(KEY));
        assertTrue(breaker.nextAttemptAt(KEY).isEmpty());
        assertTrue(breaker.statsFor(GITHUB).isEmpty());
    }

    @Test
    void noOpRateGovernor_ReturnsHintWithoutCooldown() {
        // Given
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        NoOpRateGovernor governor = new NoOpRateGovernor(Clock.fixed(now, ZoneOffset.UTC));

        // When
        Instant reset = governor.onRateLimited(GITHUB, Duration.ofSeconds(5));

        // Then
        assertEquals(now.plusSeconds(5), reset);
        assertDoesNotThrow(() -> governor.acquire(GITHUB));
    }
}
