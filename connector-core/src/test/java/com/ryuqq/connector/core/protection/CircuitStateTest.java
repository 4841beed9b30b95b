package com.ryuqq.connector.core.protection;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitState 스냅샷 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class CircuitStateTest {

    private static final OperationKey KEY = OperationKey.of(ProviderId.of("github"), "issues.list");

    @Test
    void initial_IsClosedWithZeroCounters() {
        CircuitState state = CircuitState.initial(KEY);

        assertEquals(CircuitBreakerState.CLOSED, state.status());
        assertEquals(0, state.consecutiveFailures());
        assertEquals(0, state.totalRequests());
        assertNull(state.openedAt());
    }

    @Test
    void openWithoutOpenedAt_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CircuitState.initial(KEY).withStatus(CircuitBreakerState.OPEN, null, false)
        );
        assertTrue(exception.getMessage().contains("openedAt is required"));
    }

    @Test
    void closed_ResetsStreakButKeepsTotals() {
        // Given
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        CircuitState opened = CircuitState.initial(KEY)
            .withFailureStreak(1, now, now)
            .withSuccessRecorded()
            .withStatus(CircuitBreakerState.OPEN, now, false);

        // When
        CircuitState closed = opened.closed();

        // Then
        assertEquals(CircuitBreakerState.CLOSED, closed.status());
        assertEquals(0, closed.consecutiveFailures());
        assertNull(closed.firstFailureAt());
        assertEquals(2, closed.totalRequests());
        assertEquals(now, closed.lastFailureAt());
    }

    @Test
    void circuitHealth_NoCircuits_IsFullyHealthy() {
        assertEquals(100.0, CircuitHealth.of(0, 0, 0).healthPercent());
        assertEquals(50.0, CircuitHealth.of(1, 0, 1).healthPercent());
    }
}
