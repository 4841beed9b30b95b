package com.ryuqq.connector.core.outcome;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP 상태 코드 분류 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class HttpOutcomesTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void fromStatus_2xx_DecodesBodyOnce() {
        // Given
        AtomicInteger decodeCount = new AtomicInteger();

        // When
        VendorOutcome<String> outcome = HttpOutcomes.fromStatus(200, null, () -> {
            decodeCount.incrementAndGet();
            return "body";
        }, clock);

        // Then
        assertTrue(outcome.isOk());
        assertEquals("body", ((Ok<String>) outcome).value());
        assertEquals(1, decodeCount.get());
    }

    @Test
    void fromStatus_401_NeedsRefreshWithoutDecoding() {
        // When
        VendorOutcome<String> outcome = HttpOutcomes.fromStatus(401, null, () -> fail("must not decode"), clock);

        // Then
        assertTrue(outcome.isNeedsRefresh());
    }

    @Test
    void fromStatus_429WithSeconds_RateLimitedWithHint() {
        // When
        VendorOutcome<String> outcome = HttpOutcomes.fromStatus(429, "5", () -> "x", clock);

        // Then
        assertTrue(outcome.isRateLimited());
        assertEquals(Duration.ofSeconds(5), ((RateLimited<String>) outcome).retryAfter());
    }

    @Test
    void fromStatus_429WithoutHeader_RateLimitedWithoutHint() {
        // When
        VendorOutcome<String> outcome = HttpOutcomes.fromStatus(429, null, () -> "x", clock);

        // Then
        assertFalse(((RateLimited<String>) outcome).hasRetryAfter());
    }

    @Test
    void fromStatus_503_ServerErrorCountsTowardBreaker() {
        // When
        Fail<String> outcome = (Fail<String>) HttpOutcomes.fromStatus(503, null, () -> "x", clock);

        // Then
        assertEquals(FailureKind.SERVER_ERROR, outcome.kind());
        assertEquals(503, outcome.status());
        assertTrue(outcome.kind().countsTowardBreaker());
    }

    @Test
    void fromStatus_404_ClientErrorDoesNotCountTowardBreaker() {
        // When
        Fail<String> outcome = (Fail<String>) HttpOutcomes.fromStatus(404, null, () -> "x", clock);

        // Then
        assertEquals(FailureKind.CLIENT_ERROR, outcome.kind());
        assertFalse(outcome.kind().countsTowardBreaker());
        assertFalse(outcome.kind().isTransient());
    }
}
