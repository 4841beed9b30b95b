package com.ryuqq.connector.core.protection;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Retry-After 헤더 해석 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class RetryAfterParserTest {

    private final Clock clock = Clock.fixed(Instant.parse("2015-10-21T07:27:00Z"), ZoneOffset.UTC);

    @Test
    void parse_DeltaSeconds_ReturnsDuration() {
        assertEquals(Optional.of(Duration.ofSeconds(120)), RetryAfterParser.parse("120", clock));
        assertEquals(Optional.of(Duration.ofSeconds(5)), RetryAfterParser.parse(" 5 ", clock));
    }

    @Test
    void parse_HttpDate_ReturnsDeltaFromClock() {
        assertEquals(Optional.of(Duration.ofSeconds(60)),
            RetryAfterParser.parse("Wed, 21 Oct 2015 07:28:00 GMT", clock));
    }

    @Test
    void parse_HttpDateInPast_ReturnsZero() {
        assertEquals(Optional.of(Duration.ZERO),
            RetryAfterParser.parse("Wed, 21 Oct 2015 07:00:00 GMT", clock));
    }

    @Test
    void parse_MissingOrMalformed_ReturnsEmpty() {
        assertTrue(RetryAfterParser.parse(null, clock).isEmpty());
        assertTrue(RetryAfterParser.parse("", clock).isEmpty());
        assertTrue(RetryAfterParser.parse("soon", clock).isEmpty());
        assertTrue(RetryAfterParser.parse("-5", clock).isEmpty());
    }

    @Test
    void parse_HugeValues_ClampedToMaxDelay() {
        assertEquals(Optional.of(RetryAfterParser.MAX_DELAY), RetryAfterParser.parse("9223372036854775807", clock));
        assertEquals(Optional.of(RetryAfterParser.MAX_DELAY), RetryAfterParser.parse("99999999999999999999999", clock));
        assertEquals(Optional.of(RetryAfterParser.MAX_DELAY),
            RetryAfterParser.parse("Fri, 31 Dec 9999 23:59:59 GMT", clock));
    }
}
