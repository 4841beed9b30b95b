package com.ryuqq.connector.core.protection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Retry-After 헤더 해석기.
 *
 * <p>두 가지 형식을 지원합니다:</p>
 * <ul>
 *   <li>delta-seconds: {@code Retry-After: 120}</li>
 *   <li>HTTP-date: {@code Retry-After: Wed, 21 Oct 2015 07:28:00 GMT}</li>
 * </ul>
 *
 * <p>과거 시각의 HTTP-date는 0초로, 해석할 수 없는 값은 empty로 처리합니다.
 * 결과는 {@link #MAX_DELAY}를 넘지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class RetryAfterParser {

    /**
     * Vendor 힌트로 허용하는 최대 대기 시간.
     */
    public static final Duration MAX_DELAY = Duration.ofDays(1);

    private RetryAfterParser() {
    }

    /**
     * Retry-After 헤더 해석.
     *
     * @param header 헤더 값 (null 가능)
     * @param clock HTTP-date 기준 시계
     * @return 대기 시간 (헤더가 없거나 형식이 잘못되면 empty)
     */
    public static Optional<Duration> parse(String header, Clock clock) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String value = header.trim();

        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(clamp(Duration.ofSeconds(Long.parseLong(value))));
            } catch (NumberFormatException e) {
                // 자릿수가 long 범위를 넘는 값
                return Optional.of(MAX_DELAY);
            }
        }

        try {
            Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration delta = Duration.between(clock.instant(), at);
            return Optional.of(clamp(delta));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * 대기 시간을 [0, {@link #MAX_DELAY}] 범위로 제한.
     *
     * @param delay 대기 시간 (null이면 0)
     * @return 제한된 대기 시간
     */
    public static Duration clamp(Duration delay) {
        if (delay == null || delay.isNegative()) {
            return Duration.ZERO;
        }
        return delay.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : delay;
    }
}
