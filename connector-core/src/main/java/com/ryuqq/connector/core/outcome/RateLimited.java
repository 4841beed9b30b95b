package com.ryuqq.connector.core.outcome;

import java.time.Duration;

/**
 * Provider가 요청을 제한함 (429 Too Many Requests).
 *
 * @param retryAfter Retry-After 헤더에서 해석한 대기 시간 (헤더가 없으면 null)
 * @param <T> 값 타입
 * @author Connector Team
 * @since 1.0.0
 */
public record RateLimited<T>(Duration retryAfter) implements VendorOutcome<T> {

    public RateLimited {
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter cannot be negative (current: " + retryAfter + ")");
        }
    }

    public static <T> RateLimited<T> after(Duration retryAfter) {
        return new RateLimited<>(retryAfter);
    }

    public static <T> RateLimited<T> withoutHint() {
        return new RateLimited<>(null);
    }

    public boolean hasRetryAfter() {
        return retryAfter != null;
    }
}
