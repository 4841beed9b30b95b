package com.ryuqq.connector.core.outcome;

import com.ryuqq.connector.core.protection.RetryAfterParser;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * HTTP 상태 코드를 {@link VendorOutcome}으로 분류하는 유틸리티.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <pre>
 * 2xx → Ok (바디는 이 시점에 한 번만 디코딩)
 * 401 → NeedsRefresh
 * 429 → RateLimited (Retry-After: 초 또는 HTTP-date)
 * 5xx → Fail(SERVER_ERROR)
 * 그 외 → Fail(CLIENT_ERROR)
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class HttpOutcomes {

    private HttpOutcomes() {
    }

    /**
     * 상태 코드 분류.
     *
     * @param status HTTP 상태 코드
     * @param retryAfterHeader Retry-After 헤더 값 (null 가능)
     * @param bodyDecoder 2xx일 때만 호출되는 바디 디코더
     * @param clock HTTP-date 해석 기준 시계
     * @param <T> 값 타입
     * @return 분류된 결과
     */
    public static <T> VendorOutcome<T> fromStatus(int status, String retryAfterHeader, Supplier<T> bodyDecoder, Clock clock) {
        if (bodyDecoder == null) {
            throw new IllegalArgumentException("bodyDecoder cannot be null");
        }
        if (status >= 200 && status < 300) {
            return Ok.of(bodyDecoder.get());
        }
        if (status == 401) {
            return NeedsRefresh.of("HTTP 401 Unauthorized");
        }
        if (status == 429) {
            return new RateLimited<>(RetryAfterParser.parse(retryAfterHeader, clock).orElse(null));
        }
        if (status >= 500) {
            return Fail.of(FailureKind.SERVER_ERROR, status, "HTTP " + status);
        }
        return Fail.of(FailureKind.CLIENT_ERROR, status, "HTTP " + status);
    }
}
