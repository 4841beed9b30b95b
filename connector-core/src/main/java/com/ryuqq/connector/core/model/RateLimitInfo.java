package com.ryuqq.connector.core.model;

import java.time.Instant;

/**
 * Provider별 Rate Limit 현황.
 *
 * @param limit 버킷 용량 (허용 요청 수)
 * @param remaining 남은 요청 수 (0 이상)
 * @param resetTime 버킷이 다시 가득 차거나 cooldown이 끝나는 시각
 * @author Connector Team
 * @since 1.0.0
 */
public record RateLimitInfo(int limit, int remaining, Instant resetTime) {

    public RateLimitInfo {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining cannot be negative");
        }
        if (resetTime == null) {
            throw new IllegalArgumentException("resetTime cannot be null");
        }
    }
}
