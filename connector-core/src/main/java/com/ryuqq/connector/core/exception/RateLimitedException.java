package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ProviderId;

import java.time.Instant;

/**
 * Rate Governor cooldown 중이거나 버킷이 비어 호출이 시도되지 않음.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class RateLimitedException extends IntegrationException {

    private final Instant resetTime;

    public RateLimitedException(ProviderId provider, Instant resetTime) {
        super(provider, "Rate limited for " + provider + ", retry after " + resetTime);
        if (resetTime == null) {
            throw new IllegalArgumentException("resetTime cannot be null");
        }
        this.resetTime = resetTime;
    }

    public Instant getResetTime() {
        return resetTime;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
