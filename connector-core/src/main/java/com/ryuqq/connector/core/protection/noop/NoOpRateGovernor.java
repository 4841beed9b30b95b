package com.ryuqq.connector.core.protection.noop;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.RateLimitInfo;
import com.ryuqq.connector.core.protection.RateGovernor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Rate Governor NoOp 구현.
 *
 * <p>acquire()는 항상 즉시 통과합니다. onRateLimited()는 cooldown을 기록하지 않고
 * 힌트 시각(없으면 현재 시각)을 그대로 돌려줍니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class NoOpRateGovernor implements RateGovernor {

    private final Clock clock;

    public NoOpRateGovernor() {
        this(Clock.systemUTC());
    }

    public NoOpRateGovernor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void acquire(ProviderId provider) {
        // NoOp
    }

    @Override
    public Instant onRateLimited(ProviderId provider, Duration retryAfter) {
        Instant now = clock.instant();
        return retryAfter == null ? now : now.plus(retryAfter);
    }

    @Override
    public void onSuccess(ProviderId provider) {
        // NoOp
    }

    @Override
    public RateLimitInfo rateLimitInfo(ProviderId provider) {
        return new RateLimitInfo(Integer.MAX_VALUE, Integer.MAX_VALUE, clock.instant());
    }

    @Override
    public void reset(ProviderId provider) {
        // NoOp
    }
}
