package com.ryuqq.connector.adapter.protection.ratelimit;

import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.exception.RateLimitedException;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.RateLimitInfo;
import com.ryuqq.connector.core.protection.BackoffCalculator;
import com.ryuqq.connector.core.protection.ProviderPolicies;
import com.ryuqq.connector.core.protection.RateGovernor;
import com.ryuqq.connector.core.protection.RateLimitPolicy;
import com.ryuqq.connector.core.protection.RetryAfterParser;
import com.ryuqq.connector.core.protection.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Provider별 토큰 버킷 Rate Governor.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>버킷은 burst개의 토큰으로 시작하며 permitsPerSecond 속도로 보충됩니다</li>
 *   <li>토큰이 없으면 다음 토큰을 예약하고 락 밖에서 대기합니다 (대기 시간이 maxWait를 넘으면 즉시 실패)</li>
 *   <li>429 이후 cooldown 동안은 대기하지 않고 {@link RateLimitedException}으로 즉시 실패합니다</li>
 *   <li>Retry-After가 없으면 연속 429 횟수로 지수 백오프를 계산합니다 (backoffCeiling 상한)</li>
 * </ul>
 *
 * <p>버킷 단위로 동기화하므로 Provider 간에는 경합이 없습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class TokenBucketRateGovernor implements RateGovernor {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateGovernor.class);

    private final ProviderPolicies<RateLimitPolicy> policies;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;
    private final ConcurrentHashMap<ProviderId, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * 기본 정책으로 생성.
     */
    public TokenBucketRateGovernor() {
        this(ProviderPolicies.withDefault(new RateLimitPolicy()), Clock.systemUTC());
    }

    public TokenBucketRateGovernor(ProviderPolicies<RateLimitPolicy> policies, Clock clock) {
        this(policies, clock, Sleeper.system(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 전체 설정으로 생성.
     *
     * @param policies Provider별 정책
     * @param clock 시계
     * @param sleeper 토큰 대기 구현
     * @param jitterSource 백오프 jitter용 [0, 1) 난수 공급자
     */
    public TokenBucketRateGovernor(ProviderPolicies<RateLimitPolicy> policies, Clock clock,
                                   Sleeper sleeper, DoubleSupplier jitterSource) {
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (jitterSource == null) {
            throw new IllegalArgumentException("jitterSource cannot be null");
        }
        this.policies = policies;
        this.clock = clock;
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    @Override
    public void acquire(ProviderId provider) {
        Bucket bucket = bucket(provider);
        Duration wait;

        synchronized (bucket) {
            Instant now = clock.instant();
            if (bucket.inCooldown(now)) {
                throw new RateLimitedException(provider, bucket.cooldownUntil);
            }
            bucket.refill(now);
            if (bucket.tokens >= 1.0) {
                bucket.tokens -= 1.0;
                return;
            }
            wait = Duration.ofNanos((long) Math.ceil((1.0 - bucket.tokens) * bucket.policy.nanosPerPermit()));
            if (wait.compareTo(bucket.policy.maxWait()) > 0) {
                throw new RateLimitedException(provider, now.plus(wait));
            }
            // 토큰을 미리 예약하여 뒤이은 호출이 더 긴 대기 시간을 계산하게 함
            bucket.tokens -= 1.0;
        }

        log.debug("Waiting {}ms for {} rate limit permit", wait.toMillis(), provider);
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntegrationException(provider, "Interrupted while waiting for rate limit permit", e);
        }
    }

    @Override
    public Instant onRateLimited(ProviderId provider, Duration retryAfter) {
        Bucket bucket = bucket(provider);
        synchronized (bucket) {
            Instant now = clock.instant();
            bucket.consecutiveRateLimits++;

            Duration delay = retryAfter != null
                ? RetryAfterParser.clamp(retryAfter)
                : backoffFor(bucket.policy).calculate(bucket.consecutiveRateLimits);
            Instant until = now.plus(delay);
            if (bucket.cooldownUntil == null || until.isAfter(bucket.cooldownUntil)) {
                bucket.cooldownUntil = until;
            }
            bucket.tokens = 0.0;
            bucket.lastRefill = now;

            log.warn("Rate limited by {} ({} consecutive, retryAfter={}), cooling down until {}",
                provider, bucket.consecutiveRateLimits, retryAfter, bucket.cooldownUntil);
            return bucket.cooldownUntil;
        }
    }

    @Override
    public void onSuccess(ProviderId provider) {
        Bucket bucket = buckets.get(provider);
        if (bucket == null) {
            return;
        }
        synchronized (bucket) {
            bucket.consecutiveRateLimits = 0;
        }
    }

    @Override
    public RateLimitInfo rateLimitInfo(ProviderId provider) {
        Bucket bucket = bucket(provider);
        synchronized (bucket) {
            Instant now = clock.instant();
            int limit = bucket.policy.burst();
            if (bucket.inCooldown(now)) {
                return new RateLimitInfo(limit, 0, bucket.cooldownUntil);
            }
            bucket.refill(now);
            int remaining = (int) Math.max(0, Math.floor(bucket.tokens));
            double missing = limit - Math.max(0.0, bucket.tokens);
            Instant resetTime = now.plusNanos((long) Math.ceil(missing * bucket.policy.nanosPerPermit()));
            return new RateLimitInfo(limit, remaining, resetTime);
        }
    }

    @Override
    public void reset(ProviderId provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        buckets.remove(provider);
        log.info("Rate limit state reset for {}", provider);
    }

    private Bucket bucket(ProviderId provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        return buckets.computeIfAbsent(provider, p -> new Bucket(policies.forProvider(p), clock.instant()));
    }

    private BackoffCalculator backoffFor(RateLimitPolicy policy) {
        return new BackoffCalculator(policy.backoffBase(), policy.backoffCeiling(), policy.jitterFactor(), jitterSource);
    }

    /**
     * Provider 하나의 버킷 상태. 인스턴스 자체를 락으로 사용합니다.
     */
    private static final class Bucket {

        private final RateLimitPolicy policy;
        private double tokens;
        private Instant lastRefill;
        private Instant cooldownUntil;
        private int consecutiveRateLimits;

        private Bucket(RateLimitPolicy policy, Instant now) {
            this.policy = policy;
            this.tokens = policy.burst();
            this.lastRefill = now;
        }

        private boolean inCooldown(Instant now) {
            return cooldownUntil != null && now.isBefore(cooldownUntil);
        }

        private void refill(Instant now) {
            if (!now.isAfter(lastRefill)) {
                return;
            }
            long elapsedNanos = Duration.between(lastRefill, now).toNanos();
            tokens = Math.min(policy.burst(), tokens + (double) elapsedNanos / policy.nanosPerPermit());
            lastRefill = now;
        }
    }
}
