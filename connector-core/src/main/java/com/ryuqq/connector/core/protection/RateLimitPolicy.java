package com.ryuqq.connector.core.protection;

import java.time.Duration;

/**
 * Provider별 Rate Governor 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>permitsPerSecond: 토큰 보충 속도 (기본 10.0)</li>
 *   <li>burst: 버킷 용량 (기본 10)</li>
 *   <li>maxWait: 토큰 대기 상한, 초과하면 대기 대신 RateLimitedException (기본 5초)</li>
 *   <li>backoffBase / backoffCeiling / jitterFactor: Retry-After 없는 429의 cooldown 계산 (1s / 300s / 0.1)</li>
 * </ul>
 *
 * @param permitsPerSecond 초당 토큰 보충 수 (양수)
 * @param burst 버킷 용량 (1 이상)
 * @param maxWait 최대 대기 시간 (0 이상)
 * @param backoffBase 백오프 기본 시간
 * @param backoffCeiling 백오프 상한
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @author Connector Team
 * @since 1.0.0
 */
public record RateLimitPolicy(
    double permitsPerSecond,
    int burst,
    Duration maxWait,
    Duration backoffBase,
    Duration backoffCeiling,
    double jitterFactor
) {

    /**
     * 기본 정책 생성자.
     */
    public RateLimitPolicy() {
        this(10.0, 10, Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(300), 0.1);
    }

    public RateLimitPolicy {
        if (permitsPerSecond <= 0 || Double.isNaN(permitsPerSecond) || Double.isInfinite(permitsPerSecond)) {
            throw new IllegalArgumentException(
                "permitsPerSecond must be positive (current: " + permitsPerSecond + ")");
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("burst must be positive (current: " + burst + ")");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must be >= 0 (current: " + maxWait + ")");
        }
        if (backoffBase == null || backoffBase.isZero() || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be positive (current: " + backoffBase + ")");
        }
        if (backoffCeiling == null || backoffCeiling.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("backoffCeiling must be >= backoffBase (current: " + backoffCeiling + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
    }

    /**
     * 초당 요청 수와 burst만 지정한 정책.
     */
    public static RateLimitPolicy of(double permitsPerSecond, int burst) {
        RateLimitPolicy defaults = new RateLimitPolicy();
        return new RateLimitPolicy(permitsPerSecond, burst, defaults.maxWait(),
            defaults.backoffBase(), defaults.backoffCeiling(), defaults.jitterFactor());
    }

    public RateLimitPolicy withMaxWait(Duration maxWait) {
        return new RateLimitPolicy(permitsPerSecond, burst, maxWait, backoffBase, backoffCeiling, jitterFactor);
    }

    public RateLimitPolicy withBackoff(Duration backoffBase, Duration backoffCeiling, double jitterFactor) {
        return new RateLimitPolicy(permitsPerSecond, burst, maxWait, backoffBase, backoffCeiling, jitterFactor);
    }

    /**
     * 토큰 1개 보충에 걸리는 시간 (나노초).
     */
    public long nanosPerPermit() {
        return (long) (1_000_000_000L / permitsPerSecond);
    }
}
