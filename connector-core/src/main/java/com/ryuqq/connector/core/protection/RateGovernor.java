package com.ryuqq.connector.core.protection;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.RateLimitInfo;

import java.time.Duration;
import java.time.Instant;

/**
 * Provider별 Rate Governor SPI.
 *
 * <p>토큰 버킷으로 호출 속도를 제한하고, 429 응답 이후에는 cooldown 동안
 * 네트워크 호출 없이 즉시 거부합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * governor.acquire(provider);            // 대기 또는 RateLimitedException
 * VendorOutcome<T> outcome = call(...);
 * if (outcome instanceof RateLimited<T> limited) {
 *     Instant reset = governor.onRateLimited(provider, limited.retryAfter());
 *     throw new RateLimitedException(provider, reset);
 * }
 * governor.onSuccess(provider);
 * }</pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>같은 Provider에 대한 모든 동시 호출이 버킷을 공유해야 함</li>
 *   <li>429는 Circuit Breaker 실패로 집계하지 않음 (호출자 책임)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface RateGovernor {

    /**
     * 호출 허가 획득.
     *
     * <p>cooldown 중이면 즉시 실패합니다. 토큰이 없으면 maxWait 이내에서 대기하고,
     * 대기 시간이 maxWait를 넘으면 대기하지 않고 실패합니다.</p>
     *
     * @param provider Provider ID
     * @throws com.ryuqq.connector.core.exception.RateLimitedException 허가를 얻지 못한 경우
     */
    void acquire(ProviderId provider);

    /**
     * 429 응답 기록.
     *
     * @param provider Provider ID
     * @param retryAfter Retry-After 힌트 (null이면 지수 백오프)
     * @return cooldown 종료 시각
     */
    Instant onRateLimited(ProviderId provider, Duration retryAfter);

    /**
     * 성공 응답 기록 (연속 429 카운트 초기화).
     *
     * @param provider Provider ID
     */
    void onSuccess(ProviderId provider);

    /**
     * 현재 Rate Limit 상태.
     *
     * @param provider Provider ID
     * @return limit(burst), remaining(남은 토큰), resetTime(버킷이 다시 가득 차거나 cooldown이 끝나는 시각)
     */
    RateLimitInfo rateLimitInfo(ProviderId provider);

    /**
     * Provider 상태를 초기화 (버킷 가득, cooldown 해제).
     *
     * @param provider Provider ID
     */
    void reset(ProviderId provider);
}
