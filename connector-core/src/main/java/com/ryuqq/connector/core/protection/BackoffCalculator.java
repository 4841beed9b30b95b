package com.ryuqq.connector.core.protection;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>Retry-After 힌트 없이 429를 받았을 때의 cooldown과 로컬 재시도 간격을 계산합니다.
 * 지수적으로 증가시키되 Jitter를 추가하여 동시에 제한된 호출들이 같은 시각에 몰리지 않게 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(base * 2^(attempt-1) + jitter, ceiling)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (base=1s, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000-1100ms</li>
 *   <li>attempt=2: 2000-2200ms</li>
 *   <li>attempt=3: 4000-4400ms</li>
 *   <li>attempt=10: 300000ms (ceiling)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: base=1s, ceiling=300s, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(Duration.ofSeconds(1), Duration.ofSeconds(300), 0.1);
    }

    public BackoffCalculator(Duration base, Duration ceiling, double jitterFactor) {
        this(base, ceiling, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param base 기본 지연 시간 (양수)
     * @param ceiling 최대 지연 시간 (base 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 난수 공급자 (테스트에서 고정값 주입)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(Duration base, Duration ceiling, double jitterFactor, DoubleSupplier random) {
        if (base == null || base.isZero() || base.isNegative()) {
            throw new IllegalArgumentException("base must be positive (current: " + base + ")");
        }
        if (ceiling == null || ceiling.compareTo(base) < 0) {
            throw new IllegalArgumentException(
                "ceiling must be >= base (base: " + base + ", ceiling: " + ceiling + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = base.toMillis();
        this.maxDelayMs = ceiling.toMillis();
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 지연 시간 계산.
     *
     * @param attemptCount 현재 시도 횟수 (1부터 시작)
     * @return 대기 시간
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public Duration calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // shift 상한으로 overflow 방지
        int shift = Math.min(attemptCount - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
