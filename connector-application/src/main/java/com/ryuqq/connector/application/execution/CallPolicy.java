package com.ryuqq.connector.application.execution;

import com.ryuqq.connector.core.protection.BackoffCalculator;

import java.time.Duration;

/**
 * Vendor 호출 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeout: 호출 1건의 최대 시간 (기본 10초, 초과 시 네트워크 오류와 동일하게 취급)</li>
 *   <li>maxTransientRetries: 일시적 실패(네트워크, 타임아웃, 5xx)의 로컬 재시도 횟수 (기본 2)</li>
 *   <li>retryBackoffBase / retryBackoffCeiling: 재시도 간 지수 백오프 (기본 200ms / 5초)</li>
 *   <li>jitterFactor: 백오프 jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * @param timeout 호출 타임아웃
 * @param maxTransientRetries 로컬 재시도 횟수 (0 이상)
 * @param retryBackoffBase 재시도 백오프 기본값
 * @param retryBackoffCeiling 재시도 백오프 상한
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record CallPolicy(
    Duration timeout,
    int maxTransientRetries,
    Duration retryBackoffBase,
    Duration retryBackoffCeiling,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     */
    public CallPolicy() {
        this(Duration.ofSeconds(10), 2, Duration.ofMillis(200), Duration.ofSeconds(5), 0.1);
    }

    public CallPolicy {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (maxTransientRetries < 0) {
            throw new IllegalArgumentException(
                "maxTransientRetries cannot be negative (current: " + maxTransientRetries + ")"
            );
        }
        if (retryBackoffBase == null || retryBackoffBase.isZero() || retryBackoffBase.isNegative()) {
            throw new IllegalArgumentException("retryBackoffBase must be positive (current: " + retryBackoffBase + ")");
        }
        if (retryBackoffCeiling == null || retryBackoffCeiling.compareTo(retryBackoffBase) < 0) {
            throw new IllegalArgumentException("retryBackoffCeiling must be >= retryBackoffBase");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public CallPolicy withTimeout(Duration timeout) {
        return new CallPolicy(timeout, maxTransientRetries, retryBackoffBase, retryBackoffCeiling, jitterFactor);
    }

    public CallPolicy withMaxTransientRetries(int maxTransientRetries) {
        return new CallPolicy(timeout, maxTransientRetries, retryBackoffBase, retryBackoffCeiling, jitterFactor);
    }

    public CallPolicy withRetryBackoff(Duration base, Duration ceiling, double jitterFactor) {
        return new CallPolicy(timeout, maxTransientRetries, base, ceiling, jitterFactor);
    }

    BackoffCalculator backoff() {
        return new BackoffCalculator(retryBackoffBase, retryBackoffCeiling, jitterFactor);
    }
}
