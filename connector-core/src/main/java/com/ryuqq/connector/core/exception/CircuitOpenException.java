package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.OperationKey;

import java.time.Instant;

/**
 * Circuit Breaker가 OPEN이어서 네트워크 호출 없이 거부됨.
 *
 * <p>호출자의 잘못이 아니며 retryAt 이후 재시도할 수 있습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class CircuitOpenException extends IntegrationException {

    private final OperationKey key;
    private final Instant retryAt;

    public CircuitOpenException(OperationKey key, Instant retryAt) {
        super(key.provider(), "Circuit breaker is OPEN for " + key
            + (retryAt != null ? ", next attempt at " + retryAt : ""));
        this.key = key;
        this.retryAt = retryAt;
    }

    public OperationKey getKey() {
        return key;
    }

    /**
     * 다음 시도 가능 시각.
     *
     * @return cooldown 종료 시각 (HALF_OPEN probe가 진행 중이면 null)
     */
    public Instant getRetryAt() {
        return retryAt;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
