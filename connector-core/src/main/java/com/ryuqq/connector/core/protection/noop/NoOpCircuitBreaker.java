package com.ryuqq.connector.core.protection.noop;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.protection.CircuitBreaker;
import com.ryuqq.connector.core.protection.CircuitBreakerState;
import com.ryuqq.connector.core.protection.CircuitHealth;
import com.ryuqq.connector.core.protection.CircuitState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 테스트 환경에서 사용하거나, 보호 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>recordSuccess() / recordFailure() / releasePermit(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public boolean tryAcquire(OperationKey key) {
        return true;
    }

    @Override
    public void recordSuccess(OperationKey key) {
        // NoOp
    }

    @Override
    public void recordFailure(OperationKey key, FailureKind kind) {
        // NoOp
    }

    @Override
    public void releasePermit(OperationKey key) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState(OperationKey key) {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public Optional<Instant> nextAttemptAt(OperationKey key) {
        return Optional.empty();
    }

    @Override
    public CircuitState stats(OperationKey key) {
        return CircuitState.initial(key);
    }

    @Override
    public List<CircuitState> statsFor(ProviderId provider) {
        return List.of();
    }

    @Override
    public CircuitHealth systemHealth() {
        return CircuitHealth.of(0, 0, 0);
    }

    @Override
    public void reset(OperationKey key) {
        // NoOp
    }
}
