package com.ryuqq.connector.core.protection;

import com.ryuqq.connector.core.model.OperationKey;

import java.time.Instant;

/**
 * (Provider, Operation) 키별 Circuit Breaker 상태 스냅샷.
 *
 * <p>불변 record이며, 상태 전이는 {@code CircuitStateStore.compareAndSet}으로
 * 이전 스냅샷을 새 스냅샷으로 교체하는 방식으로만 일어납니다.</p>
 *
 * @param key (Provider, Operation) 키
 * @param status 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param firstFailureAt 현재 연속 실패 구간의 첫 실패 시각 (null 가능)
 * @param openedAt OPEN 전이 시각 (CLOSED면 null)
 * @param probeInFlight HALF_OPEN probe 진행 여부
 * @param totalSuccesses 누적 성공 수
 * @param totalFailures 누적 실패 수 (집계 대상 실패만)
 * @param totalRejections 누적 거부 수
 * @param lastFailureAt 마지막 실패 시각 (null 가능)
 * @author Connector Team
 * @since 1.0.0
 */
public record CircuitState(
    OperationKey key,
    CircuitBreakerState status,
    int consecutiveFailures,
    Instant firstFailureAt,
    Instant openedAt,
    boolean probeInFlight,
    long totalSuccesses,
    long totalFailures,
    long totalRejections,
    Instant lastFailureAt
) {

    public CircuitState {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures cannot be negative");
        }
        if (status != CircuitBreakerState.CLOSED && openedAt == null) {
            throw new IllegalArgumentException("openedAt is required when status is " + status);
        }
    }

    /**
     * 초기 상태 (CLOSED, 카운터 0).
     *
     * @param key (Provider, Operation) 키
     * @return 초기 CircuitState
     */
    public static CircuitState initial(OperationKey key) {
        return new CircuitState(key, CircuitBreakerState.CLOSED, 0, null, null, false, 0, 0, 0, null);
    }

    public long totalRequests() {
        return totalSuccesses + totalFailures;
    }

    public CircuitState withStatus(CircuitBreakerState status, Instant openedAt, boolean probeInFlight) {
        return new CircuitState(key, status, consecutiveFailures, firstFailureAt, openedAt, probeInFlight,
            totalSuccesses, totalFailures, totalRejections, lastFailureAt);
    }

    public CircuitState withFailureStreak(int consecutiveFailures, Instant firstFailureAt, Instant failedAt) {
        return new CircuitState(key, status, consecutiveFailures, firstFailureAt, openedAt, probeInFlight,
            totalSuccesses, totalFailures + 1, totalRejections, failedAt);
    }

    public CircuitState withSuccessRecorded() {
        return new CircuitState(key, status, consecutiveFailures, firstFailureAt, openedAt, probeInFlight,
            totalSuccesses + 1, totalFailures, totalRejections, lastFailureAt);
    }

    public CircuitState withRejectionRecorded() {
        return new CircuitState(key, status, consecutiveFailures, firstFailureAt, openedAt, probeInFlight,
            totalSuccesses, totalFailures, totalRejections + 1, lastFailureAt);
    }

    /**
     * 연속 실패 카운터를 초기화한 CLOSED 상태.
     */
    public CircuitState closed() {
        return new CircuitState(key, CircuitBreakerState.CLOSED, 0, null, null, false,
            totalSuccesses, totalFailures, totalRejections, lastFailureAt);
    }
}
