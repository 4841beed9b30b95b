package com.ryuqq.connector.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (rolling window 내 연속 실패 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (cooldown 경과 후 다음 호출)
 * HALF_OPEN (probe 1건만 통과)
 *   │
 *   ├─► 성공 → CLOSED (consecutiveFailures 초기화)
 *   └─► 실패 → OPEN (openedAt 갱신)
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>실패할 때마다 consecutiveFailures를 증가시키고,
     * 임계값에 도달하면 OPEN으로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (네트워크 호출 없이 즉시 거부).
     *
     * <p>cooldown이 지나면 다음 호출이 CLOSED가 아닌 HALF_OPEN으로 전이시킵니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태.
     *
     * <p>정확히 한 건의 probe만 통과합니다. 동시에 도착한 나머지 호출은 OPEN처럼 거부됩니다.</p>
     */
    HALF_OPEN
}
