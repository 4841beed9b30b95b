package com.ryuqq.connector.core.outcome;

/**
 * Vendor 호출 실패 분류.
 *
 * <p><strong>Circuit Breaker 집계 규칙:</strong></p>
 * <ul>
 *   <li>NETWORK, TIMEOUT, SERVER_ERROR: 의존 서비스 장애 → consecutiveFailures 증가</li>
 *   <li>CLIENT_ERROR (401/429 제외 4xx): 잘못된 요청 → 집계하지 않음</li>
 *   <li>AUTHENTICATION: 자격 증명 문제 → 집계하지 않음</li>
 * </ul>
 *
 * <p>타임아웃은 네트워크 오류와 동일하게 취급합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public enum FailureKind {

    NETWORK(true),
    TIMEOUT(true),
    SERVER_ERROR(true),
    CLIENT_ERROR(false),
    AUTHENTICATION(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Circuit Breaker의 consecutiveFailures에 포함되는지 여부.
     *
     * @return 집계 대상이면 true
     */
    public boolean countsTowardBreaker() {
        return transientFailure;
    }

    /**
     * 로컬 재시도 대상인지 여부.
     *
     * @return 일시적 실패면 true
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
