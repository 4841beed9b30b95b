package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.outcome.FailureKind;

/**
 * Vendor 호출 실패 (로컬 재시도 소진 또는 재시도 불가 요청 오류).
 *
 * <p>Circuit Breaker가 아직 CLOSED인 상태에서 재시도 한도를 넘긴 일시적 실패,
 * 또는 4xx 요청 오류가 이 타입으로 전달됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class VendorCallException extends IntegrationException {

    private final FailureKind kind;
    private final int status;

    public VendorCallException(ProviderId provider, FailureKind kind, int status, String message) {
        super(provider, message);
        this.kind = kind;
        this.status = status;
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * HTTP 상태 코드.
     *
     * @return 상태 코드 (네트워크/타임아웃이면 0)
     */
    public int getStatus() {
        return status;
    }

    @Override
    public boolean isRetryable() {
        return kind.isTransient();
    }
}
