package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ProviderId;

/**
 * 통합 프레임워크 예외의 최상위 타입.
 *
 * <p>애플리케이션 코드는 이 타입 하나로 Provider와 무관하게 실패를 처리할 수 있습니다.
 * 메시지에는 토큰이나 시크릿을 포함하지 않습니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link AuthenticationException}: 자격 증명 만료/무효, 사용자 조치 필요</li>
 *   <li>{@link CircuitOpenException}: 의존 서비스 비정상, 나중에 재시도</li>
 *   <li>{@link RateLimitedException}: resetTime 이후 재시도</li>
 *   <li>{@link SyncException}: 부분 실패 집계, 부분 SyncResult 포함</li>
 *   <li>{@link ValidationException}: Webhook 서명/페이로드 오류, 재시도 금지</li>
 *   <li>{@link VendorCallException}: 로컬 재시도 소진 후의 일시적/요청 오류</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class IntegrationException extends RuntimeException {

    private final ProviderId provider;

    public IntegrationException(ProviderId provider, String message) {
        super(message);
        this.provider = provider;
    }

    public IntegrationException(ProviderId provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    /**
     * 실패한 Provider.
     *
     * @return Provider ID (Provider와 무관한 실패면 null)
     */
    public ProviderId getProvider() {
        return provider;
    }

    /**
     * 동일 요청을 나중에 다시 시도해도 되는지 여부.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable() {
        return false;
    }
}
