package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ProviderId;

/**
 * 자격 증명 만료/무효.
 *
 * <p>사용자 재인증 없이는 재시도할 수 없습니다. 토큰 갱신 후 1회 재시도에서도
 * 401이 반환되거나, Refresh Token 자체가 무효한 경우 발생합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class AuthenticationException extends IntegrationException {

    public AuthenticationException(ProviderId provider, String message) {
        super(provider, message);
    }

    public AuthenticationException(ProviderId provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
