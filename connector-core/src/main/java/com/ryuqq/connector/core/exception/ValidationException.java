package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ProviderId;

/**
 * Webhook 서명/페이로드 형식 오류.
 *
 * <p>거부 대상이며 재시도하지 않습니다. 핸들러는 실행되지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ValidationException extends IntegrationException {

    public ValidationException(ProviderId provider, String message) {
        super(provider, message);
    }

    public ValidationException(ProviderId provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
