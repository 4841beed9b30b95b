package com.ryuqq.connector.core.contract;

import com.ryuqq.connector.core.model.WebhookPayload;

/**
 * 이벤트 타입별 Webhook 핸들러.
 *
 * <p>Provider는 같은 이벤트를 재전송할 수 있으므로 핸들러는 멱등이어야 합니다
 * (delta 적용보다 캐시 무효화/재조회 방식 권장).</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WebhookHandler {

    void handle(WebhookPayload payload);
}
