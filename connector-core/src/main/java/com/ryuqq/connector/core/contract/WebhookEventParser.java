package com.ryuqq.connector.core.contract;

import com.ryuqq.connector.core.model.InboundWebhook;
import com.ryuqq.connector.core.model.WebhookPayload;

/**
 * 원본 Webhook 요청을 정규화된 {@link WebhookPayload}로 변환합니다.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WebhookEventParser {

    /**
     * 파싱.
     *
     * @param webhook 서명 검증을 통과한 원본 요청
     * @return 정규화된 페이로드
     * @throws com.ryuqq.connector.core.exception.ValidationException 바디가 잘못되었거나 이벤트 타입을 찾을 수 없는 경우
     */
    WebhookPayload parse(InboundWebhook webhook);
}
