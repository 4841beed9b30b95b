package com.ryuqq.connector.core.contract;

import com.ryuqq.connector.core.model.InboundWebhook;

/**
 * Provider별 Webhook 서명 검증 방식.
 *
 * <p>HMAC-SHA256(원본 바디, 공유 시크릿)이 일반적이며, 일부 Provider는 Bearer Token을 사용합니다.
 * 구현은 상수 시간 비교를 사용해야 합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface WebhookVerifier {

    /**
     * 서명이 담긴 헤더 이름.
     *
     * @return 헤더 이름 (예: X-Hub-Signature-256)
     */
    String signatureHeader();

    /**
     * 서명 검증.
     *
     * @param webhook 원본 요청
     * @param signature 서명 헤더 값 (null 가능)
     * @return 유효하면 true
     */
    boolean verify(InboundWebhook webhook, String signature);
}
