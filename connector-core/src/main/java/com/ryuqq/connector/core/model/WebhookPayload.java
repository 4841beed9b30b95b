package com.ryuqq.connector.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 정규화된 Webhook 봉투.
 *
 * <p>어댑터별 페이로드는 디스패치 전에 이 형태로 풀어냅니다.
 * body는 원본 바디를 한 번만 파싱한 Jackson 트리입니다.</p>
 *
 * @param provider Provider ID
 * @param eventType 이벤트 타입 (예: issues, message)
 * @param headers 요청 헤더
 * @param body 파싱된 바디
 * @param receivedAt 수신 시각
 * @author Connector Team
 * @since 1.0.0
 */
public record WebhookPayload(
    ProviderId provider,
    String eventType,
    Map<String, String> headers,
    JsonNode body,
    Instant receivedAt
) {

    public WebhookPayload {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt cannot be null");
        }
        TreeMap<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            normalized.putAll(headers);
        }
        headers = Collections.unmodifiableMap(normalized);
    }
}
