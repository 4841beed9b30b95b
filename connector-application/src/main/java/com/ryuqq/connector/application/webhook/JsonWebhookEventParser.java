package com.ryuqq.connector.application.webhook;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.connector.core.contract.WebhookEventParser;
import com.ryuqq.connector.core.exception.ValidationException;
import com.ryuqq.connector.core.model.InboundWebhook;
import com.ryuqq.connector.core.model.WebhookPayload;

import java.io.IOException;

/**
 * JSON 본문 Webhook을 표준 {@link WebhookPayload}로 변환하는 파서.
 *
 * <p>이벤트 타입은 헤더(예: GitHub {@code X-GitHub-Event}) 또는
 * 본문 필드(JSON Pointer, 예: Slack {@code /event/type})에서 읽습니다.
 * 헤더가 지정되어 있고 값이 있으면 헤더가 우선합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class JsonWebhookEventParser implements WebhookEventParser {

    private final ObjectMapper objectMapper;
    private final String eventTypeHeader;
    private final JsonPointer eventTypePointer;

    private JsonWebhookEventParser(ObjectMapper objectMapper, String eventTypeHeader, String eventTypePointer) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
        this.eventTypeHeader = eventTypeHeader;
        this.eventTypePointer = eventTypePointer != null ? JsonPointer.compile(eventTypePointer) : null;
    }

    /**
     * 헤더에서 이벤트 타입을 읽는 파서.
     *
     * @param objectMapper Jackson ObjectMapper
     * @param header 이벤트 타입 헤더 이름
     */
    public static JsonWebhookEventParser fromHeader(ObjectMapper objectMapper, String header) {
        if (header == null || header.isBlank()) {
            throw new IllegalArgumentException("header cannot be null or blank");
        }
        return new JsonWebhookEventParser(objectMapper, header, null);
    }

    /**
     * 본문 필드에서 이벤트 타입을 읽는 파서.
     *
     * @param objectMapper Jackson ObjectMapper
     * @param pointer JSON Pointer (예: "/type")
     */
    public static JsonWebhookEventParser fromField(ObjectMapper objectMapper, String pointer) {
        if (pointer == null || !pointer.startsWith("/")) {
            throw new IllegalArgumentException("pointer must start with '/' (current: " + pointer + ")");
        }
        return new JsonWebhookEventParser(objectMapper, null, pointer);
    }

    /**
     * 헤더 우선, 없으면 본문 필드에서 이벤트 타입을 읽는 파서.
     */
    public static JsonWebhookEventParser fromHeaderOrField(ObjectMapper objectMapper, String header, String pointer) {
        if (header == null || header.isBlank()) {
            throw new IllegalArgumentException("header cannot be null or blank");
        }
        if (pointer == null || !pointer.startsWith("/")) {
            throw new IllegalArgumentException("pointer must start with '/' (current: " + pointer + ")");
        }
        return new JsonWebhookEventParser(objectMapper, header, pointer);
    }

    @Override
    public WebhookPayload parse(InboundWebhook webhook) {
        if (webhook == null) {
            throw new IllegalArgumentException("webhook cannot be null");
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(webhook.rawBody());
        } catch (IOException e) {
            throw new ValidationException(webhook.provider(), "Malformed webhook body from " + webhook.provider(), e);
        }
        if (body == null || body.isMissingNode() || !body.isContainerNode()) {
            throw new ValidationException(webhook.provider(), "Webhook body from " + webhook.provider() + " is not a JSON document");
        }

        String eventType = eventTypeHeader != null ? webhook.header(eventTypeHeader) : null;
        if ((eventType == null || eventType.isBlank()) && eventTypePointer != null) {
            JsonNode node = body.at(eventTypePointer);
            eventType = node.isValueNode() ? node.asText() : null;
        }
        if (eventType == null || eventType.isBlank()) {
            throw new ValidationException(webhook.provider(), "Webhook event type missing for " + webhook.provider());
        }

        return new WebhookPayload(webhook.provider(), eventType, webhook.headers(), body, webhook.receivedAt());
    }
}
