package com.ryuqq.connector.core.model;

import java.util.Set;

/**
 * 어댑터 메타데이터.
 *
 * @param provider Provider ID
 * @param name 표시 이름 (예: GitHub)
 * @param version 어댑터 버전
 * @param webhookEvents 처리 가능한 Webhook 이벤트 타입
 * @author Connector Team
 * @since 1.0.0
 */
public record IntegrationMetadata(
    ProviderId provider,
    String name,
    String version,
    Set<String> webhookEvents
) {

    public IntegrationMetadata {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version cannot be null or blank");
        }
        webhookEvents = webhookEvents == null ? Set.of() : Set.copyOf(webhookEvents);
    }
}
