package com.ryuqq.connector.core.model;

import java.util.List;

/**
 * 어댑터가 제공하는 기능 단위와 필요한 scope.
 *
 * @param name 기능 이름 (예: Issues)
 * @param description 설명
 * @param enabled 활성 여부
 * @param requiredScopes 기능에 필요한 scope 목록
 * @author Connector Team
 * @since 1.0.0
 */
public record IntegrationCapability(
    String name,
    String description,
    boolean enabled,
    List<String> requiredScopes
) {

    public IntegrationCapability {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        requiredScopes = requiredScopes == null ? List.of() : List.copyOf(requiredScopes);
    }

    public static IntegrationCapability enabled(String name, String description, List<String> requiredScopes) {
        return new IntegrationCapability(name, description, true, requiredScopes);
    }
}
