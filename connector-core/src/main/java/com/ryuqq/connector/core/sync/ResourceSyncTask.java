package com.ryuqq.connector.core.sync;

/**
 * 리소스 타입 이름과 동기화 함수의 쌍.
 *
 * @param resourceType 리소스 타입 (예: issues, pull_requests)
 * @param sync 동기화 함수
 * @author Connector Team
 * @since 1.0.0
 */
public record ResourceSyncTask(String resourceType, ResourceSync sync) {

    public ResourceSyncTask {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType cannot be null or blank");
        }
        if (sync == null) {
            throw new IllegalArgumentException("sync cannot be null");
        }
    }

    public static ResourceSyncTask of(String resourceType, ResourceSync sync) {
        return new ResourceSyncTask(resourceType, sync);
    }
}
