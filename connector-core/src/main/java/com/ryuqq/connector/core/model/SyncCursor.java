package com.ryuqq.connector.core.model;

import java.time.Instant;

/**
 * 리소스 타입별 증분 동기화 워터마크.
 *
 * <p>동기화 시작 전에 읽고, 해당 리소스 타입의 동기화가 완전히 끝난 뒤에만 기록합니다.
 * 중간에 프로세스가 죽으면 cursor가 전진하지 않았으므로 재동기화가 일어날 뿐
 * 데이터가 조용히 유실되지 않습니다.</p>
 *
 * <p><strong>단조성:</strong> {@link #advanceTo(Instant)}는 과거 시각으로 되돌리지 않습니다.</p>
 *
 * @param provider Provider ID
 * @param userId 사용자
 * @param resourceType 리소스 타입 (예: issues)
 * @param lastSyncTime 마지막으로 완전히 동기화된 시각
 * @author Connector Team
 * @since 1.0.0
 */
public record SyncCursor(
    ProviderId provider,
    UserId userId,
    String resourceType,
    Instant lastSyncTime
) {

    public SyncCursor {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType cannot be null or blank");
        }
        if (lastSyncTime == null) {
            throw new IllegalArgumentException("lastSyncTime cannot be null");
        }
    }

    /**
     * 단조 전진.
     *
     * @param candidate 새 워터마크 후보
     * @return candidate가 더 늦으면 전진한 새 인스턴스, 아니면 자기 자신
     */
    public SyncCursor advanceTo(Instant candidate) {
        if (candidate == null || !candidate.isAfter(lastSyncTime)) {
            return this;
        }
        return new SyncCursor(provider, userId, resourceType, candidate);
    }
}
