package com.ryuqq.connector.application.sync;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.sync.ResourceSyncTask;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 동기화 요청.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>tasks:</strong> 리소스 타입별 동기화 작업 (타입 중복 불가)</li>
 *   <li><strong>lastSyncTimeOverride:</strong> 지정 시 저장된 cursor 대신 이 시각부터 조회 (nullable)</li>
 *   <li><strong>deadline:</strong> 지정 시 정책의 기한 대신 사용 (nullable)</li>
 *   <li><strong>fullSync:</strong> true면 cursor를 무시하고 모든 항목을 다시 조회 (완료된 타입의 cursor는 갱신)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record SyncRequest(
    UserId userId,
    ProviderId provider,
    String integrationId,
    List<ResourceSyncTask> tasks,
    Instant lastSyncTimeOverride,
    Duration deadline,
    boolean fullSync
) {

    public SyncRequest {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (integrationId == null || integrationId.isBlank()) {
            throw new IllegalArgumentException("integrationId cannot be null or blank");
        }
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        Set<String> types = new HashSet<>();
        for (ResourceSyncTask task : tasks) {
            if (!types.add(task.resourceType())) {
                throw new IllegalArgumentException("duplicate resourceType: " + task.resourceType());
            }
        }
        if (deadline != null && (deadline.isZero() || deadline.isNegative())) {
            throw new IllegalArgumentException("deadline must be positive (current: " + deadline + ")");
        }
    }

    public static SyncRequest of(UserId userId, ProviderId provider, String integrationId, List<ResourceSyncTask> tasks) {
        return new SyncRequest(userId, provider, integrationId, tasks, null, null, false);
    }

    public SyncRequest withLastSyncTimeOverride(Instant lastSyncTimeOverride) {
        return new SyncRequest(userId, provider, integrationId, tasks, lastSyncTimeOverride, deadline, fullSync);
    }

    public SyncRequest withDeadline(Duration deadline) {
        return new SyncRequest(userId, provider, integrationId, tasks, lastSyncTimeOverride, deadline, fullSync);
    }

    public SyncRequest asFullSync() {
        return new SyncRequest(userId, provider, integrationId, tasks, null, deadline, true);
    }
}
