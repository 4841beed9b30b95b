package com.ryuqq.connector.core.sync;

import java.util.List;

/**
 * 리소스 타입 하나의 동기화 결과.
 *
 * <p>itemErrors가 비어 있지 않으면 해당 리소스 타입의 cursor는 전진하지 않습니다.</p>
 *
 * @param processed 반영한 항목 수
 * @param skipped 이미 최신이라 건너뛴 항목 수
 * @param itemErrors 항목별 실패 메시지
 * @author Connector Team
 * @since 1.0.0
 */
public record ResourceSyncResult(int processed, int skipped, List<String> itemErrors) {

    public ResourceSyncResult {
        if (processed < 0) {
            throw new IllegalArgumentException("processed cannot be negative (current: " + processed + ")");
        }
        if (skipped < 0) {
            throw new IllegalArgumentException("skipped cannot be negative (current: " + skipped + ")");
        }
        itemErrors = itemErrors == null ? List.of() : List.copyOf(itemErrors);
    }

    public static ResourceSyncResult of(int processed, int skipped) {
        return new ResourceSyncResult(processed, skipped, List.of());
    }

    public boolean isComplete() {
        return itemErrors.isEmpty();
    }
}
