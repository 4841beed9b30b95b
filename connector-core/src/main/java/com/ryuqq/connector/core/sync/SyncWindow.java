package com.ryuqq.connector.core.sync;

import java.time.Instant;

/**
 * 리소스 타입 하나의 동기화 구간.
 *
 * <ul>
 *   <li>since: 조회 기준 시각 (호출자 override 또는 저장된 cursor, 최초 동기화면 null)</li>
 *   <li>reflectedThrough: 저장된 cursor, 이 시각 이전에 갱신된 항목은 이미 반영됨 (null 가능)</li>
 *   <li>startedAt: 이번 실행 시작 시각, 완료 시 cursor가 이 시각으로 전진</li>
 * </ul>
 *
 * @param resourceType 리소스 타입
 * @param since 조회 기준 시각 (null 가능)
 * @param reflectedThrough 이미 반영된 시각 (null 가능)
 * @param startedAt 실행 시작 시각
 * @author Connector Team
 * @since 1.0.0
 */
public record SyncWindow(
    String resourceType,
    Instant since,
    Instant reflectedThrough,
    Instant startedAt
) {

    public SyncWindow {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType cannot be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
    }

    /**
     * 최초 동기화 여부.
     */
    public boolean isFullSync() {
        return since == null && reflectedThrough == null;
    }

    /**
     * 항목이 이전 동기화에서 이미 반영되었는지 여부.
     *
     * <p>since와 reflectedThrough 중 늦은 시각 이하에 갱신된 항목은 건너뜁니다.
     * 갱신 시각을 알 수 없는 항목(null)은 항상 처리합니다.</p>
     *
     * @param updatedAt 항목의 갱신 시각
     * @return 이미 반영되었으면 true
     */
    public boolean isAlreadySynced(Instant updatedAt) {
        if (updatedAt == null) {
            return false;
        }
        Instant watermark = watermark();
        return watermark != null && !updatedAt.isAfter(watermark);
    }

    /**
     * since와 reflectedThrough 중 늦은 시각.
     *
     * @return 워터마크 (둘 다 null이면 null)
     */
    public Instant watermark() {
        if (since == null) {
            return reflectedThrough;
        }
        if (reflectedThrough == null) {
            return since;
        }
        return since.isAfter(reflectedThrough) ? since : reflectedThrough;
    }
}
