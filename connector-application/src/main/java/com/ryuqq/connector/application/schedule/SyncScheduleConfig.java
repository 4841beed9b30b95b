package com.ryuqq.connector.application.schedule;

import java.time.Duration;
import java.time.LocalTime;

/**
 * 동기화 스케줄 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>incrementalInterval: 증분 동기화 주기 (기본 5분)</li>
 *   <li>fullSyncAt: 매일 전체 동기화를 시작하는 UTC 시각 (기본 02:00)</li>
 *   <li>batchSize: 한 번의 sweep에서 동기화할 최대 통합 수 (기본 100)</li>
 * </ul>
 *
 * @param incrementalInterval 증분 동기화 주기 (양수)
 * @param fullSyncAt 전체 동기화 시각 (UTC)
 * @param batchSize 배치 크기 (1 이상)
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record SyncScheduleConfig(
    Duration incrementalInterval,
    LocalTime fullSyncAt,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     */
    public SyncScheduleConfig() {
        this(Duration.ofMinutes(5), LocalTime.of(2, 0), 100);
    }

    public SyncScheduleConfig {
        if (incrementalInterval == null || incrementalInterval.isZero() || incrementalInterval.isNegative()) {
            throw new IllegalArgumentException(
                "incrementalInterval must be positive (current: " + incrementalInterval + ")");
        }
        if (fullSyncAt == null) {
            throw new IllegalArgumentException("fullSyncAt cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
    }

    public SyncScheduleConfig withIncrementalInterval(Duration incrementalInterval) {
        return new SyncScheduleConfig(incrementalInterval, fullSyncAt, batchSize);
    }

    public SyncScheduleConfig withFullSyncAt(LocalTime fullSyncAt) {
        return new SyncScheduleConfig(incrementalInterval, fullSyncAt, batchSize);
    }

    public SyncScheduleConfig withBatchSize(int batchSize) {
        return new SyncScheduleConfig(incrementalInterval, fullSyncAt, batchSize);
    }
}
