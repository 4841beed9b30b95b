package com.ryuqq.connector.application.sync;

import java.time.Duration;

/**
 * Provider별 동기화 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrency: Provider당 동시에 실행할 리소스 타입 수 (기본 4)</li>
 *   <li>deadline: 동기화 전체 기한 (기본 5분)</li>
 * </ul>
 *
 * @param maxConcurrency 동시 실행 리소스 타입 수
 * @param deadline 동기화 전체 기한
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record SyncPolicy(int maxConcurrency, Duration deadline) {

    public SyncPolicy() {
        this(4, Duration.ofMinutes(5));
    }

    public SyncPolicy {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive (current: " + maxConcurrency + ")");
        }
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            throw new IllegalArgumentException("deadline must be positive (current: " + deadline + ")");
        }
    }

    public SyncPolicy withMaxConcurrency(int maxConcurrency) {
        return new SyncPolicy(maxConcurrency, deadline);
    }

    public SyncPolicy withDeadline(Duration deadline) {
        return new SyncPolicy(maxConcurrency, deadline);
    }
}
