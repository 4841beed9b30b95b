package com.ryuqq.connector.application.adapter;

import com.ryuqq.connector.application.auth.TokenRefreshCoordinator;
import com.ryuqq.connector.application.execution.ProtectedCallExecutor;
import com.ryuqq.connector.application.metrics.GuardedMetricsSink;
import com.ryuqq.connector.application.sync.SyncOrchestrator;
import com.ryuqq.connector.core.protection.RateGovernor;
import com.ryuqq.connector.core.spi.IntegrationConfigStore;
import com.ryuqq.connector.core.spi.MetricsSink;
import com.ryuqq.connector.core.spi.SyncCursorStore;
import com.ryuqq.connector.core.spi.TokenVault;

import java.time.Clock;

/**
 * 어댑터가 공유하는 엔진과 협력 객체 묶음.
 *
 * <p>모든 어댑터 인스턴스가 같은 묶음을 공유해야 breaker / governor / 갱신 상태가
 * 사용자와 어댑터 사이에서 공유됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record IntegrationServices(
    ProtectedCallExecutor callExecutor,
    TokenRefreshCoordinator tokenRefreshCoordinator,
    SyncOrchestrator syncOrchestrator,
    RateGovernor rateGovernor,
    IntegrationConfigStore configStore,
    SyncCursorStore cursorStore,
    TokenVault tokenVault,
    MetricsSink metrics,
    Clock clock
) {

    public IntegrationServices {
        if (callExecutor == null) {
            throw new IllegalArgumentException("callExecutor cannot be null");
        }
        if (tokenRefreshCoordinator == null) {
            throw new IllegalArgumentException("tokenRefreshCoordinator cannot be null");
        }
        if (syncOrchestrator == null) {
            throw new IllegalArgumentException("syncOrchestrator cannot be null");
        }
        if (rateGovernor == null) {
            throw new IllegalArgumentException("rateGovernor cannot be null");
        }
        if (configStore == null) {
            throw new IllegalArgumentException("configStore cannot be null");
        }
        if (cursorStore == null) {
            throw new IllegalArgumentException("cursorStore cannot be null");
        }
        if (tokenVault == null) {
            throw new IllegalArgumentException("tokenVault cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        metrics = GuardedMetricsSink.wrap(metrics);
    }
}
