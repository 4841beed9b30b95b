package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;

/**
 * {@link MetricsSink} that discards everything.
 */
final class NoOpMetricsSink implements MetricsSink {

    static final NoOpMetricsSink INSTANCE = new NoOpMetricsSink();

    private NoOpMetricsSink() {
    }

    @Override
    public void trackApiCall(UserId userId, String integrationId, ProviderId provider, String operation,
                             long durationMs, boolean success) {
        // NoOp
    }

    @Override
    public void trackWebhookEvent(UserId userId, String integrationId, ProviderId provider, String eventType,
                                  long durationMs) {
        // NoOp
    }

    @Override
    public void trackRateLimit(ProviderId provider, String operation) {
        // NoOp
    }

    @Override
    public void trackSyncOperation(UserId userId, String integrationId, ProviderId provider,
                                   int itemsProcessed, int itemsSkipped, int errorCount, long durationMs) {
        // NoOp
    }
}
