package com.ryuqq.connector.application.metrics;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 메트릭 싱크 장애를 호출자에게 전파하지 않는 래퍼.
 *
 * <p>메트릭은 fire-and-forget이므로 위임 대상의 RuntimeException은
 * 로그만 남기고 버립니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class GuardedMetricsSink implements MetricsSink {

    private static final Logger log = LoggerFactory.getLogger(GuardedMetricsSink.class);

    private final MetricsSink delegate;

    private GuardedMetricsSink(MetricsSink delegate) {
        this.delegate = delegate;
    }

    /**
     * 싱크를 감쌉니다. 이미 감싼 싱크는 그대로 반환합니다.
     *
     * @param delegate 위임 대상 (null이면 NoOp)
     * @return 장애 격리된 MetricsSink
     */
    public static MetricsSink wrap(MetricsSink delegate) {
        if (delegate == null) {
            return MetricsSink.noop();
        }
        if (delegate instanceof GuardedMetricsSink) {
            return delegate;
        }
        return new GuardedMetricsSink(delegate);
    }

    @Override
    public void trackApiCall(UserId userId, String integrationId, ProviderId provider, String operation,
                             long durationMs, boolean success) {
        try {
            delegate.trackApiCall(userId, integrationId, provider, operation, durationMs, success);
        } catch (RuntimeException e) {
            dropped("trackApiCall", e);
        }
    }

    @Override
    public void trackWebhookEvent(UserId userId, String integrationId, ProviderId provider, String eventType,
                                  long durationMs) {
        try {
            delegate.trackWebhookEvent(userId, integrationId, provider, eventType, durationMs);
        } catch (RuntimeException e) {
            dropped("trackWebhookEvent", e);
        }
    }

    @Override
    public void trackRateLimit(ProviderId provider, String operation) {
        try {
            delegate.trackRateLimit(provider, operation);
        } catch (RuntimeException e) {
            dropped("trackRateLimit", e);
        }
    }

    @Override
    public void trackSyncOperation(UserId userId, String integrationId, ProviderId provider,
                                   int itemsProcessed, int itemsSkipped, int errorCount, long durationMs) {
        try {
            delegate.trackSyncOperation(userId, integrationId, provider, itemsProcessed, itemsSkipped, errorCount, durationMs);
        } catch (RuntimeException e) {
            dropped("trackSyncOperation", e);
        }
    }

    private void dropped(String method, RuntimeException e) {
        log.warn("Metrics sink {} failed, metric dropped: {}", method, e.toString());
    }
}
