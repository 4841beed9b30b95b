package com.ryuqq.connector.adapter.protection.metrics;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.MetricsSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer {@link MeterRegistry}로 기록하는 {@link MetricsSink}.
 *
 * <p><strong>노출 메트릭:</strong></p>
 * <ul>
 *   <li>integration_api_calls (Timer): provider, operation, status=success|failure</li>
 *   <li>integration_webhook_events (Timer): provider, event_type</li>
 *   <li>integration_rate_limits_total (Counter): provider, operation</li>
 *   <li>integration_sync_duration (Timer): provider, status=success|partial_failure</li>
 *   <li>integration_sync_items_total (Counter): provider, result=processed|skipped</li>
 *   <li>integration_sync_errors_total (Counter): provider</li>
 * </ul>
 *
 * <p>userId와 integrationId는 태그 cardinality를 키우므로 로그에만 남깁니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class MicrometerMetricsSink implements MetricsSink {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsSink.class);

    static final String API_CALLS = "integration_api_calls";
    static final String WEBHOOK_EVENTS = "integration_webhook_events";
    static final String RATE_LIMITS = "integration_rate_limits_total";
    static final String SYNC_DURATION = "integration_sync_duration";
    static final String SYNC_ITEMS = "integration_sync_items_total";
    static final String SYNC_ERRORS = "integration_sync_errors_total";

    private final MeterRegistry meterRegistry;

    /**
     * 생성자.
     *
     * @param meterRegistry 메트릭 레지스트리
     * @throws IllegalArgumentException meterRegistry가 null인 경우
     */
    public MicrometerMetricsSink(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry cannot be null");
        }
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void trackApiCall(UserId userId, String integrationId, ProviderId provider, String operation,
                             long durationMs, boolean success) {
        Timer.builder(API_CALLS)
            .description("Vendor API call attempts")
            .tag("provider", provider.getValue())
            .tag("operation", operation)
            .tag("status", success ? "success" : "failure")
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("api_call provider={} operation={} integration={} durationMs={} success={}",
            provider, operation, integrationId, durationMs, success);
    }

    @Override
    public void trackWebhookEvent(UserId userId, String integrationId, ProviderId provider, String eventType,
                                  long durationMs) {
        Timer.builder(WEBHOOK_EVENTS)
            .description("Verified webhook events")
            .tag("provider", provider.getValue())
            .tag("event_type", eventType)
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("webhook_event provider={} eventType={} integration={} durationMs={}",
            provider, eventType, integrationId, durationMs);
    }

    @Override
    public void trackRateLimit(ProviderId provider, String operation) {
        Counter.builder(RATE_LIMITS)
            .description("Vendor 429 responses")
            .tag("provider", provider.getValue())
            .tag("operation", operation)
            .register(meterRegistry)
            .increment();
        log.info("rate_limit provider={} operation={}", provider, operation);
    }

    @Override
    public void trackSyncOperation(UserId userId, String integrationId, ProviderId provider,
                                   int itemsProcessed, int itemsSkipped, int errorCount, long durationMs) {
        String providerTag = provider.getValue();
        Timer.builder(SYNC_DURATION)
            .description("Duration of sync runs")
            .tag("provider", providerTag)
            .tag("status", errorCount == 0 ? "success" : "partial_failure")
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);
        syncItems(providerTag, "processed").increment(itemsProcessed);
        syncItems(providerTag, "skipped").increment(itemsSkipped);
        Counter.builder(SYNC_ERRORS)
            .description("Errors recorded during sync runs")
            .tag("provider", providerTag)
            .register(meterRegistry)
            .increment(errorCount);
        log.info("sync provider={} integration={} processed={} skipped={} errors={} durationMs={}",
            provider, integrationId, itemsProcessed, itemsSkipped, errorCount, durationMs);
    }

    private Counter syncItems(String provider, String result) {
        return Counter.builder(SYNC_ITEMS)
            .description("Items seen by sync runs")
            .tag("provider", provider)
            .tag("result", result)
            .register(meterRegistry);
    }
}
