package com.ryuqq.connector.testkit.contract;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.MetricsSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory {@link MetricsSink} that keeps every event for later assertions.
 *
 * <p>Thread-safe: the engines report from worker threads.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class RecordingMetricsSink implements MetricsSink {

    public record ApiCall(UserId userId, String integrationId, ProviderId provider, String operation,
                          long durationMs, boolean success) {
    }

    public record WebhookEvent(UserId userId, String integrationId, ProviderId provider, String eventType,
                               long durationMs) {
    }

    public record RateLimit(ProviderId provider, String operation) {
    }

    public record SyncOperation(UserId userId, String integrationId, ProviderId provider,
                                int itemsProcessed, int itemsSkipped, int errorCount, long durationMs) {
    }

    private final List<ApiCall> apiCalls = new CopyOnWriteArrayList<>();
    private final List<WebhookEvent> webhookEvents = new CopyOnWriteArrayList<>();
    private final List<RateLimit> rateLimits = new CopyOnWriteArrayList<>();
    private final List<SyncOperation> syncOperations = new CopyOnWriteArrayList<>();

    @Override
    public void trackApiCall(UserId userId, String integrationId, ProviderId provider, String operation,
                             long durationMs, boolean success) {
        apiCalls.add(new ApiCall(userId, integrationId, provider, operation, durationMs, success));
    }

    @Override
    public void trackWebhookEvent(UserId userId, String integrationId, ProviderId provider, String eventType,
                                  long durationMs) {
        webhookEvents.add(new WebhookEvent(userId, integrationId, provider, eventType, durationMs));
    }

    @Override
    public void trackRateLimit(ProviderId provider, String operation) {
        rateLimits.add(new RateLimit(provider, operation));
    }

    @Override
    public void trackSyncOperation(UserId userId, String integrationId, ProviderId provider,
                                   int itemsProcessed, int itemsSkipped, int errorCount, long durationMs) {
        syncOperations.add(new SyncOperation(userId, integrationId, provider,
            itemsProcessed, itemsSkipped, errorCount, durationMs));
    }

    public List<ApiCall> apiCalls() {
        return List.copyOf(apiCalls);
    }

    /**
     * API calls recorded for one operation name.
     *
     * @param operation operation name (e.g. issues.list)
     * @return matching calls in recording order
     */
    public List<ApiCall> apiCalls(String operation) {
        return apiCalls.stream()
            .filter(call -> call.operation().equals(operation))
            .collect(Collectors.toList());
    }

    public List<WebhookEvent> webhookEvents() {
        return List.copyOf(webhookEvents);
    }

    public List<RateLimit> rateLimits() {
        return List.copyOf(rateLimits);
    }

    public List<SyncOperation> syncOperations() {
        return List.copyOf(syncOperations);
    }

    public void clear() {
        apiCalls.clear();
        webhookEvents.clear();
        rateLimits.clear();
        syncOperations.clear();
    }
}
