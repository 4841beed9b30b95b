package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;

/**
 * Fire-and-forget metrics SPI.
 *
 * <p>Counters and timers are keyed by provider and operation. Callers must never let a
 * sink failure affect the outcome of the operation being measured.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface MetricsSink {

    /**
     * Records one vendor API call attempt.
     *
     * @param userId the user the call was made for (null for unauthenticated calls)
     * @param integrationId the integration instance id (null if unknown)
     * @param provider the provider
     * @param operation the operation name (e.g. issues.list)
     * @param durationMs wall-clock duration of the attempt
     * @param success whether the attempt produced a value
     */
    void trackApiCall(UserId userId, String integrationId, ProviderId provider, String operation,
                      long durationMs, boolean success);

    /**
     * Records one verified webhook event.
     *
     * @param userId the owning user (null if the adapter is not user-bound)
     * @param integrationId the integration instance id (null if unknown)
     * @param provider the provider
     * @param eventType the normalized event type
     * @param durationMs handler duration
     */
    void trackWebhookEvent(UserId userId, String integrationId, ProviderId provider, String eventType,
                           long durationMs);

    /**
     * Records a 429 response.
     *
     * @param provider the provider
     * @param operation the operation that was throttled
     */
    void trackRateLimit(ProviderId provider, String operation);

    /**
     * Records a completed sync run.
     *
     * @param userId the user
     * @param integrationId the integration instance id (null if unknown)
     * @param provider the provider
     * @param itemsProcessed items written during the run
     * @param itemsSkipped items already up to date
     * @param errorCount number of recorded errors
     * @param durationMs run duration
     */
    void trackSyncOperation(UserId userId, String integrationId, ProviderId provider,
                            int itemsProcessed, int itemsSkipped, int errorCount, long durationMs);

    /**
     * Returns a sink that discards everything.
     *
     * @return no-op sink
     */
    static MetricsSink noop() {
        return NoOpMetricsSink.INSTANCE;
    }
}
