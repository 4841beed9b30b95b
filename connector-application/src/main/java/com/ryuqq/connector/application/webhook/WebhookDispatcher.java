package com.ryuqq.connector.application.webhook;

import com.ryuqq.connector.application.metrics.GuardedMetricsSink;
import com.ryuqq.connector.core.contract.IntegrationAdapter;
import com.ryuqq.connector.core.exception.ValidationException;
import com.ryuqq.connector.core.model.InboundWebhook;
import com.ryuqq.connector.core.model.WebhookPayload;
import com.ryuqq.connector.core.spi.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Inbound Webhook 디스패처.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * dispatch(integrationId, webhook)
 *   ↓
 * 1. 통합 조회 (없거나 Provider 불일치 → ValidationException)
 * 2. 서명 검증 (실패 → ValidationException, 핸들러/메트릭 부작용 없음)
 * 3. 표준 WebhookPayload로 파싱 (본문 오류 → ValidationException)
 * 4. 이벤트 타입 분류
 *      미지원 타입 → 로그 후 IGNORED
 *      지원 타입   → adapter.handleWebhook → HANDLED
 *                    핸들러 예외 → 로그 후 HANDLER_FAILED (재전송을 유발하지 않도록 수신 확인)
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final MetricsSink metrics;
    private final ConcurrentHashMap<String, IntegrationAdapter> routes = new ConcurrentHashMap<>();

    public WebhookDispatcher(MetricsSink metrics) {
        this.metrics = GuardedMetricsSink.wrap(metrics);
    }

    /**
     * 통합 등록 (같은 integrationId는 교체).
     *
     * @param adapter 통합 어댑터
     */
    public void register(IntegrationAdapter adapter) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        routes.put(adapter.getIntegrationId(), adapter);
        log.debug("Webhook route registered for {} integration {}", adapter.getProvider(), adapter.getIntegrationId());
    }

    /**
     * 통합 등록 해제.
     *
     * @param integrationId 통합 ID
     * @return 해제 여부
     */
    public boolean unregister(String integrationId) {
        return integrationId != null && routes.remove(integrationId) != null;
    }

    public Optional<IntegrationAdapter> route(String integrationId) {
        return integrationId == null ? Optional.empty() : Optional.ofNullable(routes.get(integrationId));
    }

    /**
     * Webhook 디스패치.
     *
     * @param integrationId 수신 경로의 통합 ID
     * @param webhook 원본 요청
     * @return 처리 결과 (모두 수신 확인 대상)
     * @throws ValidationException 라우팅 실패, 서명 불일치, 본문 오류 시
     */
    public WebhookAck dispatch(String integrationId, InboundWebhook webhook) {
        if (webhook == null) {
            throw new IllegalArgumentException("webhook cannot be null");
        }
        IntegrationAdapter adapter = route(integrationId)
            .orElseThrow(() -> new ValidationException(webhook.provider(),
                "No integration registered for webhook route " + integrationId));
        if (!adapter.getProvider().equals(webhook.provider())) {
            throw new ValidationException(webhook.provider(),
                "Webhook from " + webhook.provider() + " does not match integration provider " + adapter.getProvider());
        }

        String signatureHeader = adapter.webhookSignatureHeader();
        String signature = signatureHeader != null ? webhook.header(signatureHeader) : null;
        if (!adapter.validateWebhookSignature(webhook, signature)) {
            log.warn("Rejected webhook for {} integration {}: signature verification failed",
                webhook.provider(), integrationId);
            throw new ValidationException(webhook.provider(), "Invalid webhook signature for " + webhook.provider());
        }

        WebhookPayload payload = adapter.parseWebhook(webhook);
        String eventType = payload.eventType();
        if (!adapter.supportsWebhookEvent(eventType)) {
            log.info("Ignoring unsupported webhook event {} from {}", eventType, webhook.provider());
            return WebhookAck.ignored(eventType);
        }

        long startNanos = System.nanoTime();
        WebhookAck ack;
        try {
            adapter.handleWebhook(payload);
            ack = WebhookAck.handled(eventType);
        } catch (RuntimeException e) {
            log.error("Webhook handler for {} event {} failed, acknowledging anyway", webhook.provider(), eventType, e);
            ack = WebhookAck.handlerFailed(eventType);
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        metrics.trackWebhookEvent(adapter.getUserId(), adapter.getIntegrationId(), adapter.getProvider(),
            eventType, durationMs);
        return ack;
    }

    public int size() {
        return routes.size();
    }
}
