package com.ryuqq.connector.testkit.contract;

import com.ryuqq.connector.application.webhook.WebhookAck;
import com.ryuqq.connector.core.exception.ValidationException;
import com.ryuqq.connector.core.model.InboundWebhook;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 5: Inbound Webhooks.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>An invalid signature is rejected before any handler or metric runs</li>
 *   <li>A signed supported event reaches its handler once per delivery</li>
 *   <li>Unsupported events are acknowledged without side effects</li>
 *   <li>Handler failures are acknowledged, not propagated</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
class WebhookContractTest extends AbstractContractTest {

    private static final String ROUTE = "github-alice";
    private static final String OPENED = "{\"action\":\"opened\",\"issue\":{\"number\":7}}";

    private final List<String> handled = new CopyOnWriteArrayList<>();

    private ScriptedAdapter connectWithIssueHandler() {
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        adapter.on("issues", payload -> handled.add(payload.body().at("/action").asText()));
        return adapter;
    }

    @Test
    void testWebhook_InvalidSignature_NoHandlerNoMetric() {
        // Given
        connectWithIssueHandler();
        InboundWebhook forged = webhookWithSignature("issues", OPENED, "sha256=" + "0".repeat(64));

        // When
        ValidationException rejected = assertThrows(ValidationException.class,
            () -> webhookDispatcher.dispatch(ROUTE, forged));

        // Then
        assertTrue(rejected.getMessage().contains("Invalid webhook signature"));
        assertTrue(handled.isEmpty(), "Handler must not run for a forged delivery");
        assertTrue(metrics.webhookEvents().isEmpty(), "No metric for a rejected delivery");
    }

    @Test
    void testWebhook_TamperedBody_Rejected() {
        // Given
        connectWithIssueHandler();
        InboundWebhook signed = signedWebhook("issues", OPENED);
        InboundWebhook tampered = webhookWithSignature("issues", OPENED.replace("opened", "closed"),
            signed.header(SIGNATURE_HEADER));

        // When & Then
        assertThrows(ValidationException.class, () -> webhookDispatcher.dispatch(ROUTE, tampered));
        assertTrue(handled.isEmpty());
    }

    @Test
    void testWebhook_SignedSupportedEvent_Handled() {
        // Given
        connectWithIssueHandler();

        // When
        WebhookAck ack = webhookDispatcher.dispatch(ROUTE, signedWebhook("issues", OPENED));

        // Then
        assertEquals(WebhookAck.Status.HANDLED, ack.status());
        assertEquals(List.of("opened"), handled);
        assertEquals(1, metrics.webhookEvents().size());
        assertEquals("issues", metrics.webhookEvents().get(0).eventType());
        assertEquals(ROUTE, metrics.webhookEvents().get(0).integrationId());
    }

    @Test
    void testWebhook_UnsupportedEvent_IgnoredWithoutSideEffects() {
        // Given
        connectWithIssueHandler();

        // When
        WebhookAck ack = webhookDispatcher.dispatch(ROUTE, signedWebhook("star", "{\"action\":\"created\"}"));

        // Then
        assertEquals(WebhookAck.Status.IGNORED, ack.status());
        assertTrue(handled.isEmpty());
        assertTrue(metrics.webhookEvents().isEmpty());
    }

    @Test
    void testWebhook_HandlerFailure_Acknowledged() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        adapter.on("issues", payload -> {
            throw new IllegalStateException("database unavailable");
        });

        // When
        WebhookAck ack = webhookDispatcher.dispatch(ROUTE, signedWebhook("issues", OPENED));

        // Then
        assertEquals(WebhookAck.Status.HANDLER_FAILED, ack.status());
        assertEquals(1, metrics.webhookEvents().size());
    }

    @Test
    void testWebhook_DisconnectedIntegration_NoLongerRouted() {
        // Given
        connectWithIssueHandler();

        // When
        registry.disconnect(ALICE, GITHUB);

        // Then
        assertThrows(ValidationException.class,
            () -> webhookDispatcher.dispatch(ROUTE, signedWebhook("issues", OPENED)));
        assertTrue(handled.isEmpty());
    }
}
