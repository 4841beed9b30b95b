package com.ryuqq.connector.testkit.contract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.connector.adapter.inmemory.store.InMemoryCircuitStateStore;
import com.ryuqq.connector.adapter.inmemory.store.InMemoryIntegrationConfigStore;
import com.ryuqq.connector.adapter.inmemory.store.InMemorySyncCursorStore;
import com.ryuqq.connector.adapter.protection.circuit.KeyedCircuitBreaker;
import com.ryuqq.connector.adapter.protection.ratelimit.TokenBucketRateGovernor;
import com.ryuqq.connector.adapter.protection.vault.AesGcmTokenVault;
import com.ryuqq.connector.adapter.protection.webhook.HmacSha256WebhookVerifier;
import com.ryuqq.connector.application.adapter.IntegrationRegistry;
import com.ryuqq.connector.application.adapter.IntegrationServices;
import com.ryuqq.connector.application.auth.TokenRefreshCoordinator;
import com.ryuqq.connector.application.execution.CallPolicy;
import com.ryuqq.connector.application.execution.ProtectedCallExecutor;
import com.ryuqq.connector.application.sync.SyncOrchestrator;
import com.ryuqq.connector.application.sync.SyncPolicy;
import com.ryuqq.connector.application.webhook.JsonWebhookEventParser;
import com.ryuqq.connector.application.webhook.WebhookDispatcher;
import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.model.InboundWebhook;
import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.protection.CircuitBreakerConfig;
import com.ryuqq.connector.core.protection.ProviderPolicies;
import com.ryuqq.connector.core.protection.RateLimitPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires the real protection chain over in-memory stores so that each contract
 * test observes the behavior a production deployment would show.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>MutableClock: time only moves when a test (or a backoff sleep) advances it</li>
 *   <li>KeyedCircuitBreaker over InMemoryCircuitStateStore</li>
 *   <li>TokenBucketRateGovernor whose waits advance the clock instead of sleeping</li>
 *   <li>AesGcmTokenVault: tokens are encrypted at rest</li>
 *   <li>RecordingMetricsSink: every emitted metric is kept for assertions</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         ScriptedAdapter adapter = connect(ALICE, GITHUB);
 *         adapter.issues().then(Fail.of(FailureKind.SERVER_ERROR, 503, "unavailable"));
 *         // ... test logic ...
 *     }
 * }
 * </pre>
 *
 * <p>Subclasses tune the wiring by overriding {@link #callPolicy()},
 * {@link #rateLimitPolicy()} or {@link #circuitBreakerConfig()}.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    protected static final UserId ALICE = UserId.of("alice");
    protected static final UserId BOB = UserId.of("bob");
    protected static final ProviderId GITHUB = ProviderId.of("github");
    protected static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    protected static final String EVENT_HEADER = "X-GitHub-Event";
    protected static final String WEBHOOK_SECRET = "contract-webhook-secret";

    // Key derivation is slow; one vault serves every test.
    private static final AesGcmTokenVault VAULT = new AesGcmTokenVault("contract-secret", "contract-salt", 1_000);

    protected MutableClock clock;
    protected InMemoryIntegrationConfigStore configStore;
    protected InMemorySyncCursorStore cursorStore;
    protected InMemoryCircuitStateStore circuitStore;
    protected KeyedCircuitBreaker circuitBreaker;
    protected TokenBucketRateGovernor rateGovernor;
    protected AesGcmTokenVault vault;
    protected RecordingMetricsSink metrics;
    protected TokenRefreshCoordinator tokenRefreshCoordinator;
    protected ProtectedCallExecutor callExecutor;
    protected SyncOrchestrator syncOrchestrator;
    protected IntegrationServices services;
    protected WebhookDispatcher webhookDispatcher;
    protected IntegrationRegistry registry;
    protected HmacSha256WebhookVerifier webhookVerifier;
    protected ObjectMapper objectMapper;

    private ExecutorService vendorPool;
    private ExecutorService syncPool;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh stores and a fresh protection chain; nothing is shared
     * between tests except the key-derived vault.</p>
     */
    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        configStore = new InMemoryIntegrationConfigStore();
        cursorStore = new InMemorySyncCursorStore();
        circuitStore = new InMemoryCircuitStateStore();
        vault = VAULT;
        metrics = new RecordingMetricsSink();
        objectMapper = new ObjectMapper();

        circuitBreaker = new KeyedCircuitBreaker(circuitStore,
            ProviderPolicies.withDefault(circuitBreakerConfig()), clock);
        rateGovernor = new TokenBucketRateGovernor(ProviderPolicies.withDefault(rateLimitPolicy()), clock,
            clock::advance, () -> 0.5);
        tokenRefreshCoordinator = new TokenRefreshCoordinator(configStore, vault, clock);

        vendorPool = Executors.newCachedThreadPool();
        syncPool = Executors.newCachedThreadPool();
        callExecutor = new ProtectedCallExecutor(circuitBreaker, rateGovernor, tokenRefreshCoordinator, metrics,
            ProviderPolicies.withDefault(callPolicy()), vendorPool, clock::advance);
        syncOrchestrator = new SyncOrchestrator(cursorStore, metrics,
            ProviderPolicies.withDefault(new SyncPolicy()), syncPool, clock);

        services = new IntegrationServices(callExecutor, tokenRefreshCoordinator, syncOrchestrator, rateGovernor,
            configStore, cursorStore, vault, metrics, clock);
        webhookDispatcher = new WebhookDispatcher(metrics);
        registry = new IntegrationRegistry(configStore, cursorStore, webhookDispatcher);
        webhookVerifier = HmacSha256WebhookVerifier.builder(SIGNATURE_HEADER, WEBHOOK_SECRET)
            .prefix("sha256=")
            .build();
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Stops the worker pools so held vendors from a failed test cannot leak
     * into the next one.</p>
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        if (callExecutor != null) {
            callExecutor.shutdown();
        }
        if (syncOrchestrator != null) {
            syncOrchestrator.shutdown();
        }
        if (configStore != null) {
            configStore.clear();
        }
        if (metrics != null) {
            metrics.clear();
        }
    }

    /**
     * Call policy applied to every provider. Transient retries are off by default.
     */
    protected CallPolicy callPolicy() {
        return new CallPolicy().withMaxTransientRetries(0);
    }

    /**
     * Rate limit policy applied to every provider. Generous enough that local
     * throttling never interferes unless a test asks for it.
     */
    protected RateLimitPolicy rateLimitPolicy() {
        return RateLimitPolicy.of(1_000, 1_000);
    }

    protected CircuitBreakerConfig circuitBreakerConfig() {
        return new CircuitBreakerConfig();
    }

    /**
     * Creates, authenticates and registers an adapter for the user.
     *
     * <p>The credential exchange hands out {@code access-1} and {@code refresh-1};
     * the refresh endpoint rotates them to {@code access-2} and {@code refresh-2}.</p>
     *
     * @param userId the user
     * @param provider the provider
     * @return the connected adapter
     */
    protected ScriptedAdapter connect(UserId userId, ProviderId provider) {
        configStore.save(IntegrationConfig.of(userId, provider)
            .withClient("client-id", "client-secret", "https://api.example.test"));
        ScriptedAdapter adapter = new ScriptedAdapter(services, userId, provider, webhookVerifier,
            JsonWebhookEventParser.fromHeader(objectMapper, EVENT_HEADER));
        AuthResult result = adapter.authenticate();
        assertTrue(result.success(), "authentication should succeed: " + result.error());
        registry.register(adapter);
        return adapter;
    }

    /**
     * Builds an inbound webhook signed with the shared webhook secret.
     *
     * @param eventType value of the event type header
     * @param body raw JSON body
     * @return the signed webhook
     */
    protected InboundWebhook signedWebhook(String eventType, String body) {
        byte[] raw = body.getBytes(StandardCharsets.UTF_8);
        return new InboundWebhook(GITHUB,
            Map.of(SIGNATURE_HEADER, webhookVerifier.signatureFor(raw, null), EVENT_HEADER, eventType),
            raw, clock.instant());
    }

    protected InboundWebhook webhookWithSignature(String eventType, String body, String signature) {
        return new InboundWebhook(GITHUB, Map.of(SIGNATURE_HEADER, signature, EVENT_HEADER, eventType),
            body.getBytes(StandardCharsets.UTF_8), clock.instant());
    }

    protected IntegrationConfig storedConfig(UserId userId, ProviderId provider) {
        return configStore.find(userId, provider)
            .orElseThrow(() -> new AssertionError("no stored config for " + userId + "/" + provider));
    }

    protected static OperationKey issuesKey(ProviderId provider) {
        return OperationKey.of(provider, ScriptedAdapter.OPERATION_LIST_ISSUES);
    }
}
