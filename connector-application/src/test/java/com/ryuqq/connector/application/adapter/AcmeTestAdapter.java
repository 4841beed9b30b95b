package com.ryuqq.connector.application.adapter;

import com.ryuqq.connector.core.contract.WebhookEventParser;
import com.ryuqq.connector.core.contract.WebhookVerifier;
import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.model.IntegrationCapability;
import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.IntegrationMetadata;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.model.WebhookPayload;
import com.ryuqq.connector.core.outcome.Ok;
import com.ryuqq.connector.core.outcome.VendorOutcome;
import com.ryuqq.connector.core.sync.ResourceSyncTask;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 응답을 테스트에서 지정하는 "acme" 어댑터.
 */
class AcmeTestAdapter extends AbstractIntegrationAdapter {

    static final ProviderId ACME = ProviderId.of("acme");

    @FunctionalInterface
    interface Exchange<T> {
        VendorOutcome<T> call(String input) throws IOException;
    }

    Exchange<AuthResult> credentials = input -> Ok.of(AuthResult.success("access-1", "refresh-1", null, List.of()));
    Exchange<AuthResult> refresh = input -> Ok.of(AuthResult.success("access-2", null, null, List.of()));
    Exchange<String> probe = input -> Ok.of("pong");
    Exchange<Boolean> revoke = input -> Ok.of(Boolean.TRUE);
    List<ResourceSyncTask> tasks = new ArrayList<>();
    final List<String> probedWith = new CopyOnWriteArrayList<>();
    final List<WebhookPayload> handledIssues = new CopyOnWriteArrayList<>();

    AcmeTestAdapter(IntegrationServices services, UserId userId, WebhookVerifier verifier, WebhookEventParser parser) {
        super(services, userId, "acme-" + userId.getValue(),
            new IntegrationMetadata(ACME, "Acme", "1.0.0", Set.of("issue")), verifier, parser);
        onWebhookEvent("issue", handledIssues::add);
    }

    @Override
    public List<IntegrationCapability> getCapabilities() {
        return List.of(
            IntegrationCapability.enabled("issues", "Read issues", List.of("read")),
            new IntegrationCapability("admin", "Manage projects", false, List.of("write")));
    }

    @Override
    protected VendorOutcome<AuthResult> exchangeCredentials(IntegrationConfig config) throws IOException {
        return credentials.call(config.clientId());
    }

    @Override
    protected VendorOutcome<AuthResult> exchangeRefreshToken(String refreshToken) throws IOException {
        return refresh.call(refreshToken);
    }

    @Override
    protected VendorOutcome<?> probeConnection(String accessToken) throws IOException {
        probedWith.add(accessToken);
        return probe.call(accessToken);
    }

    @Override
    protected VendorOutcome<Boolean> revokeToken(String accessToken) throws IOException {
        return revoke.call(accessToken);
    }

    @Override
    protected List<ResourceSyncTask> syncTasks() {
        return tasks;
    }
}
