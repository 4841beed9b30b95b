package com.ryuqq.connector.testkit.contract;

import com.ryuqq.connector.application.adapter.AbstractIntegrationAdapter;
import com.ryuqq.connector.application.adapter.IntegrationServices;
import com.ryuqq.connector.core.contract.WebhookEventParser;
import com.ryuqq.connector.core.contract.WebhookHandler;
import com.ryuqq.connector.core.contract.WebhookVerifier;
import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.model.IntegrationCapability;
import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.IntegrationMetadata;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.outcome.Ok;
import com.ryuqq.connector.core.outcome.VendorOutcome;
import com.ryuqq.connector.core.sync.ResourceSyncTask;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Provider adapter whose vendor endpoints are {@link ScriptedVendor}s.
 *
 * <p>Everything else (token storage, protection chain, sync fan-out, webhook
 * routing) is the real {@link AbstractIntegrationAdapter} behavior, so contract
 * tests exercise the same code paths a production adapter does.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ScriptedAdapter extends AbstractIntegrationAdapter {

    public static final String OPERATION_LIST_ISSUES = "issues.list";

    private final ScriptedVendor<AuthResult> credentials =
        ScriptedVendor.always(Ok.of(AuthResult.success("access-1", "refresh-1", null, List.of())));
    private final ScriptedVendor<AuthResult> refresh =
        ScriptedVendor.always(Ok.of(AuthResult.success("access-2", "refresh-2", null, List.of())));
    private final ScriptedVendor<String> probe = ScriptedVendor.always(Ok.of("pong"));
    private final ScriptedVendor<String> issues = ScriptedVendor.always(Ok.of("[]"));
    private final ScriptedVendor<Boolean> revoke = ScriptedVendor.always(Ok.of(Boolean.TRUE));
    private final List<IntegrationCapability> capabilities = new CopyOnWriteArrayList<>();
    private final List<ResourceSyncTask> syncTasks = new CopyOnWriteArrayList<>();

    public ScriptedAdapter(IntegrationServices services, UserId userId, ProviderId provider,
                           WebhookVerifier webhookVerifier, WebhookEventParser webhookEventParser) {
        super(services, userId, provider.getValue() + "-" + userId.getValue(),
            new IntegrationMetadata(provider, "Scripted " + provider.getValue(), "1.0.0", Set.of()),
            webhookVerifier, webhookEventParser);
    }

    public ScriptedVendor<AuthResult> credentials() {
        return credentials;
    }

    public ScriptedVendor<AuthResult> refresh() {
        return refresh;
    }

    public ScriptedVendor<String> probe() {
        return probe;
    }

    public ScriptedVendor<String> issues() {
        return issues;
    }

    public ScriptedVendor<Boolean> revoke() {
        return revoke;
    }

    /**
     * Calls the scripted issues endpoint through the protection chain.
     *
     * @return decoded response
     */
    public String listIssues() {
        return execute(OPERATION_LIST_ISSUES, issues);
    }

    public ScriptedAdapter withCapability(IntegrationCapability capability) {
        capabilities.add(capability);
        return this;
    }

    public ScriptedAdapter withSyncTask(ResourceSyncTask task) {
        syncTasks.add(task);
        return this;
    }

    public ScriptedAdapter on(String eventType, WebhookHandler handler) {
        onWebhookEvent(eventType, handler);
        return this;
    }

    @Override
    public List<IntegrationCapability> getCapabilities() {
        return List.copyOf(capabilities);
    }

    @Override
    protected VendorOutcome<AuthResult> exchangeCredentials(IntegrationConfig config) throws IOException {
        return credentials.call(null);
    }

    @Override
    protected VendorOutcome<AuthResult> exchangeRefreshToken(String refreshToken) throws IOException {
        return refresh.call(refreshToken);
    }

    @Override
    protected VendorOutcome<?> probeConnection(String accessToken) throws IOException {
        return probe.call(accessToken);
    }

    @Override
    protected VendorOutcome<Boolean> revokeToken(String accessToken) throws IOException {
        return revoke.call(accessToken);
    }

    @Override
    protected List<ResourceSyncTask> syncTasks() {
        return List.copyOf(syncTasks);
    }
}
