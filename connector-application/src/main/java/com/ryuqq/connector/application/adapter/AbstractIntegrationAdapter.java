package com.ryuqq.connector.application.adapter;

import com.ryuqq.connector.application.execution.CallContext;
import com.ryuqq.connector.application.sync.SyncRequest;
import com.ryuqq.connector.core.contract.IntegrationAdapter;
import com.ryuqq.connector.core.contract.VendorCall;
import com.ryuqq.connector.core.contract.WebhookEventParser;
import com.ryuqq.connector.core.contract.WebhookHandler;
import com.ryuqq.connector.core.contract.WebhookVerifier;
import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.exception.ValidationException;
import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.model.ConnectionStatus;
import com.ryuqq.connector.core.model.InboundWebhook;
import com.ryuqq.connector.core.model.IntegrationCapability;
import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.IntegrationMetadata;
import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.model.SyncResult;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.model.WebhookPayload;
import com.ryuqq.connector.core.outcome.Fail;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.outcome.NeedsRefresh;
import com.ryuqq.connector.core.outcome.Ok;
import com.ryuqq.connector.core.outcome.RateLimited;
import com.ryuqq.connector.core.outcome.VendorOutcome;
import com.ryuqq.connector.core.sync.ResourceSyncTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 공통 통합 계약의 기본 구현.
 *
 * <p>Provider별 어댑터는 이 클래스를 상속하여 Vendor HTTP 호출만 구현합니다.
 * 인증 상태 관리, 보호된 호출, 동기화, Webhook 라우팅은 이 클래스가 공유 엔진에 위임합니다.</p>
 *
 * <p><strong>하위 클래스 구현 항목:</strong></p>
 * <ul>
 *   <li>{@link #exchangeCredentials(IntegrationConfig)} - 최초 인증 (토큰 발급)</li>
 *   <li>{@link #exchangeRefreshToken(String)} - refresh token으로 access token 재발급</li>
 *   <li>{@link #probeConnection(String)} - 연결 확인용 가벼운 호출</li>
 *   <li>{@link #syncTasks()} - 리소스 타입별 동기화 작업</li>
 *   <li>{@link #getCapabilities()} - 기능과 필요 scope 선언</li>
 *   <li>{@link #revokeToken(String)} - 토큰 폐기 (선택, 기본은 로컬 해제만)</li>
 * </ul>
 *
 * <p>Webhook 이벤트 핸들러는 생성자에서 {@link #onWebhookEvent(String, WebhookHandler)}로 등록합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public abstract class AbstractIntegrationAdapter implements IntegrationAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractIntegrationAdapter.class);

    private static final String OPERATION_AUTHENTICATE = "auth.authenticate";
    private static final String OPERATION_REVOKE = "auth.revoke";
    private static final String OPERATION_TEST_CONNECTION = "connection.test";

    private final IntegrationServices services;
    private final UserId userId;
    private final String integrationId;
    private final IntegrationMetadata metadata;
    private final WebhookVerifier webhookVerifier;
    private final WebhookEventParser webhookEventParser;
    private final Map<String, WebhookHandler> webhookHandlers = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param services 공유 엔진 묶음
     * @param userId 사용자 ID
     * @param integrationId 통합 ID
     * @param metadata 어댑터 메타데이터
     * @param webhookVerifier Webhook 서명 검증 (Webhook 미지원 시 null)
     * @param webhookEventParser Webhook 본문 파서 (Webhook 미지원 시 null)
     */
    protected AbstractIntegrationAdapter(IntegrationServices services, UserId userId, String integrationId,
                                         IntegrationMetadata metadata, WebhookVerifier webhookVerifier,
                                         WebhookEventParser webhookEventParser) {
        if (services == null) {
            throw new IllegalArgumentException("services cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (integrationId == null || integrationId.isBlank()) {
            throw new IllegalArgumentException("integrationId cannot be null or blank");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        this.services = services;
        this.userId = userId;
        this.integrationId = integrationId;
        this.metadata = metadata;
        this.webhookVerifier = webhookVerifier;
        this.webhookEventParser = webhookEventParser;
    }

    // ---- 하위 클래스 구현 항목 ----

    /**
     * 최초 인증 (자격 증명 → 토큰).
     */
    protected abstract VendorOutcome<AuthResult> exchangeCredentials(IntegrationConfig config) throws IOException;

    /**
     * refresh token으로 access token 재발급.
     */
    protected abstract VendorOutcome<AuthResult> exchangeRefreshToken(String refreshToken) throws IOException;

    /**
     * 연결 확인용 호출 (예: GET /user).
     */
    protected abstract VendorOutcome<?> probeConnection(String accessToken) throws IOException;

    /**
     * 리소스 타입별 동기화 작업.
     */
    protected abstract List<ResourceSyncTask> syncTasks();

    /**
     * Vendor 측 토큰 폐기. 기본 구현은 폐기 API가 없는 Provider용으로 바로 성공합니다.
     */
    protected VendorOutcome<Boolean> revokeToken(String accessToken) throws IOException {
        return Ok.of(Boolean.TRUE);
    }

    // ---- 공통 계약 ----

    @Override
    public IntegrationMetadata metadata() {
        return metadata;
    }

    @Override
    public UserId getUserId() {
        return userId;
    }

    @Override
    public String getIntegrationId() {
        return integrationId;
    }

    @Override
    public AuthResult authenticate() {
        ProviderId provider = getProvider();
        Optional<IntegrationConfig> found = services.configStore().find(userId, provider);
        if (found.isEmpty()) {
            return AuthResult.failure("Integration with " + provider + " is not configured");
        }
        IntegrationConfig config = found.get();

        long startNanos = System.nanoTime();
        VendorOutcome<AuthResult> outcome;
        try {
            outcome = services.callExecutor().callWithTimeout(provider, "Authentication",
                () -> exchangeCredentials(config));
        } catch (IntegrationException e) {
            trackAuth(startNanos, false);
            log.warn("Authentication with {} failed: {}", provider, e.getMessage());
            return AuthResult.failure("Authentication with " + provider + " did not complete");
        }

        AuthResult result = toAuthResult(outcome);
        trackAuth(startNanos, result.success());
        if (!result.success()) {
            log.warn("Authentication with {} failed: {}", provider, result.error());
            return result;
        }

        String encryptedAccess = services.tokenVault().encrypt(result.accessToken(), userId);
        String encryptedRefresh = result.refreshToken() != null
            ? services.tokenVault().encrypt(result.refreshToken(), userId)
            : null;
        IntegrationConfig authenticated = config.withTokens(encryptedAccess, encryptedRefresh, result.expiresAt());
        if (!result.scope().isEmpty()) {
            authenticated = authenticated.withScopes(result.scope());
        }
        services.configStore().save(authenticated);
        log.info("Authenticated {} integration {}", provider, integrationId);
        return result;
    }

    @Override
    public AuthResult refreshToken() {
        try {
            String accessToken = services.tokenRefreshCoordinator()
                .refresh(userId, getProvider(), null,
                    services.callExecutor().withTimeout(getProvider(), this::exchangeRefreshToken));
            IntegrationConfig config = services.configStore().find(userId, getProvider()).orElse(null);
            return AuthResult.success(accessToken, null,
                config != null ? config.tokenExpiry() : null,
                config != null ? config.scopes() : List.of());
        } catch (IntegrationException e) {
            return AuthResult.failure(e.getMessage());
        }
    }

    @Override
    public boolean revokeAccess() {
        ProviderId provider = getProvider();
        IntegrationConfig config = services.configStore().find(userId, provider).orElse(null);
        if (config == null || !config.connected()) {
            return false;
        }
        try {
            Boolean revoked = execute(OPERATION_REVOKE, this::revokeToken);
            if (!Boolean.TRUE.equals(revoked)) {
                log.warn("{} did not confirm token revocation for integration {}", provider, integrationId);
                return false;
            }
        } catch (IntegrationException e) {
            log.warn("Token revocation with {} failed: {}", provider, e.getMessage());
            return false;
        }
        services.configStore().save(config.disconnected());
        log.info("Access revoked for {} integration {}", provider, integrationId);
        return true;
    }

    @Override
    public ConnectionStatus testConnection() {
        ProviderId provider = getProvider();
        Instant now = services.clock().instant();
        IntegrationConfig config = services.configStore().find(userId, provider).orElse(null);
        if (config == null || !config.connected()) {
            return ConnectionStatus.disconnected(now, "Integration with " + provider + " is not connected");
        }
        try {
            execute(OPERATION_TEST_CONNECTION, accessToken -> withoutValue(probeConnection(accessToken)));
            return ConnectionStatus.connected(now, services.rateGovernor().rateLimitInfo(provider));
        } catch (IntegrationException e) {
            return ConnectionStatus.disconnected(now, e.getMessage(), services.rateGovernor().rateLimitInfo(provider));
        }
    }

    @Override
    public boolean validateRequiredScopes(Collection<String> scopes) {
        if (scopes == null) {
            throw new IllegalArgumentException("scopes cannot be null");
        }
        Set<String> declared = new HashSet<>();
        for (IntegrationCapability capability : getCapabilities()) {
            if (capability.enabled()) {
                declared.addAll(capability.requiredScopes());
            }
        }
        return declared.containsAll(scopes);
    }

    @Override
    public SyncResult syncData(Instant lastSyncTime) {
        SyncRequest request = SyncRequest.of(userId, getProvider(), integrationId, syncTasks())
            .withLastSyncTimeOverride(lastSyncTime);
        return services.syncOrchestrator().sync(request);
    }

    @Override
    public SyncResult fullSync() {
        return services.syncOrchestrator().sync(
            SyncRequest.of(userId, getProvider(), integrationId, syncTasks()).asFullSync());
    }

    /**
     * 리소스 타입 cursor 중 가장 오래된 값 (모든 타입이 이 시각까지 반영됨).
     */
    @Override
    public Optional<Instant> getLastSyncTime() {
        return services.cursorStore().findAll(userId, getProvider()).stream()
            .map(SyncCursor::lastSyncTime)
            .min(Comparator.naturalOrder());
    }

    @Override
    public void handleWebhook(WebhookPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        WebhookHandler handler = webhookHandlers.get(payload.eventType());
        if (handler == null) {
            log.info("Ignoring unsupported webhook event {} for {} integration {}",
                payload.eventType(), getProvider(), integrationId);
            return;
        }
        handler.handle(payload);
    }

    @Override
    public boolean validateWebhookSignature(InboundWebhook webhook, String signature) {
        if (webhookVerifier == null) {
            log.warn("No webhook verifier configured for {}, rejecting webhook", getProvider());
            return false;
        }
        return webhookVerifier.verify(webhook, signature);
    }

    @Override
    public String webhookSignatureHeader() {
        return webhookVerifier != null ? webhookVerifier.signatureHeader() : null;
    }

    @Override
    public WebhookPayload parseWebhook(InboundWebhook webhook) {
        if (webhookEventParser == null) {
            throw new ValidationException(getProvider(), getProvider() + " does not accept webhooks");
        }
        return webhookEventParser.parse(webhook);
    }

    @Override
    public boolean supportsWebhookEvent(String eventType) {
        return eventType != null && webhookHandlers.containsKey(eventType);
    }

    // ---- 하위 클래스용 도구 ----

    /**
     * 보호된 Vendor 호출 (breaker, governor, 401 갱신, 로컬 재시도 적용).
     *
     * @param operation 연산 이름 (예: "issues.list")
     * @param call Vendor 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    protected <T> T execute(String operation, VendorCall<T> call) {
        return services.callExecutor().execute(OperationKey.of(getProvider(), operation), callContext(), call);
    }

    /**
     * Webhook 이벤트 핸들러 등록.
     *
     * @param eventType 이벤트 타입
     * @param handler 핸들러 (재전송에 대해 멱등이어야 함)
     */
    protected final void onWebhookEvent(String eventType, WebhookHandler handler) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        webhookHandlers.put(eventType, handler);
    }

    protected final IntegrationServices services() {
        return services;
    }

    protected final CallContext callContext() {
        return new CallContext(userId, integrationId, this::exchangeRefreshToken);
    }

    private AuthResult toAuthResult(VendorOutcome<AuthResult> outcome) {
        if (outcome instanceof Ok) {
            AuthResult result = ((Ok<AuthResult>) outcome).value();
            return result != null ? result : AuthResult.failure("Empty authentication response from " + getProvider());
        }
        if (outcome instanceof NeedsRefresh) {
            return AuthResult.failure("Invalid credentials for " + getProvider());
        }
        if (outcome instanceof RateLimited) {
            return AuthResult.failure("Rate limited by " + getProvider() + " during authentication");
        }
        if (outcome instanceof Fail) {
            Fail<AuthResult> fail = (Fail<AuthResult>) outcome;
            if (fail.kind() == FailureKind.NETWORK) {
                return AuthResult.failure("Network error during authentication with " + getProvider());
            }
            if (fail.kind() == FailureKind.TIMEOUT) {
                return AuthResult.failure("Authentication with " + getProvider() + " timed out");
            }
            return AuthResult.failure(fail.message());
        }
        return AuthResult.failure("No authentication response from " + getProvider());
    }

    private static VendorOutcome<Void> withoutValue(VendorOutcome<?> outcome) {
        if (outcome instanceof NeedsRefresh) {
            return NeedsRefresh.of(((NeedsRefresh<?>) outcome).reason());
        }
        if (outcome instanceof RateLimited) {
            return new RateLimited<>(((RateLimited<?>) outcome).retryAfter());
        }
        if (outcome instanceof Fail) {
            Fail<?> fail = (Fail<?>) outcome;
            return Fail.of(fail.kind(), fail.status(), fail.message());
        }
        return Ok.of(null);
    }

    private void trackAuth(long startNanos, boolean success) {
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        services.metrics().trackApiCall(userId, integrationId, getProvider(), OPERATION_AUTHENTICATE, durationMs, success);
    }
}
