package com.ryuqq.connector.application.auth;

import com.ryuqq.connector.core.contract.TokenRefresher;
import com.ryuqq.connector.core.exception.AuthenticationException;
import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.exception.RateLimitedException;
import com.ryuqq.connector.core.exception.VendorCallException;
import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.outcome.Fail;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.outcome.NeedsRefresh;
import com.ryuqq.connector.core.outcome.Ok;
import com.ryuqq.connector.core.outcome.RateLimited;
import com.ryuqq.connector.core.outcome.VendorOutcome;
import com.ryuqq.connector.core.protection.RetryAfterParser;
import com.ryuqq.connector.core.spi.IntegrationConfigStore;
import com.ryuqq.connector.core.spi.TokenVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * (사용자, Provider)별 토큰 갱신 single-flight 조정자.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>같은 키로 진행 중인 갱신이 있으면 새로 시작하지 않고 그 결과를 기다림</li>
 *   <li>없으면 in-flight future를 게시하고 갱신을 수행</li>
 *   <li>저장된 토큰이 호출자가 가진 만료 토큰과 다르면 이미 갱신된 것으로 보고 네트워크 호출 없이 반환</li>
 *   <li>새 토큰은 TokenVault로 암호화하여 저장한 뒤 in-flight 표시를 제거 (성공/실패 무관)</li>
 * </ol>
 *
 * <p>대기자는 소유자의 future가 완료될 때까지 기다리므로, 갱신 호출 자체의 타임아웃은
 * refresher 쪽에서 보장해야 합니다 ({@code ProtectedCallExecutor#withTimeout}).</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>Refresh token 자체가 거부됨 (401, 4xx, success=false): 통합을 disconnected로 표시하고 {@link AuthenticationException}</li>
 *   <li>네트워크 / 5xx: 연결 상태를 유지하고 {@link VendorCallException}</li>
 *   <li>429: {@link RateLimitedException}</li>
 * </ul>
 *
 * <p>토큰 값은 로그나 예외 메시지에 포함하지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class TokenRefreshCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TokenRefreshCoordinator.class);

    private final IntegrationConfigStore configStore;
    private final TokenVault vault;
    private final Clock clock;
    private final ConcurrentHashMap<RefreshKey, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    public TokenRefreshCoordinator(IntegrationConfigStore configStore, TokenVault vault) {
        this(configStore, vault, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param configStore 통합 설정 저장소
     * @param vault 토큰 암복호화
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TokenRefreshCoordinator(IntegrationConfigStore configStore, TokenVault vault, Clock clock) {
        if (configStore == null) {
            throw new IllegalArgumentException("configStore cannot be null");
        }
        if (vault == null) {
            throw new IllegalArgumentException("vault cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.configStore = configStore;
        this.vault = vault;
        this.clock = clock;
    }

    /**
     * 현재 저장된 access token을 복호화하여 반환.
     *
     * @param userId 사용자 ID
     * @param provider Provider
     * @return access token
     * @throws AuthenticationException 통합이 없거나 연결 해제되었거나 토큰이 없는 경우
     */
    public String currentAccessToken(UserId userId, ProviderId provider) {
        IntegrationConfig config = connectedConfig(userId, provider);
        if (config.encryptedAccessToken() == null) {
            throw new AuthenticationException(provider, "No access token stored for " + provider);
        }
        return vault.decrypt(config.encryptedAccessToken(), userId);
    }

    /**
     * 토큰 갱신 (single-flight).
     *
     * @param userId 사용자 ID
     * @param provider Provider
     * @param staleAccessToken 호출자가 401을 받은 토큰 (null이면 무조건 갱신)
     * @param refresher Vendor 갱신 호출
     * @return 새 access token
     * @throws AuthenticationException refresh token이 없거나 거부된 경우
     * @throws IntegrationException 일시적 실패 또는 대기 중 인터럽트
     */
    public String refresh(UserId userId, ProviderId provider, String staleAccessToken, TokenRefresher refresher) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (refresher == null) {
            throw new IllegalArgumentException("refresher cannot be null");
        }

        RefreshKey key = new RefreshKey(userId, provider);
        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight token refresh for {} {}", provider, userId);
            return await(existing, provider);
        }

        try {
            String token = doRefresh(userId, provider, staleAccessToken, refresher);
            mine.complete(token);
            return token;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * 진행 중인 갱신 수.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private String doRefresh(UserId userId, ProviderId provider, String staleAccessToken, TokenRefresher refresher) {
        IntegrationConfig config = connectedConfig(userId, provider);

        if (staleAccessToken != null && config.encryptedAccessToken() != null) {
            String stored = vault.decrypt(config.encryptedAccessToken(), userId);
            if (!stored.equals(staleAccessToken)) {
                log.debug("Access token for {} {} was already refreshed, reusing it", provider, userId);
                return stored;
            }
        }

        if (!config.hasRefreshToken()) {
            throw new AuthenticationException(provider, "No refresh token available for " + provider);
        }
        String refreshToken = vault.decrypt(config.encryptedRefreshToken(), userId);

        log.info("Refreshing access token for {} {}", provider, userId);
        VendorOutcome<AuthResult> outcome;
        try {
            outcome = refresher.refresh(refreshToken);
        } catch (IOException e) {
            log.warn("Token refresh for {} {} failed with network error: {}", provider, userId, e.getClass().getSimpleName());
            throw new VendorCallException(provider, FailureKind.NETWORK, 0, "Token refresh failed: network error");
        }
        if (outcome == null) {
            throw new IllegalStateException("TokenRefresher returned null outcome for " + provider);
        }

        if (outcome instanceof Ok) {
            AuthResult result = ((Ok<AuthResult>) outcome).value();
            if (result == null || !result.success()) {
                throw rejected(config, result != null ? result.error() : "empty refresh response");
            }
            store(config, result);
            log.info("Access token refreshed for {} {}, expires at {}", provider, userId, result.expiresAt());
            return result.accessToken();
        }
        if (outcome instanceof NeedsRefresh) {
            throw rejected(config, ((NeedsRefresh<AuthResult>) outcome).reason());
        }
        if (outcome instanceof RateLimited) {
            Duration retryAfter = ((RateLimited<AuthResult>) outcome).retryAfter();
            log.warn("Token refresh for {} {} was rate limited", provider, userId);
            throw new RateLimitedException(provider, clock.instant().plus(RetryAfterParser.clamp(retryAfter)));
        }

        Fail<AuthResult> fail = (Fail<AuthResult>) outcome;
        if (fail.kind().isTransient()) {
            log.warn("Token refresh for {} {} failed transiently: {}", provider, userId, fail.message());
            throw new VendorCallException(provider, fail.kind(), fail.status(), "Token refresh failed: " + fail.message());
        }
        throw rejected(config, fail.message());
    }

    private void store(IntegrationConfig config, AuthResult result) {
        String encryptedAccess = vault.encrypt(result.accessToken(), config.userId());
        String encryptedRefresh = result.refreshToken() != null
            ? vault.encrypt(result.refreshToken(), config.userId())
            : null;
        configStore.save(config.withTokens(encryptedAccess, encryptedRefresh, result.expiresAt()));
    }

    private AuthenticationException rejected(IntegrationConfig config, String reason) {
        configStore.save(config.disconnected());
        log.warn("Refresh token for {} {} was rejected ({}), integration marked disconnected",
            config.provider(), config.userId(), reason);
        return new AuthenticationException(config.provider(),
            "Refresh token rejected by " + config.provider() + ", re-authentication required");
    }

    private IntegrationConfig connectedConfig(UserId userId, ProviderId provider) {
        IntegrationConfig config = configStore.find(userId, provider)
            .orElseThrow(() -> new AuthenticationException(provider, "No integration configured for " + provider));
        if (!config.connected()) {
            throw new AuthenticationException(provider, "Integration with " + provider + " is disconnected");
        }
        return config;
    }

    private static String await(CompletableFuture<String> future, ProviderId provider) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IntegrationException(provider, "Token refresh failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntegrationException(provider, "Interrupted while waiting for token refresh", e);
        }
    }

    private record RefreshKey(UserId userId, ProviderId provider) {
    }
}
