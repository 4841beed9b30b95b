package com.ryuqq.connector.application.adapter;

import com.ryuqq.connector.application.webhook.WebhookDispatcher;
import com.ryuqq.connector.core.contract.IntegrationAdapter;
import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.IntegrationConfigStore;
import com.ryuqq.connector.core.spi.SyncCursorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * (사용자, Provider)별 활성 통합 레지스트리.
 *
 * <p>등록 시 Webhook 라우트도 함께 등록하며, disconnect 시 Vendor 토큰 폐기,
 * 설정과 cursor 삭제, Webhook 라우트 해제를 한 번에 수행합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class IntegrationRegistry {

    private static final Logger log = LoggerFactory.getLogger(IntegrationRegistry.class);

    private final IntegrationConfigStore configStore;
    private final SyncCursorStore cursorStore;
    private final WebhookDispatcher webhookDispatcher;
    private final ConcurrentHashMap<RegistryKey, IntegrationAdapter> adapters = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param configStore 통합 설정 저장소
     * @param cursorStore cursor 저장소
     * @param webhookDispatcher Webhook 디스패처 (Webhook 미사용 시 null)
     */
    public IntegrationRegistry(IntegrationConfigStore configStore, SyncCursorStore cursorStore,
                               WebhookDispatcher webhookDispatcher) {
        if (configStore == null) {
            throw new IllegalArgumentException("configStore cannot be null");
        }
        if (cursorStore == null) {
            throw new IllegalArgumentException("cursorStore cannot be null");
        }
        this.configStore = configStore;
        this.cursorStore = cursorStore;
        this.webhookDispatcher = webhookDispatcher;
    }

    /**
     * 통합 등록 (같은 사용자/Provider는 교체).
     *
     * @param adapter 통합 어댑터
     */
    public void register(IntegrationAdapter adapter) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        IntegrationAdapter previous = adapters.put(new RegistryKey(adapter.getUserId(), adapter.getProvider()), adapter);
        if (webhookDispatcher != null) {
            if (previous != null && !previous.getIntegrationId().equals(adapter.getIntegrationId())) {
                webhookDispatcher.unregister(previous.getIntegrationId());
            }
            webhookDispatcher.register(adapter);
        }
        log.info("Registered {} integration {}", adapter.getProvider(), adapter.getIntegrationId());
    }

    public Optional<IntegrationAdapter> find(UserId userId, ProviderId provider) {
        if (userId == null || provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(new RegistryKey(userId, provider)));
    }

    /**
     * 통합 조회 (없으면 예외).
     *
     * @throws IntegrationException 등록된 통합이 없는 경우
     */
    public IntegrationAdapter require(UserId userId, ProviderId provider) {
        return find(userId, provider)
            .orElseThrow(() -> new IntegrationException(provider, "No " + provider + " integration registered"));
    }

    public List<IntegrationAdapter> forUser(UserId userId) {
        return adapters.entrySet().stream()
            .filter(entry -> entry.getKey().userId().equals(userId))
            .map(entry -> entry.getValue())
            .sorted(Comparator.comparing(adapter -> adapter.getProvider().getValue()))
            .collect(Collectors.toList());
    }

    public List<IntegrationAdapter> forProvider(ProviderId provider) {
        return adapters.entrySet().stream()
            .filter(entry -> entry.getKey().provider().equals(provider))
            .map(entry -> entry.getValue())
            .sorted(Comparator.comparing(IntegrationAdapter::getIntegrationId))
            .collect(Collectors.toList());
    }

    /**
     * 등록된 전체 통합 (integrationId 순).
     */
    public List<IntegrationAdapter> all() {
        return adapters.values().stream()
            .sorted(Comparator.comparing(IntegrationAdapter::getIntegrationId))
            .collect(Collectors.toList());
    }

    /**
     * 통합 해제.
     *
     * <p>Vendor 토큰 폐기가 실패해도 로컬 상태는 삭제합니다.</p>
     *
     * @param userId 사용자 ID
     * @param provider Provider
     * @return Vendor 측 토큰 폐기 성공 여부 (등록된 통합이 없으면 false)
     */
    public boolean disconnect(UserId userId, ProviderId provider) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        IntegrationAdapter adapter = adapters.remove(new RegistryKey(userId, provider));

        boolean revoked = false;
        if (adapter != null) {
            try {
                revoked = adapter.revokeAccess();
            } catch (RuntimeException e) {
                log.warn("Revoking {} access failed during disconnect: {}", provider, e.toString());
            }
            if (webhookDispatcher != null) {
                webhookDispatcher.unregister(adapter.getIntegrationId());
            }
        }
        configStore.delete(userId, provider);
        cursorStore.deleteAll(userId, provider);
        log.info("Disconnected {} integration for {} (revoked={})", provider, userId, revoked);
        return revoked;
    }

    public int size() {
        return adapters.size();
    }

    private record RegistryKey(UserId userId, ProviderId provider) {
    }
}
