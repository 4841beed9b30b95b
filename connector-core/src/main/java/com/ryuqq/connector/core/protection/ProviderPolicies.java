package com.ryuqq.connector.core.protection;

import com.ryuqq.connector.core.model.ProviderId;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider별 정책 레지스트리.
 *
 * <p>등록되지 않은 Provider는 기본 정책을 사용합니다.</p>
 *
 * <pre>{@code
 * ProviderPolicies<CircuitBreakerConfig> policies = ProviderPolicies.withDefault(new CircuitBreakerConfig())
 *     .with(ProviderId.of("slack"), new CircuitBreakerConfig(3, Duration.ofSeconds(60), Duration.ofSeconds(30)))
 *     .with(ProviderId.of("github"), new CircuitBreakerConfig(8, Duration.ofSeconds(60), Duration.ofSeconds(120)));
 * }</pre>
 *
 * @param <P> 정책 타입
 * @author Connector Team
 * @since 1.0.0
 */
public final class ProviderPolicies<P> {

    private final P defaultPolicy;
    private final Map<ProviderId, P> overrides = new ConcurrentHashMap<>();

    private ProviderPolicies(P defaultPolicy) {
        this.defaultPolicy = defaultPolicy;
    }

    public static <P> ProviderPolicies<P> withDefault(P defaultPolicy) {
        if (defaultPolicy == null) {
            throw new IllegalArgumentException("defaultPolicy cannot be null");
        }
        return new ProviderPolicies<>(defaultPolicy);
    }

    /**
     * Provider 전용 정책 등록.
     *
     * @return this (체이닝)
     */
    public ProviderPolicies<P> with(ProviderId provider, P policy) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        overrides.put(provider, policy);
        return this;
    }

    public P forProvider(ProviderId provider) {
        return overrides.getOrDefault(provider, defaultPolicy);
    }

    public P defaultPolicy() {
        return defaultPolicy;
    }
}
