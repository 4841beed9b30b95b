package com.ryuqq.connector.adapter.protection.circuit;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.protection.CircuitBreaker;
import com.ryuqq.connector.core.protection.CircuitBreakerConfig;
import com.ryuqq.connector.core.protection.CircuitBreakerState;
import com.ryuqq.connector.core.protection.CircuitHealth;
import com.ryuqq.connector.core.protection.CircuitState;
import com.ryuqq.connector.core.protection.ProviderPolicies;
import com.ryuqq.connector.core.spi.CircuitStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link CircuitStateStore} 기반 (Provider, Operation) 키별 Circuit Breaker.
 *
 * <p>모든 상태 전이는 "읽기 → 새 스냅샷 계산 → compareAndSet" 루프로 수행합니다.
 * CAS에 실패하면 다른 호출이 먼저 전이시킨 것이므로 최신 상태를 다시 읽어 재계산합니다.
 * 따라서 OPEN → HALF_OPEN 전이와 probe 획득은 정확히 한 호출만 성공합니다.</p>
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED: 첫 실패로부터 rollingWindow 안에 failureThreshold번 연속 실패하면 OPEN</li>
 *   <li>OPEN: openCooldown 동안 거부, 이후 첫 호출이 HALF_OPEN probe가 됨</li>
 *   <li>HALF_OPEN: probe 성공 → CLOSED, probe 실패 → OPEN (openedAt 갱신)</li>
 * </ul>
 *
 * <p>CLOSED 상태의 tryAcquire는 저장소에 쓰지 않으므로 정상 경로에는 CAS 경합이 없습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class KeyedCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(KeyedCircuitBreaker.class);

    private final CircuitStateStore store;
    private final ProviderPolicies<CircuitBreakerConfig> policies;
    private final Clock clock;

    /**
     * 기본 설정(5회 / 60초 / 30초)으로 생성.
     *
     * @param store 공유 상태 저장소
     */
    public KeyedCircuitBreaker(CircuitStateStore store) {
        this(store, ProviderPolicies.withDefault(new CircuitBreakerConfig()), Clock.systemUTC());
    }

    /**
     * Provider별 설정으로 생성.
     *
     * @param store 공유 상태 저장소
     * @param policies Provider별 설정
     * @param clock 시계
     */
    public KeyedCircuitBreaker(CircuitStateStore store, ProviderPolicies<CircuitBreakerConfig> policies, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.policies = policies;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(OperationKey key) {
        requireKey(key);
        while (true) {
            CircuitState current = store.find(key).orElse(null);
            if (current == null || current.status() == CircuitBreakerState.CLOSED) {
                return true;
            }

            Instant now = clock.instant();
            CircuitState updated;
            boolean acquired;

            if (current.status() == CircuitBreakerState.OPEN) {
                if (now.isBefore(cooldownEnd(current))) {
                    updated = current.withRejectionRecorded();
                    acquired = false;
                } else {
                    updated = current.withStatus(CircuitBreakerState.HALF_OPEN, current.openedAt(), true);
                    acquired = true;
                }
            } else if (current.probeInFlight()) {
                updated = current.withRejectionRecorded();
                acquired = false;
            } else {
                updated = current.withStatus(CircuitBreakerState.HALF_OPEN, current.openedAt(), true);
                acquired = true;
            }

            if (store.compareAndSet(key, current, updated)) {
                if (acquired && current.status() == CircuitBreakerState.OPEN) {
                    log.info("Circuit {} transitioned OPEN -> HALF_OPEN, probe admitted", key);
                }
                return acquired;
            }
        }
    }

    @Override
    public void recordSuccess(OperationKey key) {
        requireKey(key);
        while (true) {
            CircuitState current = store.find(key).orElse(null);
            CircuitState base = current != null ? current : CircuitState.initial(key);

            boolean probeVerdict = base.status() == CircuitBreakerState.HALF_OPEN && base.probeInFlight();
            CircuitState updated = switch (base.status()) {
                case CLOSED -> base.closed().withSuccessRecorded();
                case HALF_OPEN -> probeVerdict ? base.closed().withSuccessRecorded() : base.withSuccessRecorded();
                // OPEN 이전에 시작된 호출의 늦은 성공은 상태를 바꾸지 않음
                case OPEN -> base.withSuccessRecorded();
            };

            if (store.compareAndSet(key, current, updated)) {
                if (probeVerdict) {
                    log.info("Circuit {} transitioned HALF_OPEN -> CLOSED", key);
                }
                return;
            }
        }
    }

    @Override
    public void recordFailure(OperationKey key, FailureKind kind) {
        requireKey(key);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (!kind.countsTowardBreaker()) {
            releasePermit(key);
            return;
        }

        CircuitBreakerConfig config = policies.forProvider(key.provider());
        while (true) {
            CircuitState current = store.find(key).orElse(null);
            CircuitState base = current != null ? current : CircuitState.initial(key);
            Instant now = clock.instant();

            CircuitState updated;
            switch (base.status()) {
                case CLOSED -> {
                    boolean streakExpired = base.firstFailureAt() == null
                        || Duration.between(base.firstFailureAt(), now).compareTo(config.rollingWindow()) > 0;
                    int failures = streakExpired ? 1 : base.consecutiveFailures() + 1;
                    Instant streakStart = streakExpired ? now : base.firstFailureAt();
                    updated = base.withFailureStreak(failures, streakStart, now);
                    if (failures >= config.failureThreshold()) {
                        updated = updated.withStatus(CircuitBreakerState.OPEN, now, false);
                    }
                }
                case HALF_OPEN -> updated = base
                    .withFailureStreak(base.consecutiveFailures() + 1, streakStartOrNow(base, now), now)
                    .withStatus(CircuitBreakerState.OPEN, now, false);
                default -> updated = base
                    .withFailureStreak(base.consecutiveFailures() + 1, streakStartOrNow(base, now), now);
            }

            if (store.compareAndSet(key, current, updated)) {
                if (base.status() != CircuitBreakerState.OPEN && updated.status() == CircuitBreakerState.OPEN) {
                    log.warn("Circuit {} transitioned {} -> OPEN after {} consecutive failures (last: {}), retry at {}",
                        key, base.status(), updated.consecutiveFailures(), kind, cooldownEnd(updated));
                }
                return;
            }
        }
    }

    @Override
    public void releasePermit(OperationKey key) {
        requireKey(key);
        while (true) {
            CircuitState current = store.find(key).orElse(null);
            if (current == null || current.status() != CircuitBreakerState.HALF_OPEN || !current.probeInFlight()) {
                return;
            }
            CircuitState updated = current.withStatus(CircuitBreakerState.HALF_OPEN, current.openedAt(), false);
            if (store.compareAndSet(key, current, updated)) {
                log.debug("Circuit {} probe released without verdict", key);
                return;
            }
        }
    }

    @Override
    public CircuitBreakerState getState(OperationKey key) {
        requireKey(key);
        return store.find(key).map(CircuitState::status).orElse(CircuitBreakerState.CLOSED);
    }

    @Override
    public Optional<Instant> nextAttemptAt(OperationKey key) {
        requireKey(key);
        return store.find(key)
            .filter(state -> state.status() == CircuitBreakerState.OPEN)
            .map(this::cooldownEnd);
    }

    @Override
    public CircuitState stats(OperationKey key) {
        requireKey(key);
        return store.find(key).orElse(CircuitState.initial(key));
    }

    @Override
    public List<CircuitState> statsFor(ProviderId provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        return store.findAll().stream()
            .filter(state -> state.key().provider().equals(provider))
            .sorted(Comparator.comparing(state -> state.key().operation()))
            .collect(Collectors.toList());
    }

    @Override
    public CircuitHealth systemHealth() {
        int open = 0;
        int halfOpen = 0;
        int closed = 0;
        for (CircuitState state : store.findAll()) {
            switch (state.status()) {
                case OPEN -> open++;
                case HALF_OPEN -> halfOpen++;
                case CLOSED -> closed++;
            }
        }
        return CircuitHealth.of(open, halfOpen, closed);
    }

    @Override
    public void reset(OperationKey key) {
        requireKey(key);
        store.remove(key);
        log.info("Circuit {} manually reset to CLOSED", key);
    }

    private Instant cooldownEnd(CircuitState state) {
        return state.openedAt().plus(policies.forProvider(state.key().provider()).openCooldown());
    }

    private static Instant streakStartOrNow(CircuitState state, Instant now) {
        return state.firstFailureAt() != null ? state.firstFailureAt() : now;
    }

    private static void requireKey(OperationKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
