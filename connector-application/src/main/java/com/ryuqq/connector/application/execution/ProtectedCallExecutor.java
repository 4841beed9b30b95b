package com.ryuqq.connector.application.execution;

import com.ryuqq.connector.application.auth.TokenRefreshCoordinator;
import com.ryuqq.connector.application.metrics.GuardedMetricsSink;
import com.ryuqq.connector.core.contract.TokenRefresher;
import com.ryuqq.connector.core.contract.VendorCall;
import com.ryuqq.connector.core.exception.AuthenticationException;
import com.ryuqq.connector.core.exception.CircuitOpenException;
import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.exception.RateLimitedException;
import com.ryuqq.connector.core.exception.VendorCallException;
import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.outcome.Fail;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.outcome.NeedsRefresh;
import com.ryuqq.connector.core.outcome.Ok;
import com.ryuqq.connector.core.outcome.RateLimited;
import com.ryuqq.connector.core.outcome.VendorOutcome;
import com.ryuqq.connector.core.protection.CircuitBreaker;
import com.ryuqq.connector.core.protection.ProviderPolicies;
import com.ryuqq.connector.core.protection.RateGovernor;
import com.ryuqq.connector.core.protection.Sleeper;
import com.ryuqq.connector.core.spi.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Vendor 호출 보호 실행기 (executeWithProtection).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(key, context, call)
 *   ↓
 * 1. CircuitBreaker.tryAcquire(key)     → 거부 시 CircuitOpenException (네트워크 호출 없음)
 * 2. RateGovernor.acquire(provider)     → cooldown / maxWait 초과 시 RateLimitedException
 * 3. call.call(accessToken) (timeout)   → VendorOutcome
 * 4. Outcome 분기:
 *      Ok           → recordSuccess, 값 반환
 *      NeedsRefresh → TokenRefreshCoordinator.refresh 후 1회만 재시도, 두 번째 401은 AuthenticationException
 *      RateLimited  → breaker 미집계, governor cooldown 진입, RateLimitedException
 *      Fail         → breaker 집계 (일시적 실패만), 재시도 예산 내에서 백오프 후 1로 복귀
 * </pre>
 *
 * <p>재시도마다 breaker 게이트를 다시 통과하므로, 재시도 도중 breaker가 열리면
 * {@link CircuitOpenException}으로 끝납니다.</p>
 *
 * <p>타임아웃은 네트워크 오류와 동일하게 취급합니다. 401 이후의 토큰 갱신 호출에도 같은 타임아웃이 적용됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ProtectedCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProtectedCallExecutor.class);

    private final CircuitBreaker circuitBreaker;
    private final RateGovernor rateGovernor;
    private final TokenRefreshCoordinator tokenRefreshCoordinator;
    private final MetricsSink metrics;
    private final ProviderPolicies<CallPolicy> policies;
    private final ExecutorService callExecutor;
    private final Sleeper sleeper;

    /**
     * 기본 정책과 내부 스레드 풀로 생성.
     *
     * @param circuitBreaker Circuit Breaker
     * @param rateGovernor Rate Governor
     * @param tokenRefreshCoordinator 토큰 갱신 조정자
     * @param metrics 메트릭 싱크
     */
    public ProtectedCallExecutor(CircuitBreaker circuitBreaker, RateGovernor rateGovernor,
                                 TokenRefreshCoordinator tokenRefreshCoordinator, MetricsSink metrics) {
        this(circuitBreaker, rateGovernor, tokenRefreshCoordinator, metrics,
            ProviderPolicies.withDefault(new CallPolicy()), newCallExecutor(), Sleeper.system());
    }

    /**
     * 전체 설정으로 생성.
     *
     * @param circuitBreaker Circuit Breaker
     * @param rateGovernor Rate Governor
     * @param tokenRefreshCoordinator 토큰 갱신 조정자
     * @param metrics 메트릭 싱크 (장애 격리 래퍼로 감쌈)
     * @param policies Provider별 호출 정책
     * @param callExecutor Vendor 호출 실행 스레드 풀 (타임아웃 적용용)
     * @param sleeper 재시도 백오프 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ProtectedCallExecutor(CircuitBreaker circuitBreaker, RateGovernor rateGovernor,
                                 TokenRefreshCoordinator tokenRefreshCoordinator, MetricsSink metrics,
                                 ProviderPolicies<CallPolicy> policies, ExecutorService callExecutor,
                                 Sleeper sleeper) {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (rateGovernor == null) {
            throw new IllegalArgumentException("rateGovernor cannot be null");
        }
        if (tokenRefreshCoordinator == null) {
            throw new IllegalArgumentException("tokenRefreshCoordinator cannot be null");
        }
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (callExecutor == null) {
            throw new IllegalArgumentException("callExecutor cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.circuitBreaker = circuitBreaker;
        this.rateGovernor = rateGovernor;
        this.tokenRefreshCoordinator = tokenRefreshCoordinator;
        this.metrics = GuardedMetricsSink.wrap(metrics);
        this.policies = policies;
        this.callExecutor = callExecutor;
        this.sleeper = sleeper;
    }

    /**
     * 토큰 갱신 없이 보호된 호출 실행 (401은 즉시 AuthenticationException).
     *
     * @param key (Provider, Operation) 키
     * @param userId 사용자 ID
     * @param call Vendor 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    public <T> T execute(OperationKey key, UserId userId, VendorCall<T> call) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return execute(key, new CallContext(userId, key.provider().getValue(), null), call);
    }

    /**
     * 보호된 호출 실행.
     *
     * @param key (Provider, Operation) 키
     * @param context 호출자 정보
     * @param call Vendor 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws CircuitOpenException breaker가 호출을 거부한 경우
     * @throws RateLimitedException Provider가 rate limit 상태인 경우
     * @throws AuthenticationException 갱신 후에도 401이거나 갱신이 불가능한 경우
     * @throws VendorCallException 재시도 예산을 소진했거나 재시도 불가능한 실패인 경우
     */
    public <T> T execute(OperationKey key, CallContext context, VendorCall<T> call) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        ProviderId provider = key.provider();
        CallPolicy policy = policies.forProvider(provider);
        String accessToken = tokenRefreshCoordinator.currentAccessToken(context.userId(), provider);
        boolean refreshed = false;
        int transientRetries = 0;

        while (true) {
            if (!circuitBreaker.tryAcquire(key)) {
                throw new CircuitOpenException(key, circuitBreaker.nextAttemptAt(key).orElse(null));
            }
            try {
                rateGovernor.acquire(provider);
            } catch (RuntimeException e) {
                circuitBreaker.releasePermit(key);
                throw e;
            }

            long startNanos = System.nanoTime();
            VendorOutcome<T> outcome = invoke(key, call, accessToken);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            metrics.trackApiCall(context.userId(), context.integrationId(), provider, key.operation(),
                durationMs, outcome.isOk());

            if (outcome instanceof Ok) {
                circuitBreaker.recordSuccess(key);
                rateGovernor.onSuccess(provider);
                return ((Ok<T>) outcome).value();
            }

            if (outcome instanceof NeedsRefresh) {
                circuitBreaker.recordFailure(key, FailureKind.AUTHENTICATION);
                if (refreshed || !context.canRefresh()) {
                    log.warn("Call {} rejected as unauthorized{}", key, refreshed ? " after token refresh" : "");
                    throw new AuthenticationException(provider,
                        "Authentication failed for " + key + (refreshed ? " after token refresh" : ""));
                }
                accessToken = tokenRefreshCoordinator.refresh(context.userId(), provider, accessToken,
                    withTimeout(provider, context.refresher()));
                refreshed = true;
                continue;
            }

            if (outcome instanceof RateLimited) {
                circuitBreaker.releasePermit(key);
                Duration retryAfter = ((RateLimited<T>) outcome).retryAfter();
                metrics.trackRateLimit(provider, key.operation());
                throw new RateLimitedException(provider, rateGovernor.onRateLimited(provider, retryAfter));
            }

            Fail<T> fail = (Fail<T>) outcome;
            circuitBreaker.recordFailure(key, fail.kind());
            if (fail.kind().isTransient() && transientRetries < policy.maxTransientRetries()) {
                transientRetries++;
                Duration delay = policy.backoff().calculate(transientRetries);
                log.debug("Call {} failed transiently ({}), retry {}/{} in {}ms",
                    key, fail.kind(), transientRetries, policy.maxTransientRetries(), delay.toMillis());
                pause(provider, delay);
                continue;
            }
            log.warn("Call {} failed: {} (status {}) after {} retries", key, fail.kind(), fail.status(), transientRetries);
            throw new VendorCallException(provider, fail.kind(), fail.status(),
                "Call " + key + " failed: " + fail.message());
        }
    }

    /**
     * 내부 스레드 풀 종료.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        callExecutor.shutdown();
        if (!callExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
            callExecutor.shutdownNow();
        }
    }

    /**
     * 보호 체인 없이 타임아웃만 적용하여 vendor 호출 실행 (토큰 발급/갱신용).
     *
     * <p>타임아웃은 {@code Fail.timeout}, {@link IOException}은 {@code Fail.network}로 분류합니다.</p>
     *
     * @param provider Provider (타임아웃 정책 조회용)
     * @param description 로그와 실패 메시지에 쓰일 호출 설명
     * @param call Vendor 호출
     * @param <T> 결과 타입
     * @return 분류된 결과
     * @throws IntegrationException 대기 중 인터럽트 또는 예상하지 못한 checked 예외
     */
    public <T> VendorOutcome<T> callWithTimeout(ProviderId provider, String description,
                                                Callable<VendorOutcome<T>> call) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        Duration timeout = policies.forProvider(provider).timeout();
        Future<VendorOutcome<T>> future = callExecutor.submit(call);
        try {
            VendorOutcome<T> outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                throw new IllegalStateException(description + " returned null outcome for " + provider);
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} for {} timed out after {}ms", description, provider, timeout.toMillis());
            return Fail.timeout(description + " timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                return Fail.network(description + " network error: " + cause.getClass().getSimpleName());
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IntegrationException(provider, description + " failed unexpectedly", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IntegrationException(provider, "Interrupted during " + description, e);
        }
    }

    /**
     * 갱신 호출에 Provider 타임아웃을 적용한 refresher 반환.
     *
     * @param provider Provider
     * @param refresher 원래 갱신 호출
     * @return 타임아웃이 적용된 refresher
     */
    public TokenRefresher withTimeout(ProviderId provider, TokenRefresher refresher) {
        if (refresher == null) {
            throw new IllegalArgumentException("refresher cannot be null");
        }
        return refreshToken -> callWithTimeout(provider, "Token refresh", () -> refresher.refresh(refreshToken));
    }

    private <T> VendorOutcome<T> invoke(OperationKey key, VendorCall<T> call, String accessToken) {
        try {
            return callWithTimeout(key.provider(), "Call " + key, () -> call.call(accessToken));
        } catch (RuntimeException | Error e) {
            circuitBreaker.releasePermit(key);
            throw e;
        }
    }

    private void pause(ProviderId provider, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntegrationException(provider, "Interrupted during retry backoff", e);
        }
    }

    private static ExecutorService newCallExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "connector-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
