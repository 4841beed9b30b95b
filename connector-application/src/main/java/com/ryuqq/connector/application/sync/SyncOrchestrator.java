package com.ryuqq.connector.application.sync;

import com.ryuqq.connector.application.metrics.GuardedMetricsSink;
import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.model.SyncResult;
import com.ryuqq.connector.core.protection.ProviderPolicies;
import com.ryuqq.connector.core.spi.MetricsSink;
import com.ryuqq.connector.core.spi.SyncCursorStore;
import com.ryuqq.connector.core.sync.ResourceSyncResult;
import com.ryuqq.connector.core.sync.ResourceSyncTask;
import com.ryuqq.connector.core.sync.SyncWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 리소스 타입별 증분 동기화 오케스트레이터.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * sync(request)
 *   ↓
 * 1. 리소스 타입별 cursor 조회 → SyncWindow(since = override 또는 cursor, reflectedThrough = cursor)
 * 2. fan-out: 타입별 작업을 스레드 풀에 제출 (Provider별 Semaphore로 동시 실행 수 제한)
 * 3. fan-in: 기한 내에 타입별 결과 수집
 *      완료        → processed / skipped 합산, 항목 오류는 "type: ..." 로 수집
 *      예외        → "type sync failed: ..." 오류 1건
 *      기한 초과   → 작업 취소, "type sync timed out after Xms" 오류 1건
 * 4. 항목 오류 없이 완료된 타입만 cursor를 동기화 시작 시각으로 전진 (단조 증가)
 * 5. SyncResult 집계 + 메트릭 기록
 * </pre>
 *
 * <p>한 리소스 타입의 실패는 다른 타입을 중단시키지 않으며, 부분 성공도
 * processed 수를 그대로 보고합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    static final String META_STARTED_AT = "startedAt";
    static final String META_DURATION_MS = "durationMs";
    static final String META_RESOURCE_STATUS = "resourceStatus";

    private final SyncCursorStore cursorStore;
    private final MetricsSink metrics;
    private final ProviderPolicies<SyncPolicy> policies;
    private final ExecutorService workerExecutor;
    private final Clock clock;
    private final ConcurrentHashMap<ProviderId, Semaphore> providerLimits = new ConcurrentHashMap<>();

    public SyncOrchestrator(SyncCursorStore cursorStore, MetricsSink metrics) {
        this(cursorStore, metrics, ProviderPolicies.withDefault(new SyncPolicy()), newWorkerExecutor(), Clock.systemUTC());
    }

    /**
     * 전체 설정으로 생성.
     *
     * @param cursorStore cursor 저장소
     * @param metrics 메트릭 싱크 (장애 격리 래퍼로 감쌈)
     * @param policies Provider별 동기화 정책
     * @param workerExecutor 리소스 타입 작업 실행 스레드 풀
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SyncOrchestrator(SyncCursorStore cursorStore, MetricsSink metrics, ProviderPolicies<SyncPolicy> policies,
                            ExecutorService workerExecutor, Clock clock) {
        if (cursorStore == null) {
            throw new IllegalArgumentException("cursorStore cannot be null");
        }
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (workerExecutor == null) {
            throw new IllegalArgumentException("workerExecutor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.cursorStore = cursorStore;
        this.metrics = GuardedMetricsSink.wrap(metrics);
        this.policies = policies;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    /**
     * 동기화 실행.
     *
     * @param request 동기화 요청
     * @return 집계 결과 (부분 실패 시 success=false, 진행분 포함)
     * @throws IntegrationException 결과 대기 중 인터럽트 발생 시
     */
    public SyncResult sync(SyncRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        ProviderId provider = request.provider();
        SyncPolicy policy = policies.forProvider(provider);
        Duration deadline = request.deadline() != null ? request.deadline() : policy.deadline();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + deadline.toNanos();

        log.info("Starting {} sync for {} integration {} ({} resource types)",
            request.fullSync() ? "full" : "incremental", provider, request.integrationId(), request.tasks().size());

        Semaphore limit = providerLimits.computeIfAbsent(provider, p -> new Semaphore(policy.maxConcurrency()));
        Map<ResourceSyncTask, Future<ResourceSyncResult>> futures = new LinkedHashMap<>();
        for (ResourceSyncTask task : request.tasks()) {
            SyncWindow window = windowFor(request, task.resourceType(), startedAt);
            futures.put(task, workerExecutor.submit(() -> runLimited(limit, task, window)));
        }

        int processed = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        Map<String, String> resourceStatus = new LinkedHashMap<>();

        for (Map.Entry<ResourceSyncTask, Future<ResourceSyncResult>> entry : futures.entrySet()) {
            String type = entry.getKey().resourceType();
            Future<ResourceSyncResult> future = entry.getValue();
            try {
                ResourceSyncResult result = future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
                processed += result.processed();
                skipped += result.skipped();
                for (String itemError : result.itemErrors()) {
                    errors.add(type + ": " + itemError);
                }
                if (result.isComplete()) {
                    advanceCursor(request, type, startedAt);
                    resourceStatus.put(type, "completed");
                } else {
                    log.warn("Sync of {} for {} completed with {} item errors, cursor not advanced",
                        type, provider, result.itemErrors().size());
                    resourceStatus.put(type, "partial");
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Sync of {} for {} timed out after {}ms", type, provider, deadline.toMillis());
                errors.add(type + " sync timed out after " + deadline.toMillis() + "ms");
                resourceStatus.put(type, "timed_out");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.warn("Sync of {} for {} failed: {}", type, provider, cause.toString());
                errors.add(type + " sync failed: " + describe(cause));
                resourceStatus.put(type, "failed");
            } catch (InterruptedException e) {
                futures.values().forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new IntegrationException(provider, "Sync interrupted for " + provider, e);
            }
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_STARTED_AT, startedAt.toString());
        metadata.put(META_DURATION_MS, durationMs);
        metadata.put(META_RESOURCE_STATUS, resourceStatus);
        SyncResult result = SyncResult.of(processed, skipped, errors, metadata);

        metrics.trackSyncOperation(request.userId(), request.integrationId(), provider,
            processed, skipped, errors.size(), durationMs);
        log.info("Sync for {} integration {} finished in {}ms: processed={}, skipped={}, errors={}",
            provider, request.integrationId(), durationMs, processed, skipped, errors.size());
        return result;
    }

    /**
     * 내부 스레드 풀 종료.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private SyncWindow windowFor(SyncRequest request, String resourceType, Instant startedAt) {
        if (request.fullSync()) {
            return new SyncWindow(resourceType, null, null, startedAt);
        }
        Instant cursor = cursorStore.find(request.userId(), request.provider(), resourceType)
            .map(SyncCursor::lastSyncTime)
            .orElse(null);
        Instant since = request.lastSyncTimeOverride() != null ? request.lastSyncTimeOverride() : cursor;
        return new SyncWindow(resourceType, since, cursor, startedAt);
    }

    private static ResourceSyncResult runLimited(Semaphore limit, ResourceSyncTask task, SyncWindow window) throws Exception {
        limit.acquire();
        try {
            ResourceSyncResult result = task.sync().sync(window);
            if (result == null) {
                throw new IllegalStateException("resource sync returned no result");
            }
            return result;
        } finally {
            limit.release();
        }
    }

    private void advanceCursor(SyncRequest request, String resourceType, Instant startedAt) {
        cursorStore.save(new SyncCursor(request.provider(), request.userId(), resourceType, startedAt));
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static ExecutorService newWorkerExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "connector-sync-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
