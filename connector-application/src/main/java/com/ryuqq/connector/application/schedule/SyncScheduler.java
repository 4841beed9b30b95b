package com.ryuqq.connector.application.schedule;

import com.ryuqq.connector.application.adapter.IntegrationRegistry;
import com.ryuqq.connector.core.contract.IntegrationAdapter;
import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncResult;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.IntegrationConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 등록된 통합의 주기적 동기화 스케줄러.
 *
 * <p><strong>스케줄:</strong></p>
 * <pre>
 * start()
 *   ├─ 증분 동기화: incrementalInterval마다 runIncrementalSync()
 *   └─ 전체 동기화: 매일 fullSyncAt (UTC)에 runFullSync()
 * triggerSync(user, provider) → 즉시 증분 동기화 (수동)
 * </pre>
 *
 * <p><strong>Sweep 대상:</strong></p>
 * <ul>
 *   <li>레지스트리에 등록되어 있고 저장된 설정이 connected인 통합</li>
 *   <li>pause되지 않은 통합</li>
 *   <li>마지막 동기화가 오래된 순 (한 번도 동기화하지 않은 통합이 먼저), 최대 batchSize개</li>
 * </ul>
 *
 * <p>같은 통합의 동기화는 동시에 하나만 실행됩니다. 이미 진행 중이면 sweep은 건너뛰고,
 * 수동 실행은 {@link IntegrationException}으로 실패합니다.</p>
 *
 * <p>개별 통합의 예외는 기록 후 다음 통합으로 진행합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final IntegrationRegistry registry;
    private final IntegrationConfigStore configStore;
    private final SyncScheduleConfig config;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final Set<String> paused = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean();

    public SyncScheduler(IntegrationRegistry registry, IntegrationConfigStore configStore) {
        this(registry, configStore, new SyncScheduleConfig(), newScheduler(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param registry 통합 레지스트리
     * @param configStore 통합 설정 저장소 (연결 상태 확인용)
     * @param config 스케줄 설정
     * @param scheduler 주기 실행과 수동 실행에 쓰는 스레드 풀
     * @param clock 전체 동기화 시각 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SyncScheduler(IntegrationRegistry registry, IntegrationConfigStore configStore, SyncScheduleConfig config,
                         ScheduledExecutorService scheduler, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (configStore == null) {
            throw new IllegalArgumentException("configStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.configStore = configStore;
        this.config = config;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * 주기 실행 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("SyncScheduler already started");
        }
        long incrementalMs = config.incrementalInterval().toMillis();
        scheduler.scheduleWithFixedDelay(() -> runSafely(false), incrementalMs, incrementalMs, TimeUnit.MILLISECONDS);

        Duration untilFullSync = delayUntilFullSync();
        scheduler.scheduleAtFixedRate(() -> runSafely(true), untilFullSync.toMillis(),
            Duration.ofDays(1).toMillis(), TimeUnit.MILLISECONDS);

        log.info("SyncScheduler started: incremental every {}ms, full sync daily at {} UTC (first in {}ms)",
            incrementalMs, config.fullSyncAt(), untilFullSync.toMillis());
    }

    /**
     * 대상 통합 전체에 증분 동기화 실행.
     *
     * @return sweep 결과
     */
    public SyncSweep runIncrementalSync() {
        return sweep(false);
    }

    /**
     * 대상 통합 전체에 전체 동기화 실행 (cursor 무시).
     *
     * @return sweep 결과
     */
    public SyncSweep runFullSync() {
        return sweep(true);
    }

    /**
     * 수동 증분 동기화. pause 여부와 관계없이 실행합니다.
     *
     * @param userId 사용자 ID
     * @param provider Provider
     * @return 동기화 결과 future (이미 진행 중이면 {@link IntegrationException}으로 완료)
     * @throws IntegrationException 등록된 통합이 없는 경우
     */
    public CompletableFuture<SyncResult> triggerSync(UserId userId, ProviderId provider) {
        IntegrationAdapter adapter = registry.require(userId, provider);
        log.info("Manual sync requested for {} integration {}", provider, adapter.getIntegrationId());
        return CompletableFuture.supplyAsync(() -> syncExclusively(adapter, false)
            .orElseThrow(() -> new IntegrationException(provider,
                "Sync already in progress for " + provider + " integration " + adapter.getIntegrationId())),
            scheduler);
    }

    /**
     * 주기 sweep에서 통합을 제외.
     *
     * @param userId 사용자 ID
     * @param provider Provider
     * @throws IntegrationException 등록된 통합이 없는 경우
     */
    public void pause(UserId userId, ProviderId provider) {
        IntegrationAdapter adapter = registry.require(userId, provider);
        if (paused.add(adapter.getIntegrationId())) {
            log.info("Scheduled sync paused for {} integration {}", provider, adapter.getIntegrationId());
        }
    }

    /**
     * pause 해제.
     *
     * @param userId 사용자 ID
     * @param provider Provider
     * @return pause 상태였으면 true
     */
    public boolean resume(UserId userId, ProviderId provider) {
        Optional<IntegrationAdapter> adapter = registry.find(userId, provider);
        if (adapter.isEmpty() || !paused.remove(adapter.get().getIntegrationId())) {
            return false;
        }
        log.info("Scheduled sync resumed for {} integration {}", provider, adapter.get().getIntegrationId());
        return true;
    }

    public boolean isPaused(UserId userId, ProviderId provider) {
        return registry.find(userId, provider)
            .map(adapter -> paused.contains(adapter.getIntegrationId()))
            .orElse(false);
    }

    /**
     * 스레드 풀 종료.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
    }

    /**
     * 다음 전체 동기화까지 남은 시간.
     */
    Duration delayUntilFullSync() {
        Instant now = clock.instant();
        Instant next = LocalDate.ofInstant(now, ZoneOffset.UTC).atTime(config.fullSyncAt()).toInstant(ZoneOffset.UTC);
        if (!next.isAfter(now)) {
            next = next.plus(Duration.ofDays(1));
        }
        return Duration.between(now, next);
    }

    private SyncSweep sweep(boolean fullSync) {
        String kind = fullSync ? "full" : "incremental";
        List<IntegrationAdapter> targets = eligible();
        log.info("Scheduled {} sync started for {} integrations", kind, targets.size());

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (IntegrationAdapter adapter : targets) {
            try {
                Optional<SyncResult> result = syncExclusively(adapter, fullSync);
                if (result.isEmpty()) {
                    skipped++;
                    log.debug("Skipping {} integration {}, sync already in progress",
                        adapter.getProvider(), adapter.getIntegrationId());
                } else if (result.get().success()) {
                    succeeded++;
                } else {
                    failed++;
                    log.warn("Scheduled {} sync for {} integration {} finished with {} errors",
                        kind, adapter.getProvider(), adapter.getIntegrationId(), result.get().errors().size());
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Scheduled {} sync failed for {} integration {}",
                    kind, adapter.getProvider(), adapter.getIntegrationId(), e);
            }
        }

        log.info("Scheduled {} sync completed: {} succeeded, {} failed, {} skipped out of {}",
            kind, succeeded, failed, skipped, targets.size());
        return new SyncSweep(fullSync, targets.size(), succeeded, failed, skipped);
    }

    private List<IntegrationAdapter> eligible() {
        List<IntegrationAdapter> targets = new ArrayList<>();
        for (IntegrationAdapter adapter : registry.all()) {
            if (paused.contains(adapter.getIntegrationId())) {
                continue;
            }
            boolean connected = configStore.find(adapter.getUserId(), adapter.getProvider())
                .map(IntegrationConfig::connected)
                .orElse(false);
            if (connected) {
                targets.add(adapter);
            }
        }
        targets.sort(Comparator.comparing(
            (IntegrationAdapter adapter) -> adapter.getLastSyncTime().orElse(Instant.MIN)));
        return targets.size() > config.batchSize() ? targets.subList(0, config.batchSize()) : targets;
    }

    private Optional<SyncResult> syncExclusively(IntegrationAdapter adapter, boolean fullSync) {
        String integrationId = adapter.getIntegrationId();
        if (!running.add(integrationId)) {
            return Optional.empty();
        }
        try {
            return Optional.of(fullSync ? adapter.fullSync() : adapter.syncData(null));
        } finally {
            running.remove(integrationId);
        }
    }

    private void runSafely(boolean fullSync) {
        try {
            sweep(fullSync);
        } catch (RuntimeException e) {
            // 예외가 전파되면 이후 주기 실행이 중단됨
            log.error("Scheduled {} sync sweep aborted", fullSync ? "full" : "incremental", e);
        }
    }

    private static ScheduledExecutorService newScheduler() {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "connector-sync-scheduler-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newScheduledThreadPool(2, factory);
    }
}
