package com.ryuqq.connector.application.sync;

import com.ryuqq.connector.core.sync.ResourceSync;
import com.ryuqq.connector.core.sync.ResourceSyncResult;
import com.ryuqq.connector.core.sync.SyncWindow;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 조회 → 필터 → 처리 형태의 리소스 동기화 구현.
 *
 * <p>이미 반영된 항목(updatedAt ≤ watermark)은 처리하지 않고 skipped로 집계하며,
 * 항목 처리 실패는 해당 항목만 오류로 남기고 나머지를 계속 처리합니다.</p>
 *
 * <pre>
 * ResourceSync issues = new IncrementalResourceSync&lt;&gt;(
 *     since -&gt; client.listIssues(since),
 *     Issue::updatedAt,
 *     Issue::id,
 *     cache::put);
 * </pre>
 *
 * @param <T> 항목 타입
 * @author Connector Team
 * @since 1.0.0
 */
public class IncrementalResourceSync<T> implements ResourceSync {

    /**
     * since 이후 변경된 항목 조회.
     */
    @FunctionalInterface
    public interface Fetcher<T> {
        List<T> fetch(Instant since) throws IOException;
    }

    /**
     * 항목 1건 처리.
     */
    @FunctionalInterface
    public interface ItemProcessor<T> {
        void process(T item);
    }

    private final Fetcher<T> fetcher;
    private final Function<T, Instant> updatedAt;
    private final Function<T, String> describer;
    private final ItemProcessor<T> processor;

    public IncrementalResourceSync(Fetcher<T> fetcher, Function<T, Instant> updatedAt,
                                   Function<T, String> describer, ItemProcessor<T> processor) {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        if (describer == null) {
            throw new IllegalArgumentException("describer cannot be null");
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor cannot be null");
        }
        this.fetcher = fetcher;
        this.updatedAt = updatedAt;
        this.describer = describer;
        this.processor = processor;
    }

    @Override
    public ResourceSyncResult sync(SyncWindow window) throws IOException {
        List<T> items = fetcher.fetch(window.since());
        int processed = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();

        for (T item : items) {
            if (window.isAlreadySynced(updatedAt.apply(item))) {
                skipped++;
                continue;
            }
            try {
                processor.process(item);
                processed++;
            } catch (RuntimeException e) {
                errors.add(describer.apply(item) + ": " + e.getMessage());
            }
        }
        return new ResourceSyncResult(processed, skipped, errors);
    }
}
