package com.ryuqq.connector.core.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 커서 기반 페이지네이션을 끝까지 따라가며 항목을 모읍니다.
 *
 * <p>Provider 버그로 커서가 끝나지 않는 경우를 막기 위해 최대 페이지 수(기본 100)에서 멈춥니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class PageCollector {

    private static final Logger log = LoggerFactory.getLogger(PageCollector.class);

    public static final int DEFAULT_MAX_PAGES = 100;

    /**
     * 페이지 조회 함수.
     *
     * @param <T> 항목 타입
     */
    @FunctionalInterface
    public interface PageFetcher<T> {

        /**
         * @param cursor 페이지 커서 (첫 페이지면 null)
         */
        Page<T> fetch(String cursor) throws IOException;
    }

    private final int maxPages;

    public PageCollector() {
        this(DEFAULT_MAX_PAGES);
    }

    public PageCollector(int maxPages) {
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive (current: " + maxPages + ")");
        }
        this.maxPages = maxPages;
    }

    public <T> List<T> collect(PageFetcher<T> fetcher) throws IOException {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        List<T> items = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < maxPages; page++) {
            Page<T> current = fetcher.fetch(cursor);
            items.addAll(current.items());
            if (!current.hasNext()) {
                return items;
            }
            cursor = current.nextCursor();
        }
        log.warn("Pagination stopped at page limit {} with {} items collected", maxPages, items.size());
        return items;
    }

    public int getMaxPages() {
        return maxPages;
    }
}
