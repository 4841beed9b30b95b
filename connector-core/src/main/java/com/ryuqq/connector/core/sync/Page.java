package com.ryuqq.connector.core.sync;

import java.util.List;

/**
 * 페이지네이션 응답 한 페이지.
 *
 * @param items 항목
 * @param nextCursor 다음 페이지 커서 (마지막 페이지면 null)
 * @param <T> 항목 타입
 * @author Connector Team
 * @since 1.0.0
 */
public record Page<T>(List<T> items, String nextCursor) {

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null);
    }

    public boolean hasNext() {
        return nextCursor != null && !nextCursor.isEmpty();
    }
}
