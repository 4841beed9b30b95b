package com.ryuqq.connector.core.model;

import com.ryuqq.connector.core.exception.SyncException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 동기화 1회 실행 결과.
 *
 * <p><strong>카운트 의미:</strong></p>
 * <ul>
 *   <li>itemsProcessed: 이번 실행에서 실제로 반영한 항목 수</li>
 *   <li>itemsSkipped: 유효하지만 이미 최신인 항목 수 (cursor 기준 필터링)</li>
 *   <li>errors: 처리에 실패한 항목/리소스 타입의 메시지</li>
 * </ul>
 *
 * <p>success는 errors가 비어 있을 때만 true입니다. 부분 성공은 {@code success=false}이지만
 * 처리된 카운트를 그대로 보존하며, 호출자는 이를 버려서는 안 됩니다.</p>
 *
 * @param success errors가 비어 있는지 여부
 * @param itemsProcessed 처리 항목 수 (0 이상)
 * @param itemsSkipped 건너뛴 항목 수 (0 이상)
 * @param errors 오류 메시지 목록
 * @param metadata 부가 정보 (리소스 타입별 내역, 소요 시간 등)
 * @author Connector Team
 * @since 1.0.0
 */
public record SyncResult(
    boolean success,
    int itemsProcessed,
    int itemsSkipped,
    List<String> errors,
    Map<String, Object> metadata
) {

    public SyncResult {
        if (itemsProcessed < 0) {
            throw new IllegalArgumentException("itemsProcessed cannot be negative (current: " + itemsProcessed + ")");
        }
        if (itemsSkipped < 0) {
            throw new IllegalArgumentException("itemsSkipped cannot be negative (current: " + itemsSkipped + ")");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (success && !errors.isEmpty()) {
            throw new IllegalArgumentException("success cannot be true while errors are present");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * errors 유무로 success를 결정하여 생성.
     *
     * @param itemsProcessed 처리 항목 수
     * @param itemsSkipped 건너뛴 항목 수
     * @param errors 오류 메시지
     * @param metadata 부가 정보
     * @return SyncResult 인스턴스
     */
    public static SyncResult of(int itemsProcessed, int itemsSkipped, List<String> errors, Map<String, Object> metadata) {
        boolean success = errors == null || errors.isEmpty();
        return new SyncResult(success, itemsProcessed, itemsSkipped, errors, metadata);
    }

    public static SyncResult empty() {
        return new SyncResult(true, 0, 0, List.of(), Map.of());
    }

    /**
     * 실패가 있으면 부분 결과를 담은 {@link SyncException}을 던집니다.
     *
     * @return 성공한 경우 자기 자신
     * @throws SyncException success가 false인 경우
     */
    public SyncResult orThrow() {
        if (!success) {
            throw new SyncException(this);
        }
        return this;
    }
}
