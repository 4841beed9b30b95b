package com.ryuqq.connector.core.outcome;

/**
 * Access Token 만료/무효 (401 Unauthorized).
 *
 * <p>Refresh Token이 있으면 TokenRefreshCoordinator를 통해 갱신 후 정확히 1회 재시도합니다.
 * 갱신 후 다시 NeedsRefresh가 오면 인증 실패로 확정합니다.</p>
 *
 * @param reason 사유
 * @param <T> 값 타입
 * @author Connector Team
 * @since 1.0.0
 */
public record NeedsRefresh<T>(String reason) implements VendorOutcome<T> {

    public NeedsRefresh {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static <T> NeedsRefresh<T> of(String reason) {
        return new NeedsRefresh<>(reason);
    }
}
