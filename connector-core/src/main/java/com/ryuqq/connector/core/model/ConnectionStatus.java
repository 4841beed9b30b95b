package com.ryuqq.connector.core.model;

import java.time.Instant;

/**
 * 연결 상태 (요청 단위로 매번 재계산, 캐시 금지).
 *
 * <p>연결 해제된 통합은 예외 대신 {@code connected=false}와 error로 보고됩니다.</p>
 *
 * @param connected 연결 여부
 * @param lastChecked 확인 시각
 * @param error 실패 사유 (null 가능)
 * @param rateLimitInfo Rate Limit 현황 (null 가능)
 * @author Connector Team
 * @since 1.0.0
 */
public record ConnectionStatus(
    boolean connected,
    Instant lastChecked,
    String error,
    RateLimitInfo rateLimitInfo
) {

    public ConnectionStatus {
        if (lastChecked == null) {
            throw new IllegalArgumentException("lastChecked cannot be null");
        }
    }

    public static ConnectionStatus connected(Instant lastChecked, RateLimitInfo rateLimitInfo) {
        return new ConnectionStatus(true, lastChecked, null, rateLimitInfo);
    }

    public static ConnectionStatus disconnected(Instant lastChecked, String error) {
        return new ConnectionStatus(false, lastChecked, error, null);
    }

    public static ConnectionStatus disconnected(Instant lastChecked, String error, RateLimitInfo rateLimitInfo) {
        return new ConnectionStatus(false, lastChecked, error, rateLimitInfo);
    }
}
