package com.ryuqq.connector.core.outcome;

/**
 * 실패 결과.
 *
 * <p>{@link FailureKind}에 따라 Circuit Breaker 집계 여부와 로컬 재시도 여부가 결정됩니다.</p>
 *
 * @param kind 실패 분류
 * @param status HTTP 상태 코드 (네트워크/타임아웃 실패는 0)
 * @param message 오류 메시지
 * @param <T> 값 타입
 * @author Connector Team
 * @since 1.0.0
 */
public record Fail<T>(FailureKind kind, int status, String message) implements VendorOutcome<T> {

    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (status < 0) {
            throw new IllegalArgumentException("status cannot be negative (current: " + status + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static <T> Fail<T> of(FailureKind kind, int status, String message) {
        return new Fail<>(kind, status, message);
    }

    public static <T> Fail<T> network(String message) {
        return new Fail<>(FailureKind.NETWORK, 0, message);
    }

    public static <T> Fail<T> timeout(String message) {
        return new Fail<>(FailureKind.TIMEOUT, 0, message);
    }
}
