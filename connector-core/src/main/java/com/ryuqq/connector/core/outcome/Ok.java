package com.ryuqq.connector.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 디코딩된 응답 값 (null 가능, 바디 없는 응답)
 * @param <T> 값 타입
 * @author Connector Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements VendorOutcome<T> {

    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }
}
