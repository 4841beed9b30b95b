package com.ryuqq.connector.core.outcome;

/**
 * Vendor 호출 결과 (HTTP 경계에서 한 번만 디코딩).
 *
 * <p>VendorOutcome은 네 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 타입이 지정된 값 포함</li>
 *   <li>{@link NeedsRefresh}: 401, 토큰 갱신 후 1회 재시도 대상</li>
 *   <li>{@link RateLimited}: 429, Rate Governor가 처리 (Circuit Breaker 실패로 세지 않음)</li>
 *   <li>{@link Fail}: 그 밖의 실패, {@link FailureKind}로 분류</li>
 * </ul>
 *
 * <p>예외를 제어 흐름으로 쓰지 않고 결과 타입으로 분기하기 위해 sealed interface로 정의합니다.
 * ProtectedCallExecutor와 TokenRefreshCoordinator는 예외 타입 검사 없이
 * 이 타입만으로 분기합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok&lt;T&gt; ok) {
 *     return ok.value();
 * } else if (outcome instanceof RateLimited&lt;T&gt; limited) {
 *     governor.onRateLimited(provider, limited.retryAfter());
 * }
 * </pre>
 *
 * @param <T> 성공 시 값 타입
 * @author Connector Team
 * @since 1.0.0
 */
public sealed interface VendorOutcome<T> permits Ok, NeedsRefresh, RateLimited, Fail {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isNeedsRefresh() {
        return this instanceof NeedsRefresh;
    }

    default boolean isRateLimited() {
        return this instanceof RateLimited;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
