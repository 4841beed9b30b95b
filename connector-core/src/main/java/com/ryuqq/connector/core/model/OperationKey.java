package com.ryuqq.connector.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Circuit Breaker 상태를 구분하는 (Provider, Operation) 복합 키.
 *
 * <p>동일한 OperationKey를 사용하는 모든 동시 호출은 하나의 CircuitState를 공유합니다.
 * 어댑터가 별도의 사본을 보유해서는 안 됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * OperationKey.of(ProviderId.of("github"), "issues.list")   → github:issues.list
 * OperationKey.of(ProviderId.of("slack"), "token.refresh")  → slack:token.refresh
 * </pre>
 *
 * <p><strong>Operation 유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class OperationKey {

    private static final Pattern VALID_OPERATION = Pattern.compile("^[a-zA-Z0-9._\\-]+$");

    private final ProviderId provider;
    private final String operation;

    private OperationKey(ProviderId provider, String operation) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (operation.length() > 128) {
            throw new IllegalArgumentException("operation length cannot exceed 128 characters");
        }
        if (!VALID_OPERATION.matcher(operation).matches()) {
            throw new IllegalArgumentException(
                "operation contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed");
        }
        this.provider = provider;
        this.operation = operation;
    }

    /**
     * OperationKey 생성.
     *
     * @param provider Provider ID
     * @param operation Operation 이름 (예: issues.list)
     * @return OperationKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationKey of(ProviderId provider, String operation) {
        return new OperationKey(provider, operation);
    }

    public ProviderId provider() {
        return provider;
    }

    public String operation() {
        return operation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationKey that = (OperationKey) o;
        return provider.equals(that.provider) && operation.equals(that.operation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, operation);
    }

    @Override
    public String toString() {
        return provider.getValue() + ":" + operation;
    }
}
