package com.ryuqq.connector.core.model;

import java.util.regex.Pattern;

/**
 * 외부 SaaS Provider 식별자.
 *
 * <p>Circuit Breaker 키, Rate Governor 버킷, Token Refresh 키 등
 * 프레임워크의 모든 공유 상태는 ProviderId를 기준으로 분리됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ProviderId.of("github")</li>
 *   <li>ProviderId.of("google-calendar")</li>
 *   <li>ProviderId.of("microsoft-365")</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 소문자, 숫자, 하이픈(-)만 허용</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class ProviderId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9\\-]*$");

    private final String value;

    private ProviderId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ProviderId cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("ProviderId length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ProviderId must contain only lowercase letters, digits and hyphens (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * ProviderId 생성.
     *
     * @param value Provider 이름 (예: github, slack)
     * @return ProviderId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ProviderId of(String value) {
        return new ProviderId(value);
    }

    /**
     * ProviderId 값 조회.
     *
     * @return Provider 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderId that = (ProviderId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
