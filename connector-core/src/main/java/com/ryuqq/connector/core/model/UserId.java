package com.ryuqq.connector.core.model;

/**
 * 통합(Integration)을 소유한 사용자 식별자.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class UserId {

    private final String value;

    private UserId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("UserId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("UserId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * UserId 생성.
     *
     * @param value 사용자 ID
     * @return UserId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static UserId of(String value) {
        return new UserId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserId userId = (UserId) o;
        return value.equals(userId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "UserId{" + value + '}';
    }
}
