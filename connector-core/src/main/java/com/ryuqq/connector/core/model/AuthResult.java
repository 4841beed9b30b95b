package com.ryuqq.connector.core.model;

import java.time.Instant;
import java.util.List;

/**
 * authenticate / refreshToken 결과.
 *
 * <p>직접 저장되지 않습니다. 토큰은 항상 TokenVault를 거쳐 IntegrationConfig에 기록됩니다.
 * 예상 가능한 실패(잘못된 자격 증명, 네트워크 오류)는 예외가 아니라
 * {@code success=false}와 error 메시지로 표현합니다.</p>
 *
 * @param success 성공 여부
 * @param accessToken Access Token (실패 시 null)
 * @param refreshToken Refresh Token (null 가능)
 * @param expiresAt 만료 시각 (null 가능)
 * @param scope 부여된 scope
 * @param error 실패 사유 (성공 시 null)
 * @author Connector Team
 * @since 1.0.0
 */
public record AuthResult(
    boolean success,
    String accessToken,
    String refreshToken,
    Instant expiresAt,
    List<String> scope,
    String error
) {

    public AuthResult {
        scope = scope == null ? List.of() : List.copyOf(scope);
        if (success && (accessToken == null || accessToken.isBlank())) {
            throw new IllegalArgumentException("accessToken cannot be null or blank when success");
        }
        if (!success && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error cannot be null or blank when not success");
        }
    }

    public static AuthResult success(String accessToken, String refreshToken, Instant expiresAt, List<String> scope) {
        return new AuthResult(true, accessToken, refreshToken, expiresAt, scope, null);
    }

    public static AuthResult failure(String error) {
        return new AuthResult(false, null, null, null, List.of(), error);
    }

    @Override
    public String toString() {
        return "AuthResult{success=" + success
            + ", expiresAt=" + expiresAt
            + ", scope=" + scope
            + ", error=" + error + '}';
    }
}
