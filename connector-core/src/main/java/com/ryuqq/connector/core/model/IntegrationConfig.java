package com.ryuqq.connector.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 사용자별 통합 설정.
 *
 * <p>authenticate/refresh/revoke 시 갱신되며, 연결 해제(disconnect) 시 삭제됩니다.
 * Access Token과 Refresh Token은 항상 {@code TokenVault}로 암호화된 상태로만 보관합니다.</p>
 *
 * <p>{@link #toString()}은 clientSecret과 토큰을 출력하지 않습니다.</p>
 *
 * @param userId 소유 사용자
 * @param provider Provider ID
 * @param clientId OAuth Client ID (null 가능)
 * @param clientSecret OAuth Client Secret (null 가능)
 * @param apiBaseUrl API Base URL (null 가능)
 * @param scopes 부여된 scope 목록
 * @param encryptedAccessToken 암호화된 Access Token (null 가능)
 * @param encryptedRefreshToken 암호화된 Refresh Token (null 가능)
 * @param tokenExpiry Access Token 만료 시각 (null 가능)
 * @param connected 연결 상태 (Refresh Token 무효 시 false)
 * @author Connector Team
 * @since 1.0.0
 */
public record IntegrationConfig(
    UserId userId,
    ProviderId provider,
    String clientId,
    String clientSecret,
    String apiBaseUrl,
    List<String> scopes,
    String encryptedAccessToken,
    String encryptedRefreshToken,
    Instant tokenExpiry,
    boolean connected
) {

    public IntegrationConfig {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    /**
     * 토큰 없이 연결된 상태의 설정 생성.
     *
     * @param userId 사용자
     * @param provider Provider
     * @return IntegrationConfig 인스턴스
     */
    public static IntegrationConfig of(UserId userId, ProviderId provider) {
        return new IntegrationConfig(userId, provider, null, null, null, List.of(), null, null, null, true);
    }

    /**
     * 새 토큰으로 갱신한 인스턴스 생성.
     *
     * <p>encryptedRefreshToken이 null이면 기존 Refresh Token을 유지합니다
     * (Provider가 Refresh Token을 회전시키지 않는 경우).</p>
     *
     * @param encryptedAccessToken 암호화된 새 Access Token
     * @param encryptedRefreshToken 암호화된 새 Refresh Token (null이면 유지)
     * @param tokenExpiry 만료 시각 (null 가능)
     * @return 갱신된 IntegrationConfig
     */
    public IntegrationConfig withTokens(String encryptedAccessToken, String encryptedRefreshToken, Instant tokenExpiry) {
        return new IntegrationConfig(
            userId, provider, clientId, clientSecret, apiBaseUrl, scopes,
            encryptedAccessToken,
            encryptedRefreshToken != null ? encryptedRefreshToken : this.encryptedRefreshToken,
            tokenExpiry,
            true
        );
    }

    /**
     * scopes만 변경한 새 인스턴스 생성.
     */
    public IntegrationConfig withScopes(List<String> scopes) {
        return new IntegrationConfig(
            userId, provider, clientId, clientSecret, apiBaseUrl, scopes,
            encryptedAccessToken, encryptedRefreshToken, tokenExpiry, connected);
    }

    /**
     * 클라이언트 자격 증명과 API Base URL을 변경한 새 인스턴스 생성.
     */
    public IntegrationConfig withClient(String clientId, String clientSecret, String apiBaseUrl) {
        return new IntegrationConfig(
            userId, provider, clientId, clientSecret, apiBaseUrl, scopes,
            encryptedAccessToken, encryptedRefreshToken, tokenExpiry, connected);
    }

    /**
     * 연결 해제 상태로 전환한 인스턴스 생성.
     *
     * <p>토큰을 모두 폐기합니다. 재연결에는 사용자 동작(재인증)이 필요합니다.</p>
     *
     * @return 연결 해제된 IntegrationConfig
     */
    public IntegrationConfig disconnected() {
        return new IntegrationConfig(
            userId, provider, clientId, clientSecret, apiBaseUrl, scopes,
            null, null, null, false);
    }

    public boolean hasRefreshToken() {
        return encryptedRefreshToken != null;
    }

    @Override
    public String toString() {
        return "IntegrationConfig{userId=" + userId.getValue()
            + ", provider=" + provider
            + ", scopes=" + scopes
            + ", hasAccessToken=" + (encryptedAccessToken != null)
            + ", hasRefreshToken=" + (encryptedRefreshToken != null)
            + ", tokenExpiry=" + tokenExpiry
            + ", connected=" + connected + '}';
    }
}
