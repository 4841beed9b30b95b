package com.ryuqq.connector.core.contract;

import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.outcome.VendorOutcome;

import java.io.IOException;

/**
 * Refresh Token으로 새 Access Token을 발급받는 vendor 호출.
 *
 * <p>Refresh Token 자체가 무효/만료면 {@code Ok(AuthResult.failure(..))},
 * {@code NeedsRefresh}, 또는 {@code Fail(AUTHENTICATION)}를 반환합니다.
 * 세 경우 모두 통합이 연결 해제됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * 토큰 갱신 요청.
     *
     * @param refreshToken 복호화된 Refresh Token
     * @return 분류된 결과
     * @throws IOException 네트워크 오류
     */
    VendorOutcome<AuthResult> refresh(String refreshToken) throws IOException;
}
