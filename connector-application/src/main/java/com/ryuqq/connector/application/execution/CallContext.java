package com.ryuqq.connector.application.execution;

import com.ryuqq.connector.core.contract.TokenRefresher;
import com.ryuqq.connector.core.model.UserId;

/**
 * 보호된 호출 1건의 호출자 정보.
 *
 * <p>refresher가 null이면 401 응답 시 토큰 갱신 없이 인증 실패로 처리합니다.</p>
 *
 * @param userId 사용자 ID
 * @param integrationId 메트릭용 통합 ID
 * @param refresher 토큰 갱신 호출 (nullable)
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record CallContext(UserId userId, String integrationId, TokenRefresher refresher) {

    public CallContext {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (integrationId == null || integrationId.isBlank()) {
            throw new IllegalArgumentException("integrationId cannot be null or blank");
        }
    }

    public boolean canRefresh() {
        return refresher != null;
    }
}
