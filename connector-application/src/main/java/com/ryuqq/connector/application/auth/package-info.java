/**
 * 토큰 갱신 조정 패키지.
 *
 * <p>{@link com.ryuqq.connector.application.auth.TokenRefreshCoordinator}는
 * (사용자, Provider)별로 동시에 최대 1건의 갱신만 수행합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.connector.application.auth;
