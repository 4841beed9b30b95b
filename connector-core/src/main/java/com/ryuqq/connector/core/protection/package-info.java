/**
 * 보호(Protection) 계층 SPI.
 *
 * <p>외부 Provider API 호출을 보호하기 위한 두 가지 메커니즘을 제공합니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.protection.CircuitBreaker}: (Provider, Operation) 키별 연속 실패 차단</li>
 *   <li>{@link com.ryuqq.connector.core.protection.RateGovernor}: Provider별 토큰 버킷과 429 cooldown</li>
 * </ul>
 *
 * <p><strong>적용 순서:</strong></p>
 * <pre>
 * CircuitBreaker.tryAcquire → RateGovernor.acquire → vendor call → 결과 기록
 * </pre>
 *
 * <p>기본 구현은 connector-adapter-protection 모듈에 있고, 보호가 필요 없는 테스트에는
 * {@code noop} 패키지의 구현을 사용합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.protection;
