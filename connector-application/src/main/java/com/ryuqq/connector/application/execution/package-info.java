/**
 * Vendor 호출 보호 실행 패키지.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.application.execution.ProtectedCallExecutor} - breaker, governor, 토큰 갱신을 조합한 호출 체인</li>
 *   <li>{@link com.ryuqq.connector.application.execution.CallPolicy} - 타임아웃과 로컬 재시도 정책</li>
 *   <li>{@link com.ryuqq.connector.application.execution.CallContext} - 호출자 정보</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.connector.application.execution;
