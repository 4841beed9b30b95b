package com.ryuqq.connector.core.protection;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.outcome.FailureKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * (Provider, Operation) 키별 Circuit Breaker SPI.
 *
 * <p>외부 API 호출의 연속 실패를 추적하고, 임계값 도달 시 네트워크 호출 없이
 * 즉시 실패(Fail-Fast)하여 장애가 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * OperationKey key = OperationKey.of(ProviderId.of("github"), "issues.list");
 *
 * if (!cb.tryAcquire(key)) {
 *     throw new CircuitOpenException(key, cb.nextAttemptAt(key).orElse(null));
 * }
 *
 * VendorOutcome<Issues> outcome = vendor.call(token);
 * if (outcome.isOk()) {
 *     cb.recordSuccess(key);
 * } else if (outcome instanceof Fail<Issues> fail && fail.kind().countsTowardBreaker()) {
 *     cb.recordFailure(key, fail.kind());
 * } else {
 *     cb.releasePermit(key);   // 401, 429, 4xx: 의존 서비스 장애가 아님
 * }
 * }</pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>같은 키의 상태는 모든 동시 호출이 공유해야 함</li>
 *   <li>HALF_OPEN probe 획득은 원자적이어야 함 (N개 동시 호출 중 1건만 true)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: cooldown 중이면 false, 지났으면 HALF_OPEN으로 전이하며 probe로 true</li>
     *   <li>HALF_OPEN: probe가 이미 진행 중이면 false</li>
     * </ul>
     *
     * @param key (Provider, Operation) 키
     * @return true: 호출 허용, false: 차단
     */
    boolean tryAcquire(OperationKey key);

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: consecutiveFailures 초기화</li>
     *   <li>HALF_OPEN: CLOSED로 전이</li>
     * </ul>
     *
     * @param key (Provider, Operation) 키
     */
    void recordSuccess(OperationKey key);

    /**
     * 실행 실패 기록.
     *
     * <p>{@link FailureKind#countsTowardBreaker()}가 false인 실패는
     * {@link #releasePermit(OperationKey)}과 동일하게 처리됩니다.</p>
     *
     * <ul>
     *   <li>CLOSED: 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이 (openedAt 갱신)</li>
     * </ul>
     *
     * @param key (Provider, Operation) 키
     * @param kind 실패 분류
     */
    void recordFailure(OperationKey key, FailureKind kind);

    /**
     * 상태 변화 없이 획득한 통과 허가를 반납.
     *
     * <p>HALF_OPEN probe가 401/429/4xx처럼 의존 서비스 상태를 판단할 수 없는 결과로 끝났을 때,
     * 다음 호출이 probe가 될 수 있도록 허가를 돌려줍니다.</p>
     *
     * @param key (Provider, Operation) 키
     */
    void releasePermit(OperationKey key);

    /**
     * 현재 상태 조회.
     *
     * @param key (Provider, Operation) 키
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState(OperationKey key);

    /**
     * 다음 시도 가능 시각.
     *
     * @param key (Provider, Operation) 키
     * @return OPEN이면 cooldown 종료 시각, 그 외에는 empty
     */
    Optional<Instant> nextAttemptAt(OperationKey key);

    /**
     * 키별 통계 스냅샷.
     *
     * @param key (Provider, Operation) 키
     * @return 상태 스냅샷 (추적 전이면 초기 상태)
     */
    CircuitState stats(OperationKey key);

    /**
     * Provider 하나의 모든 Operation 통계.
     *
     * @param provider Provider ID
     * @return 상태 스냅샷 목록
     */
    List<CircuitState> statsFor(ProviderId provider);

    /**
     * 전체 Circuit 상태 요약.
     *
     * @return 요약
     */
    CircuitHealth systemHealth();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.
     * 프로덕션 환경에서는 신중하게 사용해야 합니다.</p>
     *
     * @param key (Provider, Operation) 키
     */
    void reset(OperationKey key);
}
