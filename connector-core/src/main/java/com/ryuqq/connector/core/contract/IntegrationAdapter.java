package com.ryuqq.connector.core.contract;

import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.model.ConnectionStatus;
import com.ryuqq.connector.core.model.InboundWebhook;
import com.ryuqq.connector.core.model.IntegrationCapability;
import com.ryuqq.connector.core.model.IntegrationMetadata;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncResult;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.model.WebhookPayload;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 모든 Provider 어댑터가 구현하는 공통 통합 계약.
 *
 * <p>애플리케이션은 Provider와 무관하게 이 인터페이스 하나만 사용합니다.
 * 어댑터는 보통 {@code AbstractIntegrationAdapter}를 상속하여 vendor 호출과
 * 리소스 매핑만 구현합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>authenticate: 예상 가능한 실패는 예외 대신 {@code AuthResult.failure}로 반환</li>
 *   <li>syncData: 같은 lastSyncTime으로 반복 호출해도 중복 집계하지 않음 (이미 반영된 항목은 itemsSkipped)</li>
 *   <li>validateRequiredScopes: 네트워크 접근 없는 순수 함수</li>
 *   <li>handleWebhook: 알 수 없는 이벤트 타입은 로그만 남기고 무시</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface IntegrationAdapter {

    /**
     * 어댑터 메타데이터.
     *
     * @return Provider, 표시 이름, 버전, 지원 Webhook 이벤트
     */
    IntegrationMetadata metadata();

    default ProviderId getProvider() {
        return metadata().provider();
    }

    /**
     * 통합을 소유한 사용자.
     *
     * @return 사용자 ID
     */
    UserId getUserId();

    /**
     * 통합 인스턴스 ID (메트릭 태그용).
     *
     * @return 통합 ID
     */
    String getIntegrationId();

    /**
     * 저장된 설정으로 인증하고 토큰을 암호화하여 저장합니다.
     *
     * @return 인증 결과 (예상 가능한 실패는 success=false)
     */
    AuthResult authenticate();

    /**
     * Refresh Token으로 Access Token을 갱신합니다.
     *
     * <p>동시 호출은 하나의 갱신 요청으로 합쳐집니다.</p>
     *
     * @return 갱신 결과 (Refresh Token이 무효하면 success=false, 통합은 연결 해제됨)
     */
    AuthResult refreshToken();

    /**
     * Provider 측 접근 권한을 폐기합니다.
     *
     * @return 폐기 성공 여부
     */
    boolean revokeAccess();

    /**
     * 연결 상태를 확인합니다. 예외를 던지지 않습니다.
     *
     * @return 연결 상태 (Rate Limit 현황 포함)
     */
    ConnectionStatus testConnection();

    /**
     * 제공 기능 목록.
     *
     * @return 기능 목록
     */
    List<IntegrationCapability> getCapabilities();

    /**
     * 요청한 scope가 모두 활성 기능의 requiredScopes에 포함되는지 검사합니다.
     *
     * @param scopes 요청 scope
     * @return 모두 포함되면 true
     */
    boolean validateRequiredScopes(Collection<String> scopes);

    /**
     * 증분 동기화.
     *
     * @param lastSyncTime 기준 시각 override (null이면 리소스 타입별 cursor 사용)
     * @return 집계된 결과 (부분 실패는 success=false로 보고)
     */
    SyncResult syncData(Instant lastSyncTime);

    /**
     * 전체 동기화. 저장된 cursor를 무시하고 모든 항목을 다시 조회합니다.
     *
     * <p>처리는 멱등이어야 하며, 오류 없이 끝난 리소스 타입의 cursor는 갱신됩니다.</p>
     *
     * @return 집계된 결과
     */
    SyncResult fullSync();

    /**
     * 모든 리소스 타입이 동기화된 마지막 시각.
     *
     * @return 리소스 타입별 cursor 중 가장 이른 시각 (한 타입이라도 cursor가 없으면 empty)
     */
    Optional<Instant> getLastSyncTime();

    /**
     * 서명 검증을 통과한 Webhook 이벤트 처리.
     *
     * @param payload 정규화된 페이로드
     */
    void handleWebhook(WebhookPayload payload);

    /**
     * Webhook 서명 검증.
     *
     * @param webhook 원본 요청 (원본 바이트 기준으로 검증)
     * @param signature 서명 헤더 값
     * @return 유효하면 true
     */
    boolean validateWebhookSignature(InboundWebhook webhook, String signature);

    /**
     * 서명이 담긴 헤더 이름.
     *
     * @return 헤더 이름 (Webhook을 지원하지 않으면 null)
     */
    String webhookSignatureHeader();

    /**
     * 원본 요청을 정규화된 페이로드로 파싱합니다.
     *
     * @param webhook 원본 요청
     * @return 정규화된 페이로드
     * @throws com.ryuqq.connector.core.exception.ValidationException 바디나 이벤트 타입이 잘못된 경우
     */
    WebhookPayload parseWebhook(InboundWebhook webhook);

    /**
     * 이벤트 타입에 등록된 핸들러가 있는지 여부.
     *
     * @param eventType 이벤트 타입
     * @return 핸들러가 있으면 true
     */
    boolean supportsWebhookEvent(String eventType);
}
