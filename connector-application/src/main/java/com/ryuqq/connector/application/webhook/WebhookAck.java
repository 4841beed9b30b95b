package com.ryuqq.connector.application.webhook;

/**
 * 서명 검증을 통과한 Webhook의 처리 결과.
 *
 * <p>세 상태 모두 Provider에게는 수신 확인(200)으로 응답합니다.
 * 서명 검증 실패는 이 타입이 아니라 예외로 거부됩니다.</p>
 *
 * @param status 처리 상태
 * @param eventType 이벤트 타입
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record WebhookAck(Status status, String eventType) {

    /**
     * 처리 상태.
     */
    public enum Status {
        /** 핸들러가 정상 처리함 */
        HANDLED,
        /** 등록된 핸들러가 없는 이벤트 타입 */
        IGNORED,
        /** 핸들러가 실패함 (로그 후 수신 확인) */
        HANDLER_FAILED
    }

    public WebhookAck {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static WebhookAck handled(String eventType) {
        return new WebhookAck(Status.HANDLED, eventType);
    }

    public static WebhookAck ignored(String eventType) {
        return new WebhookAck(Status.IGNORED, eventType);
    }

    public static WebhookAck handlerFailed(String eventType) {
        return new WebhookAck(Status.HANDLER_FAILED, eventType);
    }
}
