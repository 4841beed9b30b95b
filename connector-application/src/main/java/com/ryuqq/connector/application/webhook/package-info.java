/**
 * Inbound Webhook 처리 패키지.
 *
 * <p>서명 검증을 통과하지 못한 Webhook은 어떤 핸들러에도 도달하지 않습니다.
 * 검증을 통과한 Webhook은 미지원 타입이거나 핸들러가 실패해도 수신 확인됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.connector.application.webhook;
