package com.ryuqq.connector.adapter.protection.webhook;

import com.ryuqq.connector.core.contract.WebhookVerifier;
import com.ryuqq.connector.core.model.InboundWebhook;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 공유 Bearer Token 방식 Webhook 검증기.
 *
 * <p>헤더 값이 {@code Bearer <token>} 또는 토큰 그 자체일 때 상수 시간으로 비교합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class BearerTokenWebhookVerifier implements WebhookVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final String header;
    private final byte[] expectedToken;

    public BearerTokenWebhookVerifier(String header, String expectedToken) {
        if (header == null || header.isBlank()) {
            throw new IllegalArgumentException("header cannot be null or blank");
        }
        if (expectedToken == null || expectedToken.isBlank()) {
            throw new IllegalArgumentException("expectedToken cannot be null or blank");
        }
        this.header = header;
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Authorization 헤더를 사용하는 검증기.
     */
    public static BearerTokenWebhookVerifier authorization(String expectedToken) {
        return new BearerTokenWebhookVerifier("Authorization", expectedToken);
    }

    @Override
    public String signatureHeader() {
        return header;
    }

    @Override
    public boolean verify(InboundWebhook webhook, String signature) {
        if (webhook == null || signature == null) {
            return false;
        }
        String token = signature.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
            ? signature.substring(BEARER_PREFIX.length()).trim()
            : signature.trim();
        return MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8));
    }
}
