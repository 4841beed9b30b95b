package com.ryuqq.connector.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * HTTP 계층에서 넘겨받은 원본 Webhook 요청.
 *
 * <p>서명 검증은 반드시 원본 바이트({@code rawBody})에 대해 수행해야 하므로
 * 파싱 전 상태로 보관합니다. 헤더 조회는 대소문자를 구분하지 않습니다.</p>
 *
 * @param provider 대상 Provider
 * @param headers 요청 헤더
 * @param rawBody 원본 바디
 * @param receivedAt 수신 시각
 * @author Connector Team
 * @since 1.0.0
 */
public record InboundWebhook(
    ProviderId provider,
    Map<String, String> headers,
    byte[] rawBody,
    Instant receivedAt
) {

    public InboundWebhook {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (rawBody == null) {
            throw new IllegalArgumentException("rawBody cannot be null");
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt cannot be null");
        }
        TreeMap<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            normalized.putAll(headers);
        }
        headers = Collections.unmodifiableMap(normalized);
        rawBody = rawBody.clone();
    }

    /**
     * 헤더 조회 (대소문자 무시).
     *
     * @param name 헤더 이름
     * @return 헤더 값, 없으면 null
     */
    public String header(String name) {
        return name == null ? null : headers.get(name);
    }

    @Override
    public byte[] rawBody() {
        return rawBody.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InboundWebhook)) return false;
        InboundWebhook that = (InboundWebhook) o;
        return provider.equals(that.provider)
            && headers.equals(that.headers)
            && Arrays.equals(rawBody, that.rawBody)
            && receivedAt.equals(that.receivedAt);
    }

    @Override
    public int hashCode() {
        int result = provider.hashCode();
        result = 31 * result + headers.hashCode();
        result = 31 * result + Arrays.hashCode(rawBody);
        result = 31 * result + receivedAt.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "InboundWebhook{provider=" + provider + ", bodyLength=" + rawBody.length + ", receivedAt=" + receivedAt + '}';
    }
}
