package com.ryuqq.connector.adapter.protection.webhook;

import com.ryuqq.connector.core.contract.WebhookVerifier;
import com.ryuqq.connector.core.model.InboundWebhook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;

/**
 * HMAC-SHA256 Webhook 서명 검증기.
 *
 * <p>원본 바디 바이트에 대해 공유 시크릿으로 HMAC을 계산하고
 * {@link MessageDigest#isEqual(byte[], byte[])}로 상수 시간 비교합니다.</p>
 *
 * <p><strong>지원 형식:</strong></p>
 * <ul>
 *   <li>hex 또는 Base64 인코딩</li>
 *   <li>접두사 ({@code sha256=}, {@code v0=} 등)</li>
 *   <li>타임스탬프 서명: 서명 대상이 {@code {version}:{timestamp}:{body}}이며,
 *       허용 오차를 벗어난 타임스탬프는 재전송 공격으로 보고 거부</li>
 * </ul>
 *
 * <pre>{@code
 * // X-Hub-Signature-256: sha256=<hex>
 * WebhookVerifier github = HmacSha256WebhookVerifier.builder("X-Hub-Signature-256", secret)
 *     .prefix("sha256=")
 *     .build();
 *
 * // X-Slack-Signature: v0=<hex>, 서명 대상 v0:{X-Slack-Request-Timestamp}:{body}
 * WebhookVerifier slack = HmacSha256WebhookVerifier.builder("X-Slack-Signature", secret)
 *     .prefix("v0=")
 *     .timestamped("X-Slack-Request-Timestamp", "v0", Duration.ofMinutes(5), clock)
 *     .build();
 * }</pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class HmacSha256WebhookVerifier implements WebhookVerifier {

    private static final Logger log = LoggerFactory.getLogger(HmacSha256WebhookVerifier.class);

    private static final String ALGORITHM = "HmacSHA256";

    /**
     * 서명 인코딩.
     */
    public enum Encoding {
        HEX,
        BASE64
    }

    private final String signatureHeader;
    private final byte[] secret;
    private final String prefix;
    private final Encoding encoding;
    private final String timestampHeader;
    private final String version;
    private final Duration tolerance;
    private final Clock clock;

    private HmacSha256WebhookVerifier(Builder builder) {
        this.signatureHeader = builder.signatureHeader;
        this.secret = builder.secret;
        this.prefix = builder.prefix;
        this.encoding = builder.encoding;
        this.timestampHeader = builder.timestampHeader;
        this.version = builder.version;
        this.tolerance = builder.tolerance;
        this.clock = builder.clock;
    }

    /**
     * Builder 생성.
     *
     * @param signatureHeader 서명 헤더 이름
     * @param secret 공유 시크릿
     * @return Builder
     */
    public static Builder builder(String signatureHeader, String secret) {
        return new Builder(signatureHeader, secret);
    }

    @Override
    public String signatureHeader() {
        return signatureHeader;
    }

    @Override
    public boolean verify(InboundWebhook webhook, String signature) {
        if (webhook == null || signature == null || !signature.startsWith(prefix)) {
            return false;
        }

        byte[] provided = decode(signature.substring(prefix.length()).trim());
        if (provided == null) {
            return false;
        }

        byte[] signedContent;
        if (timestampHeader != null) {
            String timestamp = webhook.header(timestampHeader);
            if (!withinTolerance(timestamp)) {
                log.debug("Webhook timestamp outside tolerance for {}", webhook.provider());
                return false;
            }
            signedContent = concat((version + ":" + timestamp + ":").getBytes(StandardCharsets.UTF_8), webhook.rawBody());
        } else {
            signedContent = webhook.rawBody();
        }

        return MessageDigest.isEqual(sign(signedContent), provided);
    }

    /**
     * 주어진 내용에 대한 서명 헤더 값 계산 (테스트와 발신 측 구현용).
     *
     * @param body 원본 바디
     * @param timestamp 타임스탬프 (타임스탬프 서명이 아니면 무시)
     * @return 접두사를 포함한 서명 값
     */
    public String signatureFor(byte[] body, String timestamp) {
        byte[] content = timestampHeader != null
            ? concat((version + ":" + timestamp + ":").getBytes(StandardCharsets.UTF_8), body)
            : body;
        byte[] mac = sign(content);
        String encoded = encoding == Encoding.HEX
            ? HexFormat.of().formatHex(mac)
            : Base64.getEncoder().encodeToString(mac);
        return prefix + encoded;
    }

    private byte[] sign(byte[] content) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(content);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    private byte[] decode(String value) {
        try {
            return encoding == Encoding.HEX
                ? HexFormat.of().parseHex(value.toLowerCase())
                : Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private boolean withinTolerance(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return false;
        }
        try {
            Instant signedAt = Instant.ofEpochSecond(Long.parseLong(timestamp.trim()));
            return Duration.between(signedAt, clock.instant()).abs().compareTo(tolerance) <= 0;
        } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
            log.debug("Webhook timestamp is not a usable epoch second: {}", e.getClass().getSimpleName());
            return false;
        }
    }

    private static byte[] concat(byte[] head, byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(head.length + body.length);
        out.writeBytes(head);
        out.writeBytes(body);
        return out.toByteArray();
    }

    /**
     * {@link HmacSha256WebhookVerifier} Builder.
     */
    public static final class Builder {

        private final String signatureHeader;
        private final byte[] secret;
        private String prefix = "";
        private Encoding encoding = Encoding.HEX;
        private String timestampHeader;
        private String version;
        private Duration tolerance;
        private Clock clock;

        private Builder(String signatureHeader, String secret) {
            if (signatureHeader == null || signatureHeader.isBlank()) {
                throw new IllegalArgumentException("signatureHeader cannot be null or blank");
            }
            if (secret == null || secret.isEmpty()) {
                throw new IllegalArgumentException("secret cannot be null or empty");
            }
            this.signatureHeader = signatureHeader;
            this.secret = secret.getBytes(StandardCharsets.UTF_8);
        }

        public Builder prefix(String prefix) {
            if (prefix == null) {
                throw new IllegalArgumentException("prefix cannot be null");
            }
            this.prefix = prefix;
            return this;
        }

        public Builder encoding(Encoding encoding) {
            if (encoding == null) {
                throw new IllegalArgumentException("encoding cannot be null");
            }
            this.encoding = encoding;
            return this;
        }

        /**
         * 타임스탬프 서명 활성화.
         *
         * @param timestampHeader 타임스탬프(epoch seconds) 헤더
         * @param version 서명 대상 문자열의 버전 접두사 (예: v0)
         * @param tolerance 허용 시각 오차
         * @param clock 시계
         * @return this
         */
        public Builder timestamped(String timestampHeader, String version, Duration tolerance, Clock clock) {
            if (timestampHeader == null || timestampHeader.isBlank()) {
                throw new IllegalArgumentException("timestampHeader cannot be null or blank");
            }
            if (version == null || version.isBlank()) {
                throw new IllegalArgumentException("version cannot be null or blank");
            }
            if (tolerance == null || tolerance.isNegative()) {
                throw new IllegalArgumentException("tolerance must be >= 0");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.timestampHeader = timestampHeader;
            this.version = version;
            this.tolerance = tolerance;
            this.clock = clock;
            return this;
        }

        public HmacSha256WebhookVerifier build() {
            return new HmacSha256WebhookVerifier(this);
        }
    }
}
