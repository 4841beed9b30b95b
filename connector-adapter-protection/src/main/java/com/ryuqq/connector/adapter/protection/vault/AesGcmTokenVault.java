package com.ryuqq.connector.adapter.protection.vault;

import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.TokenVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM 기반 {@link TokenVault}.
 *
 * <p><strong>형식:</strong> {@code {iv_base64}:{ciphertext_with_tag_base64}}</p>
 *
 * <ul>
 *   <li>키: 설정된 시크릿과 salt로 PBKDF2WithHmacSHA256 파생 (256bit)</li>
 *   <li>IV: 토큰마다 12바이트 난수</li>
 *   <li>AAD: userId, 다른 사용자의 암호문은 인증 태그 검증에서 실패</li>
 * </ul>
 *
 * <p>예외 메시지와 로그에는 평문이나 암호문을 포함하지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class AesGcmTokenVault implements TokenVault {

    private static final Logger log = LoggerFactory.getLogger(AesGcmTokenVault.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int KEY_LENGTH = 256;
    private static final int DEFAULT_ITERATIONS = 65_536;

    private final SecretKey key;
    private final SecureRandom secureRandom = new SecureRandom();

    public AesGcmTokenVault(String secret, String salt) {
        this(secret, salt, DEFAULT_ITERATIONS);
    }

    /**
     * 시크릿에서 키를 파생하여 생성.
     *
     * @param secret 암호화 시크릿
     * @param salt 키 파생 salt
     * @param iterations PBKDF2 반복 횟수
     */
    public AesGcmTokenVault(String secret, String salt, int iterations) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret cannot be null or empty");
        }
        if (salt == null || salt.isEmpty()) {
            throw new IllegalArgumentException("salt cannot be null or empty");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive (current: " + iterations + ")");
        }
        try {
            PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), salt.getBytes(StandardCharsets.UTF_8), iterations, KEY_LENGTH);
            byte[] keyBytes = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            spec.clearPassword();
            this.key = new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive token encryption key", e);
        }
        log.info("Token vault initialized with AES-256-GCM");
    }

    @Override
    public String encrypt(String plaintext, UserId userId) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(userId));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            return Base64.getEncoder().encodeToString(iv) + ":" + Base64.getEncoder().encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt token", e);
        }
    }

    @Override
    public String decrypt(String ciphertext, UserId userId) {
        if (ciphertext == null) {
            throw new IllegalArgumentException("ciphertext cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        String[] parts = ciphertext.split(":", 2);
        if (parts.length != 2) {
            throw new IllegalStateException("Invalid encrypted token format");
        }
        try {
            byte[] iv = Base64.getDecoder().decode(parts[0]);
            byte[] encrypted = Base64.getDecoder().decode(parts[1]);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(userId));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            // cause에 암호문 내용이 담기지 않도록 원인 클래스만 남김
            throw new IllegalStateException("Failed to decrypt token (" + e.getClass().getSimpleName() + ")");
        }
    }

    private static byte[] aad(UserId userId) {
        return userId.getValue().getBytes(StandardCharsets.UTF_8);
    }
}
