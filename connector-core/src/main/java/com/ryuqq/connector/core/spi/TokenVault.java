package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.UserId;

/**
 * Token encryption SPI.
 *
 * <p>Access and refresh tokens are persisted only in the opaque form returned by
 * {@link #encrypt(String, UserId)}. Ciphertext produced for one user must not decrypt
 * for another user.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently by refresh and call paths</li>
 *   <li>Never log plaintext or include it in exception messages</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface TokenVault {

    /**
     * Encrypts a token for the given user.
     *
     * @param plaintext the token (must not be null)
     * @param userId the owning user (bound to the ciphertext)
     * @return opaque ciphertext safe to persist
     * @throws IllegalArgumentException if plaintext or userId is null
     */
    String encrypt(String plaintext, UserId userId);

    /**
     * Decrypts a token previously produced by {@link #encrypt(String, UserId)}.
     *
     * @param ciphertext opaque ciphertext
     * @param userId the owning user
     * @return plaintext token
     * @throws IllegalStateException if the ciphertext is malformed, tampered, or bound to another user
     */
    String decrypt(String ciphertext, UserId userId);
}
