package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;

import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for per-user integration configuration.
 *
 * <p>Tokens inside {@link IntegrationConfig} are already encrypted by a
 * {@link TokenVault}; stores never see plaintext.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Last write wins for the same (user, provider) pair</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface IntegrationConfigStore {

    /**
     * Finds the configuration for a (user, provider) pair.
     *
     * @param userId the user
     * @param provider the provider
     * @return the configuration, or empty if none is stored
     */
    Optional<IntegrationConfig> find(UserId userId, ProviderId provider);

    /**
     * Inserts or replaces a configuration.
     *
     * @param config the configuration
     * @throws IllegalArgumentException if config is null
     */
    void save(IntegrationConfig config);

    /**
     * Deletes a configuration. No-op if absent.
     *
     * @param userId the user
     * @param provider the provider
     */
    void delete(UserId userId, ProviderId provider);

    /**
     * Lists all configurations owned by a user.
     *
     * @param userId the user
     * @return configurations (never null)
     */
    List<IntegrationConfig> findByUser(UserId userId);
}
