package com.ryuqq.connector.adapter.inmemory.store;

import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.IntegrationConfigStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link IntegrationConfigStore} for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>configs:</strong> ConcurrentHashMap&lt;ConfigKey, IntegrationConfig&gt; - (user, provider) keyed, O(1) access</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>findByUser is a full scan</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class InMemoryIntegrationConfigStore implements IntegrationConfigStore {

    private final ConcurrentHashMap<ConfigKey, IntegrationConfig> configs = new ConcurrentHashMap<>();

    @Override
    public Optional<IntegrationConfig> find(UserId userId, ProviderId provider) {
        return Optional.ofNullable(configs.get(new ConfigKey(userId, provider)));
    }

    @Override
    public void save(IntegrationConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        configs.put(new ConfigKey(config.userId(), config.provider()), config);
    }

    @Override
    public void delete(UserId userId, ProviderId provider) {
        configs.remove(new ConfigKey(userId, provider));
    }

    @Override
    public List<IntegrationConfig> findByUser(UserId userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        return configs.values().stream()
            .filter(config -> config.userId().equals(userId))
            .sorted(Comparator.comparing(config -> config.provider().getValue()))
            .collect(Collectors.toList());
    }

    /**
     * Returns the number of stored configurations (for testing).
     *
     * @return number of configurations
     */
    public int size() {
        return configs.size();
    }

    /**
     * Clears all stored configurations (for testing).
     */
    public void clear() {
        configs.clear();
    }

    private record ConfigKey(UserId userId, ProviderId provider) {

        private ConfigKey {
            if (userId == null) {
                throw new IllegalArgumentException("userId cannot be null");
            }
            if (provider == null) {
                throw new IllegalArgumentException("provider cannot be null");
            }
        }
    }
}
