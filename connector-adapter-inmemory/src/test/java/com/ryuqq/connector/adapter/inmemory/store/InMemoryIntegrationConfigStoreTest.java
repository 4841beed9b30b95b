package com.ryuqq.connector.adapter.inmemory.store;

import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryIntegrationConfigStore 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class InMemoryIntegrationConfigStoreTest {

    private static final UserId USER = UserId.of("user-1");

    private final InMemoryIntegrationConfigStore store = new InMemoryIntegrationConfigStore();

    @Test
    void save_thenFind_returnsLatest() {
        // Given
        IntegrationConfig config = IntegrationConfig.of(USER, ProviderId.of("github"));
        store.save(config);

        // When
        IntegrationConfig updated = config.withScopes(List.of("repo"));
        store.save(updated);

        // Then
        assertThat(store.find(USER, ProviderId.of("github"))).contains(updated);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void findByUser_returnsOnlyOwnedConfigsSortedByProvider() {
        store.save(IntegrationConfig.of(USER, ProviderId.of("slack")));
        store.save(IntegrationConfig.of(USER, ProviderId.of("github")));
        store.save(IntegrationConfig.of(UserId.of("user-2"), ProviderId.of("github")));

        assertThat(store.findByUser(USER))
            .extracting(config -> config.provider().getValue())
            .containsExactly("github", "slack");
    }

    @Test
    void delete_missingConfig_isNoOp() {
        store.delete(USER, ProviderId.of("github"));

        assertThat(store.find(USER, ProviderId.of("github"))).isEmpty();
    }

    @Test
    void save_null_throws() {
        assertThatThrownBy(() -> store.save(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }
}
