package com.ryuqq.connector.application.adapter;

import com.ryuqq.connector.application.support.MutableClock;
import com.ryuqq.connector.application.support.TestIntegrationServices;
import com.ryuqq.connector.application.webhook.WebhookDispatcher;
import com.ryuqq.connector.core.exception.IntegrationException;
import com.ryuqq.connector.core.model.IntegrationConfig;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.outcome.Fail;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.spi.MetricsSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.ryuqq.connector.application.adapter.AcmeTestAdapter.ACME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IntegrationRegistry 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@DisplayName("IntegrationRegistry 테스트")
class IntegrationRegistryTest {

    private static final UserId ALICE = UserId.of("alice");
    private static final UserId BOB = UserId.of("bob");
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private IntegrationServices services;
    private WebhookDispatcher dispatcher;
    private IntegrationRegistry registry;

    @BeforeEach
    void setUp() {
        services = TestIntegrationServices.create(new MutableClock(T0), MetricsSink.noop());
        dispatcher = new WebhookDispatcher(MetricsSink.noop());
        registry = new IntegrationRegistry(services.configStore(), services.cursorStore(), dispatcher);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        TestIntegrationServices.shutdown(services);
    }

    private AcmeTestAdapter connected(UserId userId) {
        services.configStore().save(IntegrationConfig.of(userId, ACME).withTokens(
            services.tokenVault().encrypt("access-1", userId), null, null));
        return new AcmeTestAdapter(services, userId, null, null);
    }

    @Test
    @DisplayName("등록한 어댑터를 사용자/Provider로 조회하고 webhook 경로에도 등록한다")
    void register_andFind() {
        // Given
        AcmeTestAdapter alice = connected(ALICE);
        AcmeTestAdapter bob = connected(BOB);

        // When
        registry.register(alice);
        registry.register(bob);

        // Then
        assertThat(registry.find(ALICE, ACME)).containsSame(alice);
        assertThat(registry.require(BOB, ACME)).isSameAs(bob);
        assertThat(registry.forUser(ALICE)).containsExactly(alice);
        assertThat(registry.forProvider(ACME)).containsExactly(alice, bob);
        assertThat(registry.size()).isEqualTo(2);
        assertThat(dispatcher.route("acme-alice")).containsSame(alice);
    }

    @Test
    @DisplayName("등록되지 않은 통합을 require하면 IntegrationException을 던진다")
    void require_missing() {
        assertThatThrownBy(() -> registry.require(ALICE, ProviderId.of("github")))
            .isInstanceOf(IntegrationException.class);
    }

    @Test
    @DisplayName("disconnect는 토큰을 폐기하고 설정, cursor, webhook 경로를 정리한다")
    void disconnect_cleansUp() {
        // Given
        AcmeTestAdapter alice = connected(ALICE);
        registry.register(alice);
        services.cursorStore().save(new SyncCursor(ACME, ALICE, "issues", T0));

        // When
        boolean revoked = registry.disconnect(ALICE, ACME);

        // Then
        assertThat(revoked).isTrue();
        assertThat(registry.find(ALICE, ACME)).isEmpty();
        assertThat(services.configStore().find(ALICE, ACME)).isEmpty();
        assertThat(services.cursorStore().findAll(ALICE, ACME)).isEmpty();
        assertThat(dispatcher.route("acme-alice")).isEmpty();
    }

    @Test
    @DisplayName("Vendor 토큰 폐기가 실패해도 로컬 상태는 정리된다")
    void disconnect_revokeFailure() {
        // Given
        AcmeTestAdapter alice = connected(ALICE);
        alice.revoke = token -> Fail.of(FailureKind.SERVER_ERROR, 500, "Internal Server Error");
        registry.register(alice);

        // When
        boolean revoked = registry.disconnect(ALICE, ACME);

        // Then
        assertThat(revoked).isFalse();
        assertThat(services.configStore().find(ALICE, ACME)).isEmpty();
        assertThat(registry.size()).isZero();
    }
}
