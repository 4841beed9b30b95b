package com.ryuqq.connector.adapter.inmemory.store;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.model.UserId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemorySyncCursorStore 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@DisplayName("InMemorySyncCursorStore 테스트")
class InMemorySyncCursorStoreTest {

    private static final UserId USER = UserId.of("user-1");
    private static final ProviderId GITHUB = ProviderId.of("github");
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemorySyncCursorStore store = new InMemorySyncCursorStore();

    @Test
    @DisplayName("save는 cursor를 과거로 되돌리지 않는다")
    void save_earlierCursor_keepsLater() {
        // Given
        store.save(new SyncCursor(GITHUB, USER, "issues", T0.plusSeconds(60)));

        // When
        store.save(new SyncCursor(GITHUB, USER, "issues", T0));

        // Then
        assertThat(store.find(USER, GITHUB, "issues"))
            .map(SyncCursor::lastSyncTime)
            .contains(T0.plusSeconds(60));
    }

    @Test
    void save_laterCursor_advances() {
        store.save(new SyncCursor(GITHUB, USER, "issues", T0));
        store.save(new SyncCursor(GITHUB, USER, "issues", T0.plusSeconds(5)));

        assertThat(store.find(USER, GITHUB, "issues").orElseThrow().lastSyncTime()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    @DisplayName("deleteAll은 해당 (user, provider)의 cursor만 삭제한다")
    void deleteAll_onlyMatchingPair() {
        // Given
        store.save(new SyncCursor(GITHUB, USER, "issues", T0));
        store.save(new SyncCursor(GITHUB, USER, "pulls", T0));
        store.save(new SyncCursor(ProviderId.of("slack"), USER, "channels", T0));
        store.save(new SyncCursor(GITHUB, UserId.of("user-2"), "issues", T0));

        // When
        store.deleteAll(USER, GITHUB);

        // Then
        assertThat(store.findAll(USER, GITHUB)).isEmpty();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void findAll_sortedByResourceType() {
        store.save(new SyncCursor(GITHUB, USER, "pulls", T0));
        store.save(new SyncCursor(GITHUB, USER, "issues", T0));

        assertThat(store.findAll(USER, GITHUB))
            .extracting(SyncCursor::resourceType)
            .containsExactly("issues", "pulls");
    }
}
