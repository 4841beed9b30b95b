package com.ryuqq.connector.application.sync;

import com.ryuqq.connector.core.sync.ResourceSyncResult;
import com.ryuqq.connector.core.sync.SyncWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * IncrementalResourceSync 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@DisplayName("IncrementalResourceSync 테스트")
class IncrementalResourceSyncTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private record Issue(String id, Instant updatedAt) {
    }

    @Test
    @DisplayName("최초 동기화는 모든 항목을 처리하고 since=null로 조회한다")
    void fullSync_processesEverything() throws Exception {
        // Given
        List<Instant> requestedSince = new ArrayList<>();
        List<String> written = new ArrayList<>();
        IncrementalResourceSync<Issue> sync = new IncrementalResourceSync<>(
            since -> {
                requestedSince.add(since);
                return List.of(new Issue("1", T0.minusSeconds(10)), new Issue("2", T0.minusSeconds(5)));
            },
            Issue::updatedAt, Issue::id, issue -> written.add(issue.id()));

        // When
        ResourceSyncResult result = sync.sync(new SyncWindow("issues", null, null, T0));

        // Then
        assertThat(requestedSince).containsExactly((Instant) null);
        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.skipped()).isZero();
        assertThat(written).containsExactly("1", "2");
    }

    @Test
    @DisplayName("워터마크 이하로 갱신된 항목은 건너뛰고 갱신 시각을 모르는 항목은 처리한다")
    void incrementalSync_skipsReflectedItems() throws Exception {
        // Given
        Instant cursor = T0.minusSeconds(60);
        List<String> written = new ArrayList<>();
        IncrementalResourceSync<Issue> sync = new IncrementalResourceSync<>(
            since -> List.of(
                new Issue("old", cursor.minusSeconds(1)),
                new Issue("edge", cursor),
                new Issue("new", cursor.plusSeconds(1)),
                new Issue("unknown", null)),
            Issue::updatedAt, Issue::id, issue -> written.add(issue.id()));

        // When
        ResourceSyncResult result = sync.sync(new SyncWindow("issues", cursor, cursor, T0));

        // Then
        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(2);
        assertThat(written).containsExactly("new", "unknown");
    }

    @Test
    @DisplayName("한 항목의 처리 실패는 기록되고 나머지 항목은 계속 처리된다")
    void itemFailure_isRecordedAndProcessingContinues() throws Exception {
        // Given
        List<String> written = new ArrayList<>();
        IncrementalResourceSync<Issue> sync = new IncrementalResourceSync<>(
            since -> List.of(new Issue("1", null), new Issue("2", null), new Issue("3", null)),
            Issue::updatedAt, issue -> "issue #" + issue.id(),
            issue -> {
                if (issue.id().equals("2")) {
                    throw new IllegalArgumentException("title too long");
                }
                written.add(issue.id());
            });

        // When
        ResourceSyncResult result = sync.sync(new SyncWindow("issues", null, null, T0));

        // Then
        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.itemErrors()).containsExactly("issue #2: title too long");
        assertThat(result.isComplete()).isFalse();
        assertThat(written).containsExactly("1", "3");
    }
}
