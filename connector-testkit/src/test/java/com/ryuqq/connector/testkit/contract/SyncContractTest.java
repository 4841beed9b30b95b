package com.ryuqq.connector.testkit.contract;

import com.ryuqq.connector.application.sync.IncrementalResourceSync;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.model.SyncResult;
import com.ryuqq.connector.core.outcome.Fail;
import com.ryuqq.connector.core.outcome.FailureKind;
import com.ryuqq.connector.core.sync.ResourceSyncTask;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 4: Incremental Sync.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Repeating a sync with the same cursor processes nothing twice</li>
 *   <li>A failing resource type does not block the others</li>
 *   <li>Only fully successful resource types advance their cursor</li>
 *   <li>Vendor reads inside a sync go through the protection chain</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
class SyncContractTest extends AbstractContractTest {

    private record Item(String id, Instant updatedAt) {
    }

    private final List<Item> remoteIssues = new CopyOnWriteArrayList<>();
    private final List<String> storedIssues = new CopyOnWriteArrayList<>();

    private ResourceSyncTask issuesTask(ScriptedAdapter adapter) {
        return ResourceSyncTask.of("issues", new IncrementalResourceSync<Item>(
            since -> {
                adapter.listIssues();
                return List.copyOf(remoteIssues);
            },
            Item::updatedAt,
            Item::id,
            item -> storedIssues.add(item.id())));
    }

    private static ResourceSyncTask fixedTask(String type, List<Item> items, List<String> sink) {
        return ResourceSyncTask.of(type, new IncrementalResourceSync<Item>(
            since -> List.copyOf(items), Item::updatedAt, Item::id, item -> sink.add(item.id())));
    }

    @Test
    void testSync_RepeatedWithSameCursor_NoDoubleProcessing() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        adapter.withSyncTask(issuesTask(adapter));
        remoteIssues.add(new Item("issue-1", T0.minus(Duration.ofHours(2))));
        remoteIssues.add(new Item("issue-2", T0.minus(Duration.ofHours(1))));

        // When
        SyncResult first = adapter.syncData(null);
        SyncResult second = adapter.syncData(null);

        // Then
        assertTrue(first.success());
        assertEquals(2, first.itemsProcessed());
        assertEquals(0, second.itemsProcessed());
        assertEquals(2, second.itemsSkipped());
        assertEquals(List.of("issue-1", "issue-2"), storedIssues);
        assertEquals(Optional.of(T0), adapter.getLastSyncTime());
    }

    @Test
    void testSync_NewItemsAfterCursor_OnlyNewProcessed() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        adapter.withSyncTask(issuesTask(adapter));
        remoteIssues.add(new Item("issue-1", T0.minus(Duration.ofHours(1))));
        adapter.syncData(null);

        // When
        clock.advance(Duration.ofHours(1));
        remoteIssues.add(new Item("issue-2", T0.plus(Duration.ofMinutes(30))));
        SyncResult result = adapter.syncData(null);

        // Then
        assertEquals(1, result.itemsProcessed());
        assertEquals(1, result.itemsSkipped());
        assertEquals(List.of("issue-1", "issue-2"), storedIssues);
        assertEquals(Optional.of(T0.plus(Duration.ofHours(1))), adapter.getLastSyncTime());
    }

    @Test
    void testSync_FailingResourceType_IsolatedFromOthers() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        List<String> storedComments = new CopyOnWriteArrayList<>();
        remoteIssues.add(new Item("issue-1", T0.minus(Duration.ofHours(1))));
        adapter.withSyncTask(issuesTask(adapter))
            .withSyncTask(ResourceSyncTask.of("pulls", window -> {
                throw new IOException("connection reset");
            }))
            .withSyncTask(fixedTask("comments", List.of(new Item("comment-1", T0.minusSeconds(60))), storedComments));

        // When
        SyncResult result = adapter.syncData(null);

        // Then
        assertFalse(result.success());
        assertEquals(List.of("pulls sync failed: connection reset"), result.errors());
        assertEquals(2, result.itemsProcessed());
        assertTrue(cursorStore.find(ALICE, GITHUB, "issues").isPresent());
        assertTrue(cursorStore.find(ALICE, GITHUB, "comments").isPresent());
        assertTrue(cursorStore.find(ALICE, GITHUB, "pulls").isEmpty(), "Failed type keeps its old cursor");
        assertEquals(1, metrics.syncOperations().size());
        assertEquals(1, metrics.syncOperations().get(0).errorCount());
    }

    @Test
    void testSync_ItemErrors_CursorNotAdvanced() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        cursorStore.save(new SyncCursor(GITHUB, ALICE, "issues", T0.minus(Duration.ofDays(1))));
        remoteIssues.add(new Item("issue-1", T0.minus(Duration.ofHours(1))));
        adapter.withSyncTask(ResourceSyncTask.of("issues", new IncrementalResourceSync<Item>(
            since -> List.copyOf(remoteIssues), Item::updatedAt, Item::id, item -> {
                throw new IllegalStateException("duplicate key");
            })));

        // When
        SyncResult result = adapter.syncData(null);

        // Then
        assertFalse(result.success());
        assertEquals(List.of("issues: issue-1: duplicate key"), result.errors());
        assertEquals(T0.minus(Duration.ofDays(1)),
            cursorStore.find(ALICE, GITHUB, "issues").orElseThrow().lastSyncTime());
    }

    @Test
    void testSync_VendorOutage_ReportedAsTypeFailure() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        adapter.withSyncTask(issuesTask(adapter));
        adapter.issues().then(Fail.of(FailureKind.SERVER_ERROR, 503, "Service Unavailable"));

        // When
        SyncResult result = adapter.syncData(null);

        // Then
        assertFalse(result.success());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("issues sync failed"));
        assertEquals(1, adapter.issues().calls(), "Retries are governed by the call policy");
        assertTrue(adapter.getLastSyncTime().isEmpty());
    }
}
