package com.ryuqq.connector.adapter.inmemory.store;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.SyncCursorStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SyncCursorStore} for testing and reference purposes.
 *
 * <p>{@link #save(SyncCursor)} uses {@link ConcurrentHashMap#merge} so that concurrent writers
 * can only move a cursor forward.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class InMemorySyncCursorStore implements SyncCursorStore {

    private final ConcurrentHashMap<CursorKey, SyncCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncCursor> find(UserId userId, ProviderId provider, String resourceType) {
        return Optional.ofNullable(cursors.get(new CursorKey(userId, provider, resourceType)));
    }

    @Override
    public void save(SyncCursor cursor) {
        if (cursor == null) {
            throw new IllegalArgumentException("cursor cannot be null");
        }
        CursorKey key = new CursorKey(cursor.userId(), cursor.provider(), cursor.resourceType());
        cursors.merge(key, cursor, (stored, given) -> stored.advanceTo(given.lastSyncTime()));
    }

    @Override
    public List<SyncCursor> findAll(UserId userId, ProviderId provider) {
        return cursors.values().stream()
            .filter(cursor -> cursor.userId().equals(userId) && cursor.provider().equals(provider))
            .sorted(Comparator.comparing(SyncCursor::resourceType))
            .collect(Collectors.toList());
    }

    @Override
    public void deleteAll(UserId userId, ProviderId provider) {
        cursors.keySet().removeIf(key -> key.userId().equals(userId) && key.provider().equals(provider));
    }

    /**
     * Returns the number of stored cursors (for testing).
     *
     * @return number of cursors
     */
    public int size() {
        return cursors.size();
    }

    private record CursorKey(UserId userId, ProviderId provider, String resourceType) {

        private CursorKey {
            if (userId == null) {
                throw new IllegalArgumentException("userId cannot be null");
            }
            if (provider == null) {
                throw new IllegalArgumentException("provider cannot be null");
            }
            if (resourceType == null || resourceType.isBlank()) {
                throw new IllegalArgumentException("resourceType cannot be null or blank");
            }
        }
    }
}
