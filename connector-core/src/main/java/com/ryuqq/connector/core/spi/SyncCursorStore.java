package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.model.UserId;

import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for incremental sync watermarks.
 *
 * <p><strong>Monotonicity:</strong> {@link #save(SyncCursor)} must never move a stored cursor
 * backwards. If the stored cursor is later than the given one, the stored cursor is kept.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface SyncCursorStore {

    /**
     * Finds the cursor for one resource type.
     *
     * @param userId the user
     * @param provider the provider
     * @param resourceType the resource type
     * @return the cursor, or empty if the resource type was never fully synced
     */
    Optional<SyncCursor> find(UserId userId, ProviderId provider, String resourceType);

    /**
     * Stores a cursor, keeping the later of the stored and given watermark.
     *
     * @param cursor the cursor
     */
    void save(SyncCursor cursor);

    /**
     * Lists all cursors for a (user, provider) pair.
     *
     * @param userId the user
     * @param provider the provider
     * @return cursors (never null)
     */
    List<SyncCursor> findAll(UserId userId, ProviderId provider);

    /**
     * Deletes all cursors for a (user, provider) pair.
     *
     * @param userId the user
     * @param provider the provider
     */
    void deleteAll(UserId userId, ProviderId provider);
}
