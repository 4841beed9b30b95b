package com.ryuqq.connector.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyncCursor 단조성 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class SyncCursorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final SyncCursor cursor =
        new SyncCursor(ProviderId.of("github"), UserId.of("user-1"), "issues", T0);

    @Test
    void advanceTo_LaterInstant_Advances() {
        // When
        SyncCursor advanced = cursor.advanceTo(T0.plusSeconds(60));

        // Then
        assertEquals(T0.plusSeconds(60), advanced.lastSyncTime());
        assertEquals("issues", advanced.resourceType());
    }

    @Test
    void advanceTo_EarlierInstant_KeepsCurrent() {
        assertSame(cursor, cursor.advanceTo(T0.minusSeconds(1)));
        assertSame(cursor, cursor.advanceTo(T0));
        assertSame(cursor, cursor.advanceTo(null));
    }

    @Test
    void constructor_BlankResourceType_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new SyncCursor(ProviderId.of("github"), UserId.of("user-1"), " ", T0));
    }
}
