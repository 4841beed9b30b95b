package com.ryuqq.connector.core.model;

import com.ryuqq.connector.core.exception.SyncException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyncResult 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class SyncResultTest {

    @Test
    void of_NoErrors_IsSuccess() {
        // When
        SyncResult result = SyncResult.of(10, 3, List.of(), Map.of("issues", 10));

        // Then
        assertTrue(result.success());
        assertEquals(10, result.itemsProcessed());
        assertEquals(3, result.itemsSkipped());
        assertSame(result, result.orThrow());
    }

    @Test
    void of_WithErrors_IsPartialFailureKeepingCounts() {
        // When
        SyncResult result = SyncResult.of(7, 0, List.of("pulls sync failed: boom"), null);

        // Then
        assertFalse(result.success());
        assertEquals(7, result.itemsProcessed());
        assertEquals(List.of("pulls sync failed: boom"), result.errors());
        assertTrue(result.metadata().isEmpty());
    }

    @Test
    void orThrow_PartialFailure_ThrowsSyncExceptionWithPartialResult() {
        // Given
        SyncResult result = SyncResult.of(7, 1, List.of("pulls sync failed: boom"), Map.of());

        // When
        SyncException exception = assertThrows(SyncException.class, result::orThrow);

        // Then
        assertSame(result, exception.getPartialResult());
        assertTrue(exception.getMessage().contains("pulls sync failed: boom"));
        assertTrue(exception.isRetryable());
    }

    @Test
    void constructor_SuccessWithErrors_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new SyncResult(true, 0, 0, List.of("x"), Map.of())
        );
        assertTrue(exception.getMessage().contains("success cannot be true"));
    }

    @Test
    void constructor_NegativeCounts_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> SyncResult.of(-1, 0, List.of(), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> SyncResult.of(0, -1, List.of(), Map.of()));
    }

    @Test
    void metadata_IsDefensivelyCopied() {
        // Given
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("durationMs", 12L);
        SyncResult result = SyncResult.of(0, 0, List.of(), metadata);

        // When
        metadata.put("durationMs", 99L);

        // Then
        assertEquals(12L, result.metadata().get("durationMs"));
        assertThrows(UnsupportedOperationException.class, () -> result.metadata().put("x", 1));
    }
}
