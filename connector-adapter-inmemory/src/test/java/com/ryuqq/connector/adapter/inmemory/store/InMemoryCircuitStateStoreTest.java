package com.ryuqq.connector.adapter.inmemory.store;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.protection.CircuitBreakerState;
import com.ryuqq.connector.core.protection.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryCircuitStateStore 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@DisplayName("InMemoryCircuitStateStore 테스트")
class InMemoryCircuitStateStoreTest {

    private static final OperationKey KEY = OperationKey.of(ProviderId.of("github"), "issues.list");

    private final InMemoryCircuitStateStore store = new InMemoryCircuitStateStore();

    @Test
    @DisplayName("키가 없을 때 expected=null CAS는 삽입한다")
    void compareAndSet_absentKey_inserts() {
        // Given
        CircuitState initial = CircuitState.initial(KEY);

        // When
        boolean first = store.compareAndSet(KEY, null, initial);
        boolean second = store.compareAndSet(KEY, null, initial);

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.find(KEY)).contains(initial);
    }

    @Test
    @DisplayName("expected가 현재 값과 다르면 교체하지 않는다")
    void compareAndSet_staleExpected_fails() {
        // Given
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        CircuitState initial = CircuitState.initial(KEY);
        CircuitState failed = initial.withFailureStreak(1, now, now);
        store.compareAndSet(KEY, null, initial);
        store.compareAndSet(KEY, initial, failed);

        // When
        boolean replaced = store.compareAndSet(KEY, initial, initial.withStatus(CircuitBreakerState.OPEN, now, false));

        // Then
        assertThat(replaced).isFalse();
        assertThat(store.find(KEY)).contains(failed);
    }

    @Test
    @DisplayName("동시에 같은 expected로 CAS하면 정확히 1건만 성공한다")
    void compareAndSet_concurrent_exactlyOneWins() throws Exception {
        // Given
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        CircuitState open = CircuitState.initial(KEY).withStatus(CircuitBreakerState.OPEN, now, false);
        store.compareAndSet(KEY, null, open);
        CircuitState probe = open.withStatus(CircuitBreakerState.HALF_OPEN, now, true);

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger winners = new AtomicInteger();

        // When
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (store.compareAndSet(KEY, open, probe)) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // Then
        assertThat(winners.get()).isEqualTo(1);
    }

    @Test
    void remove_deletesState() {
        store.compareAndSet(KEY, null, CircuitState.initial(KEY));

        store.remove(KEY);

        assertThat(store.find(KEY)).isEmpty();
        assertThat(store.findAll()).isEmpty();
    }
}
