package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.protection.CircuitState;

import java.util.Collection;
import java.util.Optional;

/**
 * Shared storage SPI for circuit breaker state.
 *
 * <p>All state transitions go through {@link #compareAndSet(OperationKey, CircuitState, CircuitState)},
 * which makes the half-open probe election atomic even when several processes share one store.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>compareAndSet must be atomic with respect to other calls for the same key</li>
 *   <li>Equality of expected state is value equality ({@link CircuitState#equals(Object)})</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface CircuitStateStore {

    /**
     * Finds the current state for a key.
     *
     * @param key the (provider, operation) key
     * @return the state, or empty if the key was never tracked
     */
    Optional<CircuitState> find(OperationKey key);

    /**
     * Atomically replaces the state for a key if it still equals {@code expected}.
     *
     * @param key the (provider, operation) key
     * @param expected the state previously read, or null if the key was absent
     * @param updated the new state
     * @return true if the replacement happened
     */
    boolean compareAndSet(OperationKey key, CircuitState expected, CircuitState updated);

    /**
     * Returns every tracked state.
     *
     * @return snapshot of all states
     */
    Collection<CircuitState> findAll();

    /**
     * Removes the state for a key. No-op if absent.
     *
     * @param key the (provider, operation) key
     */
    void remove(OperationKey key);
}
