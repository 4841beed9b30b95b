package com.ryuqq.connector.adapter.inmemory.store;

import com.ryuqq.connector.core.model.OperationKey;
import com.ryuqq.connector.core.protection.CircuitState;
import com.ryuqq.connector.core.spi.CircuitStateStore;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CircuitStateStore}.
 *
 * <p>Compare-and-set maps directly onto {@link ConcurrentHashMap#putIfAbsent} (absent key)
 * and {@link ConcurrentHashMap#replace(Object, Object, Object)} (present key), both of which
 * are atomic per key.</p>
 *
 * <p>One instance should be shared by every component that guards the same keys;
 * tests create a fresh instance per test case for isolation.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class InMemoryCircuitStateStore implements CircuitStateStore {

    private final ConcurrentHashMap<OperationKey, CircuitState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<CircuitState> find(OperationKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(states.get(key));
    }

    @Override
    public boolean compareAndSet(OperationKey key, CircuitState expected, CircuitState updated) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        if (expected == null) {
            return states.putIfAbsent(key, updated) == null;
        }
        return states.replace(key, expected, updated);
    }

    @Override
    public Collection<CircuitState> findAll() {
        return List.copyOf(states.values());
    }

    @Override
    public void remove(OperationKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        states.remove(key);
    }
}
