/**
 * In-memory persistence adapters.
 *
 * <p>Thread-safe implementations of the persistence SPIs backed by {@link java.util.concurrent.ConcurrentHashMap}:</p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.adapter.inmemory.store.InMemoryIntegrationConfigStore}</li>
 *   <li>{@link com.ryuqq.connector.adapter.inmemory.store.InMemorySyncCursorStore}</li>
 *   <li>{@link com.ryuqq.connector.adapter.inmemory.store.InMemoryCircuitStateStore}</li>
 * </ul>
 *
 * <p>Data does not survive a restart. Intended for tests and single-process deployments.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.inmemory.store;
