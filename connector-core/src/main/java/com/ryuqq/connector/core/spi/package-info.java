/**
 * Service Provider Interfaces for storage, encryption and metrics.
 *
 * <p>In-memory implementations live in connector-adapter-inmemory; the AES-GCM vault and
 * SLF4J metrics sink live in connector-adapter-protection.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.spi;
