/**
 * Production implementations of the protection and collaborator SPIs.
 *
 * <ul>
 *   <li>{@code circuit} - {@link com.ryuqq.connector.adapter.protection.circuit.KeyedCircuitBreaker}</li>
 *   <li>{@code ratelimit} - {@link com.ryuqq.connector.adapter.protection.ratelimit.TokenBucketRateGovernor}</li>
 *   <li>{@code webhook} - HMAC-SHA256 and bearer token signature verifiers</li>
 *   <li>{@code vault} - AES-256-GCM token vault</li>
 *   <li>{@code metrics} - Micrometer metrics sink</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.protection;
