/**
 * Domain model package.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.model.ProviderId} - Provider identifier (e.g. github)</li>
 *   <li>{@link com.ryuqq.connector.core.model.UserId} - Owning user</li>
 *   <li>{@link com.ryuqq.connector.core.model.OperationKey} - (provider, operation) circuit key</li>
 * </ul>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.model.IntegrationConfig} - Per-user configuration with encrypted tokens</li>
 *   <li>{@link com.ryuqq.connector.core.model.AuthResult} - Result of authenticate / refresh</li>
 *   <li>{@link com.ryuqq.connector.core.model.ConnectionStatus} - On-demand connection check</li>
 *   <li>{@link com.ryuqq.connector.core.model.SyncResult} - Aggregated sync result</li>
 *   <li>{@link com.ryuqq.connector.core.model.SyncCursor} - Per-resource-type watermark</li>
 *   <li>{@link com.ryuqq.connector.core.model.InboundWebhook} / {@link com.ryuqq.connector.core.model.WebhookPayload} - Raw and canonical webhook</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Connector Team
 */
package com.ryuqq.connector.core.model;
