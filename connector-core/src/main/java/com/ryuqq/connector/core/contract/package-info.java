/**
 * Provider adapter contract package.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.contract.IntegrationAdapter} - uniform capability set every adapter exposes</li>
 *   <li>{@link com.ryuqq.connector.core.contract.VendorCall} - one vendor HTTP call returning a typed outcome</li>
 *   <li>{@link com.ryuqq.connector.core.contract.TokenRefresher} - vendor token refresh call</li>
 *   <li>{@link com.ryuqq.connector.core.contract.WebhookVerifier} - signature scheme of one provider</li>
 *   <li>{@link com.ryuqq.connector.core.contract.WebhookEventParser} - raw request to canonical payload</li>
 *   <li>{@link com.ryuqq.connector.core.contract.WebhookHandler} - per-event-type handler</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Typed outcomes:</strong> vendor calls return {@code VendorOutcome} instead of throwing for 401/429</li>
 *   <li><strong>Raw bytes for signatures:</strong> verification runs before any parsing</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Connector Team
 */
package com.ryuqq.connector.core.contract;
