/**
 * Vendor call outcome package.
 *
 * <p>This package defines the sealed interface hierarchy returned by every vendor call.
 * The executor and the token refresh coordinator branch on the outcome type
 * instead of catching exceptions used as control flow.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.outcome.VendorOutcome} - Sealed interface (permits Ok, NeedsRefresh, RateLimited, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.outcome.Ok} - Decoded value</li>
 *   <li>{@link com.ryuqq.connector.core.outcome.NeedsRefresh} - 401, access token must be refreshed</li>
 *   <li>{@link com.ryuqq.connector.core.outcome.RateLimited} - 429 with optional Retry-After</li>
 *   <li>{@link com.ryuqq.connector.core.outcome.Fail} - Classified failure ({@link com.ryuqq.connector.core.outcome.FailureKind})</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (outcome instanceof Ok&lt;Issue&gt; ok) {
 *     return ok.value();
 * } else if (outcome instanceof RateLimited&lt;Issue&gt; limited) {
 *     governor.onRateLimited(provider, limited.retryAfter());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Connector Team
 */
package com.ryuqq.connector.core.outcome;
