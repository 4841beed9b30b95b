/**
 * 증분 동기화 계약.
 *
 * <p>Provider 동기화는 독립적인 리소스 타입별 {@link com.ryuqq.connector.core.sync.ResourceSync}로 분해되며,
 * 각 함수는 {@link com.ryuqq.connector.core.sync.SyncWindow}를 받아
 * {@link com.ryuqq.connector.core.sync.ResourceSyncResult}를 돌려줍니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.sync;
