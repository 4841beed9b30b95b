package com.ryuqq.connector.core.sync;

import java.io.IOException;

/**
 * 리소스 타입 하나의 동기화 함수.
 *
 * <p>다른 리소스 타입과 독립적으로 실행되며, 던진 예외는 해당 리소스 타입의 오류 하나로 집계됩니다.
 * 항목 단위 실패는 예외 대신 {@link ResourceSyncResult#itemErrors()}로 보고합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceSync {

    /**
     * 동기화 실행.
     *
     * @param window 동기화 구간
     * @return 처리/건너뜀 카운트와 항목 오류
     * @throws IOException vendor 호출 실패
     */
    ResourceSyncResult sync(SyncWindow window) throws IOException;
}
