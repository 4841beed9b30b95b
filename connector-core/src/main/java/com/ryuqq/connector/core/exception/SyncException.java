package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.SyncResult;

/**
 * 부분 실패가 포함된 동기화 결과를 예외로 전달.
 *
 * <p>부분 결과를 그대로 보존합니다. 이미 반영된 데이터는 롤백되지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class SyncException extends IntegrationException {

    private final SyncResult partialResult;

    public SyncException(SyncResult partialResult) {
        super(null, "Sync completed with " + partialResult.errors().size() + " error(s): "
            + String.join("; ", partialResult.errors()));
        this.partialResult = partialResult;
    }

    public SyncResult getPartialResult() {
        return partialResult;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
