package com.ryuqq.connector.application.schedule;

/**
 * 한 번의 스케줄 sweep 결과.
 *
 * @param fullSync 전체 동기화 sweep 여부
 * @param eligible 동기화 대상 통합 수 (batchSize 적용 후)
 * @param succeeded 오류 없이 끝난 통합 수
 * @param failed 부분 실패했거나 예외로 끝난 통합 수
 * @param skipped 이미 동기화 중이라 건너뛴 통합 수
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record SyncSweep(
    boolean fullSync,
    int eligible,
    int succeeded,
    int failed,
    int skipped
) {
}
