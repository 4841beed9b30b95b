/**
 * 증분 동기화 패키지.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.application.sync.SyncOrchestrator} - 리소스 타입 fan-out/fan-in, cursor 전진, 결과 집계</li>
 *   <li>{@link com.ryuqq.connector.application.sync.IncrementalResourceSync} - 조회/필터/처리 형태의 리소스 동기화</li>
 *   <li>{@link com.ryuqq.connector.application.sync.SyncPolicy} - Provider별 동시성과 기한</li>
 * </ul>
 *
 * <p><strong>Cursor 규칙:</strong></p>
 * <ul>
 *   <li>리소스 타입의 작업이 항목 오류 없이 끝난 경우에만 전진</li>
 *   <li>전진 값은 동기화 시작 시각 (동기화 중 변경된 항목은 다음 동기화에서 다시 조회됨)</li>
 *   <li>단조 증가만 허용 (저장소가 과거 값으로의 되감기를 무시)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.connector.application.sync;
