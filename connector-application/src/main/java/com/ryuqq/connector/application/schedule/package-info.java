/**
 * 주기적 동기화 스케줄링 패키지.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.application.schedule.SyncScheduler} - 연결된 모든 통합의 증분/전체 동기화 주기 실행과 수동 실행</li>
 *   <li>{@link com.ryuqq.connector.application.schedule.SyncScheduleConfig} - 주기, 전체 동기화 시각, 배치 크기</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.connector.application.schedule;
