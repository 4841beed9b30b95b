/**
 * 통합 어댑터 기반 클래스와 레지스트리.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.application.adapter.AbstractIntegrationAdapter} - Provider 어댑터의 기본 구현</li>
 *   <li>{@link com.ryuqq.connector.application.adapter.IntegrationServices} - 어댑터가 공유하는 엔진 묶음</li>
 *   <li>{@link com.ryuqq.connector.application.adapter.IntegrationRegistry} - (사용자, Provider)별 활성 통합</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.connector.application.adapter;
