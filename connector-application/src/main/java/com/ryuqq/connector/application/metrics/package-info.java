/**
 * 메트릭 싱크 보조 컴포넌트.
 *
 * @since 1.0.0
 */
package com.ryuqq.connector.application.metrics;
