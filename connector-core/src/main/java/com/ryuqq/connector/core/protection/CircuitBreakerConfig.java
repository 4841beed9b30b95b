package com.ryuqq.connector.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN 전이 연속 실패 수 (기본 5)</li>
 *   <li>rollingWindow: 연속 실패 집계 구간 (기본 60초), 첫 실패로부터 이 구간을 넘기면 다시 1부터 센다</li>
 *   <li>openCooldown: OPEN 유지 시간 (기본 30초)</li>
 * </ul>
 *
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param rollingWindow 집계 구간 (양수)
 * @param openCooldown OPEN 유지 시간 (양수)
 * @author Connector Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration rollingWindow,
    Duration openCooldown
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, rollingWindow=60s, openCooldown=30s</p>
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60), Duration.ofSeconds(30));
    }

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (rollingWindow == null || rollingWindow.isZero() || rollingWindow.isNegative()) {
            throw new IllegalArgumentException("rollingWindow must be positive (current: " + rollingWindow + ")");
        }
        if (openCooldown == null || openCooldown.isZero() || openCooldown.isNegative()) {
            throw new IllegalArgumentException("openCooldown must be positive (current: " + openCooldown + ")");
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, rollingWindow, openCooldown);
    }

    public CircuitBreakerConfig withRollingWindow(Duration rollingWindow) {
        return new CircuitBreakerConfig(failureThreshold, rollingWindow, openCooldown);
    }

    public CircuitBreakerConfig withOpenCooldown(Duration openCooldown) {
        return new CircuitBreakerConfig(failureThreshold, rollingWindow, openCooldown);
    }
}
