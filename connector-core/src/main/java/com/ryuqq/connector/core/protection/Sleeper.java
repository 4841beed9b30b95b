package com.ryuqq.connector.core.protection;

import java.time.Duration;

/**
 * 대기(sleep) 추상화.
 *
 * <p>Rate Governor의 토큰 대기와 재시도 백오프에 사용됩니다.
 * 테스트에서는 가상 시계를 전진시키는 구현을 주입합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 주어진 시간만큼 대기.
     *
     * @param duration 대기 시간 (0 이하면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 구현.
     *
     * @return 시스템 Sleeper
     */
    static Sleeper system() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
            }
        };
    }
}
