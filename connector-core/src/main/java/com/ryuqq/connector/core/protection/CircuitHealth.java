package com.ryuqq.connector.core.protection;

/**
 * 전체 Circuit 상태 요약.
 *
 * @param totalCircuits 추적 중인 키 수
 * @param openCircuits OPEN 수
 * @param halfOpenCircuits HALF_OPEN 수
 * @param closedCircuits CLOSED 수
 * @param healthPercent CLOSED 비율 (추적 키가 없으면 100)
 * @author Connector Team
 * @since 1.0.0
 */
public record CircuitHealth(
    int totalCircuits,
    int openCircuits,
    int halfOpenCircuits,
    int closedCircuits,
    double healthPercent
) {

    public static CircuitHealth of(int openCircuits, int halfOpenCircuits, int closedCircuits) {
        int total = openCircuits + halfOpenCircuits + closedCircuits;
        double health = total == 0 ? 100.0 : (closedCircuits * 100.0) / total;
        return new CircuitHealth(total, openCircuits, halfOpenCircuits, closedCircuits, health);
    }
}
