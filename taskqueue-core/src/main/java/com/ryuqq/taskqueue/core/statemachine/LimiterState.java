package com.ryuqq.taskqueue.core.statemachine;

/**
 * ConcurrencyLimiter의 스케줄링 사이클 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * IDLE (activeCount = 0)
 *   │
 *   ▼ (첫 admit)
 * ACTIVE (0 &lt; activeCount &lt;= concurrency)
 *   │
 *   ▼ (마지막 in-flight 작업 종료)
 * IDLE
 * </pre>
 *
 * <p>상태는 저장되지 않고 in-flight 집합의 크기에서 계산됩니다.</p>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public enum LimiterState {

    /**
     * 실행 중인 작업 없음.
     */
    IDLE,

    /**
     * 하나 이상의 작업이 실행 중.
     */
    ACTIVE;

    /**
     * activeCount로부터 상태 계산.
     *
     * @param activeCount 현재 in-flight 작업 수
     * @return activeCount가 0이면 IDLE, 아니면 ACTIVE
     */
    public static LimiterState of(int activeCount) {
        return activeCount == 0 ? IDLE : ACTIVE;
    }
}
