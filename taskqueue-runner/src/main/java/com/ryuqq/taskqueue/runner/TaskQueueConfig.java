package com.ryuqq.taskqueue.runner;

import com.ryuqq.taskqueue.core.collection.BoundedSequence;
import com.ryuqq.taskqueue.core.executor.DrainMode;

/**
 * TaskQueue 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 최대 동시 처리 수 (기본 1)</li>
 *   <li>capacity: 큐 최대 용량 (기본 무제한)</li>
 *   <li>drainMode: 슬롯이 가득 찼을 때의 대기 방식 (기본 DEFAULT)</li>
 * </ul>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 * @param concurrency 최대 동시 처리 수 (1 이상이어야 함)
 * @param capacity 큐 최대 용량 (1 이상이어야 함, {@link BoundedSequence#UNBOUNDED}는 무제한)
 * @param drainMode drain 대기 방식 (null 불가)
 */
public record TaskQueueConfig(
    int concurrency,
    int capacity,
    DrainMode drainMode
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=1, capacity=UNBOUNDED, drainMode=DEFAULT</p>
     */
    public TaskQueueConfig() {
        this(1, BoundedSequence.UNBOUNDED, DrainMode.DEFAULT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TaskQueueConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
        if (drainMode == null) {
            throw new IllegalArgumentException("drainMode cannot be null");
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public TaskQueueConfig withConcurrency(int concurrency) {
        return new TaskQueueConfig(concurrency, capacity, drainMode);
    }

    /**
     * capacity만 변경한 새 인스턴스 생성.
     */
    public TaskQueueConfig withCapacity(int capacity) {
        return new TaskQueueConfig(concurrency, capacity, drainMode);
    }

    /**
     * drainMode만 변경한 새 인스턴스 생성.
     */
    public TaskQueueConfig withDrainMode(DrainMode drainMode) {
        return new TaskQueueConfig(concurrency, capacity, drainMode);
    }
}
