package com.ryuqq.taskqueue.core.collection;

/**
 * 가득 찬 큐에 enqueue를 시도했을 때 발생하는 예외.
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class QueueFullException extends CapacityExceededException {

    /**
     * 생성자.
     *
     * @param capacity 큐의 최대 용량
     */
    public QueueFullException(int capacity) {
        super("Queue is full (capacity: " + capacity + ")", capacity);
    }
}
