package com.ryuqq.taskqueue.runner;

import com.ryuqq.taskqueue.core.collection.BoundedQueue;
import com.ryuqq.taskqueue.core.collection.BoundedStack;
import com.ryuqq.taskqueue.core.executor.DrainMode;

import java.util.Arrays;

/**
 * 큐/스택/TaskQueue 정적 팩토리.
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public final class TaskQueues {

    private TaskQueues() {
    }

    /**
     * 용량이 제한된 FIFO 큐 생성.
     *
     * @param capacity 최대 용량
     * @param initialElements 초기 요소
     * @param <T> 요소 타입
     * @return BoundedQueue
     * @throws com.ryuqq.taskqueue.core.collection.CapacityExceededException 초기 요소 수가 용량을 초과한 경우
     */
    @SafeVarargs
    public static <T> BoundedQueue<T> newBoundedQueue(int capacity, T... initialElements) {
        return new BoundedQueue<>(capacity, Arrays.asList(initialElements));
    }

    /**
     * 용량이 제한된 LIFO 스택 생성.
     *
     * @param capacity 최대 용량
     * @param initialElements 초기 요소 (마지막 요소가 top)
     * @param <T> 요소 타입
     * @return BoundedStack
     */
    @SafeVarargs
    public static <T> BoundedStack<T> newBoundedStack(int capacity, T... initialElements) {
        return new BoundedStack<>(capacity, Arrays.asList(initialElements));
    }

    /**
     * TaskQueue 생성 (DEFAULT drain 방식).
     *
     * @param concurrency 최대 동시 처리 수
     * @param capacity 큐 최대 용량
     * @param initialElements 초기 요소
     * @param <T> 요소 타입
     * @return TaskQueue
     */
    @SafeVarargs
    public static <T> TaskQueue<T> newTaskQueue(int concurrency, int capacity, T... initialElements) {
        return newTaskQueue(new TaskQueueConfig(concurrency, capacity, DrainMode.DEFAULT), initialElements);
    }

    /**
     * 설정 기반 TaskQueue 생성.
     *
     * @param config 설정
     * @param initialElements 초기 요소
     * @param <T> 요소 타입
     * @return TaskQueue
     */
    @SafeVarargs
    public static <T> TaskQueue<T> newTaskQueue(TaskQueueConfig config, T... initialElements) {
        return new TaskQueue<>(config, Arrays.asList(initialElements));
    }
}
