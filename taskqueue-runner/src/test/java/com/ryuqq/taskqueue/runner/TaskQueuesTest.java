package com.ryuqq.taskqueue.runner;

import com.ryuqq.taskqueue.core.collection.BoundedQueue;
import com.ryuqq.taskqueue.core.collection.BoundedStack;
import com.ryuqq.taskqueue.core.collection.CapacityExceededException;
import com.ryuqq.taskqueue.core.executor.DrainMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskQueuesTest {

    @Test
    void 팩토리는_초기_요소를_순서대로_담은_컨테이너를_생성() {
        BoundedQueue<String> queue = TaskQueues.newBoundedQueue(3, "a", "b");
        BoundedStack<String> stack = TaskQueues.newBoundedStack(3, "a", "b");

        assertThat(queue.peek()).contains("a");
        assertThat(stack.peek()).contains("b");
    }

    @Test
    void newTaskQueue는_DEFAULT_drain_방식을_사용() {
        TaskQueue<Integer> taskQueue = TaskQueues.newTaskQueue(3, 25, 1, 2, 3);

        assertThat(taskQueue.config().drainMode()).isEqualTo(DrainMode.DEFAULT);
        assertThat(taskQueue.concurrency()).isEqualTo(3);
        assertThat(taskQueue.capacity()).isEqualTo(25);
        assertThat(taskQueue.length()).isEqualTo(3);
    }

    @Test
    void 초기_요소가_용량을_넘으면_예외() {
        assertThatThrownBy(() -> TaskQueues.newTaskQueue(1, 2, 1, 2, 3))
            .isInstanceOf(CapacityExceededException.class);
    }
}
