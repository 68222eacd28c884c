package com.ryuqq.taskqueue.runner;

import com.ryuqq.taskqueue.core.collection.BoundedSequence;
import com.ryuqq.taskqueue.core.executor.DrainMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskQueueConfigTest {

    @Test
    void 기본_설정값() {
        TaskQueueConfig config = new TaskQueueConfig();

        assertThat(config.concurrency()).isEqualTo(1);
        assertThat(config.capacity()).isEqualTo(BoundedSequence.UNBOUNDED);
        assertThat(config.drainMode()).isEqualTo(DrainMode.DEFAULT);
    }

    @Test
    void with_메서드는_해당_값만_변경한_새_인스턴스를_반환() {
        TaskQueueConfig base = new TaskQueueConfig();

        TaskQueueConfig changed = base.withConcurrency(4).withCapacity(20).withDrainMode(DrainMode.RACE);

        assertThat(changed).isEqualTo(new TaskQueueConfig(4, 20, DrainMode.RACE));
        assertThat(base.concurrency()).isEqualTo(1);
    }

    @Test
    void 잘못된_값은_거부됨() {
        assertThatThrownBy(() -> new TaskQueueConfig(0, 10, DrainMode.DEFAULT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("concurrency must be positive (current: 0)");
        assertThatThrownBy(() -> new TaskQueueConfig(1, -1, DrainMode.DEFAULT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("capacity must be positive (current: -1)");
        assertThatThrownBy(() -> new TaskQueueConfig(1, 1, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("drainMode cannot be null");
    }
}
