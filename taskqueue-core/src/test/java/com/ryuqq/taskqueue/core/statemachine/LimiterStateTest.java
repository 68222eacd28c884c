package com.ryuqq.taskqueue.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LimiterStateTest {

    @Test
    void activeCount가_0이면_IDLE_그_외는_ACTIVE() {
        assertThat(LimiterState.of(0)).isEqualTo(LimiterState.IDLE);
        assertThat(LimiterState.of(1)).isEqualTo(LimiterState.ACTIVE);
        assertThat(LimiterState.of(8)).isEqualTo(LimiterState.ACTIVE);
    }
}
