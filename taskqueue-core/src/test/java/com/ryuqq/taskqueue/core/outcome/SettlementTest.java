package com.ryuqq.taskqueue.core.outcome;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Outcome / Settlement 단위 테스트.
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
class SettlementTest {

    @Test
    void outcome이_null이면_Success로_간주() {
        Settlement<String> settlement = Settlement.completed("a", null);

        assertThat(settlement.isSuccess()).isTrue();
        assertThat(settlement.isFailure()).isFalse();
        assertThat(settlement.isError()).isFalse();
        assertThat(settlement.outcome()).isInstanceOf(Success.class);
    }

    @Test
    void Failure_outcome은_실패로_분류() {
        Settlement<String> settlement = Settlement.completed("a", Outcome.failure("rejected"));

        assertThat(settlement.isFailure()).isTrue();
        assertThat(settlement.isSuccess()).isFalse();
        assertThat(((Failure) settlement.outcome()).reason()).isEqualTo("rejected");
    }

    @Test
    void 예외_종료는_outcome_없이_error만_가짐() {
        IllegalStateException error = new IllegalStateException("boom");

        Settlement<String> settlement = Settlement.errored("a", error);

        assertThat(settlement.isError()).isTrue();
        assertThat(settlement.isSuccess()).isFalse();
        assertThat(settlement.isFailure()).isFalse();
        assertThat(settlement.error()).isSameAs(error);
    }

    @Test
    void outcome과_error는_정확히_하나만_설정되어야_함() {
        assertThatThrownBy(() -> new Settlement<>("a", Outcome.success(), new RuntimeException()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Settlement<>("a", null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Settlement.completed(null, Outcome.success()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void Outcome_팩토리는_성공과_실패를_구분() {
        assertThat(Outcome.success().isSuccess()).isTrue();
        assertThat(Outcome.failure().isFailure()).isTrue();
        assertThat(Success.of("done").message()).isEqualTo("done");
        assertThat(Failure.of(null).reason()).isNull();
    }
}
