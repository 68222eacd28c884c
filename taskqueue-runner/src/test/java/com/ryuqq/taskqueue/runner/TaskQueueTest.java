package com.ryuqq.taskqueue.runner;

import com.ryuqq.taskqueue.core.collection.QueueFullException;
import com.ryuqq.taskqueue.core.executor.DrainMode;
import com.ryuqq.taskqueue.core.executor.TaskOperation;
import com.ryuqq.taskqueue.core.outcome.Outcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskQueue 테스트.
 *
 * <p>검증 시나리오:</p>
 * <ul>
 *   <li>큐 연산 (enqueue / dequeue / 용량)</li>
 *   <li>runAsync 완료 시 모든 요소가 processed에 존재</li>
 *   <li>처리 도중 enqueue된 요소도 처리됨</li>
 *   <li>awaitCompleted 재준비</li>
 *   <li>run 동기 처리</li>
 * </ul>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
class TaskQueueTest {

    private static final long TIMEOUT_SECONDS = 5;

    @Test
    void enqueue_후_dequeue는_머리_요소를_반환() {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(3, 25, 1, 2, 3);

        // when
        taskQueue.enqueue(4);

        // then
        assertThat(taskQueue.length()).isEqualTo(4);
        assertThat(taskQueue.dequeue()).contains(1);
        assertThat(taskQueue.length()).isEqualTo(3);
        assertThat(taskQueue.peek()).contains(2);
        assertThat(taskQueue.processed()).isEmpty();
    }

    @Test
    void 가득_찬_큐에_enqueue하면_QueueFullException() {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(1, 2, 1, 2);

        // when & then
        assertThatThrownBy(() -> taskQueue.enqueue(3)).isInstanceOf(QueueFullException.class);
        assertThat(taskQueue.state()).containsExactly(1, 2);
        assertThat(taskQueue.isFull()).isTrue();
    }

    @Test
    void runAsync는_모든_요소를_처리한_뒤_processed로_완료됨() throws Exception {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(2, 10, 1, 2, 3);
        List<Integer> succeeded = Collections.synchronizedList(new ArrayList<>());

        // when: 뒤 요소일수록 빨리 끝남
        Set<Integer> processed = taskQueue.runAsync(
            item -> delayed(40 - item * 10L, Outcome.success()),
            succeeded::add,
            null,
            null
        ).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(processed).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(succeeded).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(taskQueue.isCompleted()).isTrue();
        assertThat(taskQueue.isEmpty()).isTrue();
    }

    @Test
    void runAsync는_동시_실행_수_상한을_지킴() throws Exception {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(2, 50);
        for (int i = 1; i <= 12; i++) {
            taskQueue.enqueue(i);
        }
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        // when
        Set<Integer> processed = taskQueue.runAsync(item -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            return CompletableFuture.supplyAsync(() -> {
                running.decrementAndGet();
                return Outcome.success();
            }, CompletableFuture.delayedExecutor(3, TimeUnit.MILLISECONDS));
        }).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(processed).hasSize(12);
        assertThat(maxRunning.get()).isBetween(1, 2);
    }

    @Test
    void 처리_도중_enqueue된_요소도_같은_실행에서_처리됨() throws Exception {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(2, 10, 1, 2, 3);

        // when: 1이 성공하면 100을 추가
        Set<Integer> processed = taskQueue.runAsync(
            item -> delayed(5, Outcome.success()),
            OutcomeHandlers.<Integer>none().withOnSuccess(item -> {
                if (item == 1) {
                    taskQueue.enqueue(100);
                }
            })
        ).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(processed).containsExactlyInAnyOrder(1, 2, 3, 100);
        assertThat(taskQueue.isCompleted()).isTrue();
    }

    @Test
    void 요소별_오류와_실패는_실행을_중단시키지_않음() throws Exception {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(3, 10, 1, 2, 3, 4, 5);
        Map<Integer, String> routed = new ConcurrentHashMap<>();

        // when
        Set<Integer> processed = taskQueue.runAsync(
            item -> {
                if (item == 2) {
                    throw new IllegalStateException("boom");
                }
                return delayed(2, item == 4 ? Outcome.failure() : Outcome.success());
            },
            item -> routed.put(item, "success"),
            item -> routed.put(item, "failure"),
            (item, error) -> routed.put(item, "error:" + error.getMessage())
        ).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(processed).containsExactlyInAnyOrder(1, 2, 3, 4, 5);
        assertThat(routed)
            .containsEntry(2, "error:boom")
            .containsEntry(4, "failure")
            .containsEntry(1, "success")
            .hasSize(5);
    }

    @Test
    void concurrency가_요소_수_이상이면_admit_순서는_enqueue_순서와_같음() throws Exception {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(10, 10, 4, 2, 7, 1);
        taskQueue.enqueue(9);
        List<Integer> admitted = Collections.synchronizedList(new ArrayList<>());

        // when
        taskQueue.runAsync(item -> {
            admitted.add(item);
            return delayed(10 - item, Outcome.success());
        }).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(admitted).containsExactly(4, 2, 7, 1, 9);
    }

    @Test
    void 실패로_표시된_요소만_onFailure가_호출되고_나머지는_onSuccess() throws Exception {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(3, 10, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        List<Integer> succeeded = Collections.synchronizedList(new ArrayList<>());
        List<Integer> failed = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger errors = new AtomicInteger();

        // when
        Set<Integer> processed = taskQueue.runAsync(
            item -> delayed(item % 4, item == 5 ? Outcome.failure() : Outcome.success()),
            succeeded::add,
            failed::add,
            (item, error) -> errors.incrementAndGet()
        ).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(failed).containsExactly(5);
        assertThat(succeeded).hasSize(9).doesNotContain(5);
        assertThat(errors.get()).isZero();
        assertThat(processed).hasSize(10);
        assertThat(taskQueue.isEmpty()).isTrue();
    }

    @Test
    void RACE_방식도_모든_요소를_처리() throws Exception {
        // given
        TaskQueueConfig config = new TaskQueueConfig().withConcurrency(2).withCapacity(10).withDrainMode(DrainMode.RACE);
        TaskQueue<Integer> taskQueue = TaskQueues.newTaskQueue(config, 1, 2, 3, 4, 5, 6);

        // when
        Set<Integer> processed = taskQueue
            .runAsync(item -> delayed(item % 3, Outcome.success()))
            .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(processed).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6);
        assertThat(taskQueue.isCompleted()).isTrue();
    }

    // ============================================================
    // 완료 신호
    // ============================================================

    @Test
    void 빈_큐의_awaitCompleted는_즉시_완료됨() {
        TaskQueue<Integer> taskQueue = new TaskQueue<>(1, 5);

        assertThat(taskQueue.awaitCompleted()).isCompletedWithValue(Set.of());
        assertThat(taskQueue.isCompleted()).isTrue();
    }

    @Test
    void awaitCompleted는_완료_후_enqueue하면_다시_준비됨() throws Exception {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(2, 10, 1, 2);
        CompletableFuture<Set<Integer>> first = taskQueue.awaitCompleted();
        assertThat(first).isNotDone();

        // when
        taskQueue.runAsync(TaskOperation.of(item -> { })).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(first.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).containsExactlyInAnyOrder(1, 2);

        // when: 완료 후 enqueue
        taskQueue.enqueue(3);
        CompletableFuture<Set<Integer>> second = taskQueue.awaitCompleted();

        // then
        assertThat(second).isNotDone();
        assertThat(taskQueue.isCompleted()).isFalse();
        taskQueue.runAsync(TaskOperation.of(item -> { }));
        assertThat(second.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).containsExactlyInAnyOrder(1, 2, 3);
    }

    @Test
    void 남은_요소를_dequeue하거나_clear하면_완료_신호가_발생() throws Exception {
        // given
        TaskQueue<Integer> single = new TaskQueue<>(1, 5, 1);
        TaskQueue<Integer> several = new TaskQueue<>(1, 5, 1, 2);
        CompletableFuture<Set<Integer>> singleCompleted = single.awaitCompleted();
        CompletableFuture<Set<Integer>> severalCompleted = several.awaitCompleted();

        // when
        single.dequeue();
        several.clear();

        // then
        assertThat(singleCompleted.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEmpty();
        assertThat(severalCompleted.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEmpty();
        assertThat(single.dequeue()).isEmpty();
    }

    // ============================================================
    // 동기 처리 / 게이트
    // ============================================================

    @Test
    void run은_concurrency와_무관하게_하나씩_FIFO로_처리() {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(5, 10, 1, 2, 3, 4);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        // when
        taskQueue.run(item -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            order.add(item);
            return CompletableFuture.supplyAsync(() -> {
                running.decrementAndGet();
                return Outcome.success();
            }, CompletableFuture.delayedExecutor(2, TimeUnit.MILLISECONDS));
        });

        // then
        assertThat(order).containsExactly(1, 2, 3, 4);
        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(taskQueue.isCompleted()).isTrue();
        assertThat(taskQueue.awaitCompleted()).isCompletedWithValueMatching(processed -> processed.size() == 4);
    }

    @Test
    void 비활성화된_TaskQueue는_실행을_거부하고_큐를_유지() {
        // given
        TaskQueue<Integer> taskQueue = new TaskQueue<>(2, 10, 1, 2);
        taskQueue.tasks().disable();

        // when & then
        assertThatThrownBy(() -> taskQueue.runAsync(TaskOperation.of(item -> { })))
            .isInstanceOf(TaskRunnerDisabledException.class)
            .hasMessage("Enable the TaskRunner to use the `runAsync()` method");
        assertThatThrownBy(() -> taskQueue.run(TaskOperation.of(item -> { })))
            .isInstanceOf(TaskRunnerDisabledException.class)
            .hasMessage("Enable the TaskRunner to use the `run()` method");
        assertThat(taskQueue.state()).containsExactly(1, 2);
        assertThat(taskQueue.processed()).isEmpty();
    }

    private static CompletableFuture<Outcome> delayed(long delayMs, Outcome outcome) {
        return CompletableFuture.supplyAsync(() -> outcome, CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS));
    }
}
