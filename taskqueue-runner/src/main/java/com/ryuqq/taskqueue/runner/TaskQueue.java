package com.ryuqq.taskqueue.runner;

import com.ryuqq.taskqueue.core.collection.BoundedQueue;
import com.ryuqq.taskqueue.core.collection.QueueFullException;
import com.ryuqq.taskqueue.core.executor.DrainMode;
import com.ryuqq.taskqueue.core.executor.TaskOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * 동시 실행 수 제한 하에 요소를 처리하는 FIFO 큐.
 *
 * <p>{@link BoundedQueue}와 {@link TaskRunner}를 조합합니다. 큐가 공급자 역할을 하며,
 * 슬롯이 빌 때마다 머리 요소를 꺼내 admit합니다.</p>
 *
 * <p><strong>처리 흐름 ({@link #runAsync}):</strong></p>
 * <pre>
 * runAsync(operation)
 *   ↓
 * while (activeCount &lt; concurrency &amp;&amp; 큐가 비어 있지 않음):
 *   dequeue() → admit(item)
 *   ↓
 * 작업 종료 시:
 *   1. onSuccess / onFailure / onError
 *   2. processed 추가
 *   3. 다시 dequeue → admit (보충)
 *   ↓
 * 큐가 비고 activeCount == 0 → processed 스냅샷으로 완료
 * </pre>
 *
 * <p><strong>완료 신호:</strong> {@link #awaitCompleted()}는 큐가 비고 실행 중인 작업이 없어지는
 * 시점에 한 번 완료되는 Future를 반환합니다. 완료 상태에서 새 요소가 enqueue되면 새 Future가 준비됩니다.
 * 폴링은 사용하지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 큐 접근은 이 인스턴스에 동기화되어 있어 다른 스레드에서 완료되는
 * 작업의 보충이 안전합니다. 단, 같은 인스턴스에 대한 runAsync 동시 호출은 지원하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TaskQueue<Integer> taskQueue = new TaskQueue<>(3, 25, 1, 2, 3);
 * taskQueue.enqueue(4);
 * taskQueue.runAsync(item -> CompletableFuture.supplyAsync(() -> handle(item)))
 *     .thenAccept(processed -> log.info("processed: {}", processed));
 * }</pre>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class TaskQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final TaskQueueConfig config;
    private final BoundedQueue<T> queue;
    private final TaskRunner<T> tasks;

    /**
     * 큐가 비고 실행 중인 작업이 없어질 때 완료되는 Future. 완료 후 enqueue되면 교체됩니다.
     */
    private CompletableFuture<Set<T>> completion;

    /**
     * 생성자.
     *
     * @param config 설정
     * @param initialElements 초기 요소
     * @throws IllegalArgumentException config 또는 initialElements가 null인 경우
     * @throws com.ryuqq.taskqueue.core.collection.CapacityExceededException 초기 요소 수가 용량을 초과한 경우
     */
    public TaskQueue(TaskQueueConfig config, Collection<? extends T> initialElements) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.queue = new BoundedQueue<>(config.capacity(), initialElements);
        this.tasks = new TaskRunner<>(true, config.concurrency());
        this.completion = queue.isEmpty()
            ? CompletableFuture.completedFuture(Set.of())
            : new CompletableFuture<>();
    }

    /**
     * 생성자 (DEFAULT drain 방식).
     *
     * @param concurrency 최대 동시 처리 수
     * @param capacity 큐 최대 용량
     * @param initialElements 초기 요소
     */
    @SafeVarargs
    public TaskQueue(int concurrency, int capacity, T... initialElements) {
        this(new TaskQueueConfig(concurrency, capacity, DrainMode.DEFAULT), Arrays.asList(initialElements));
    }

    /**
     * 꼬리에 요소 추가.
     *
     * @param element 추가할 요소
     * @return this
     * @throws QueueFullException 가득 찬 경우
     */
    public synchronized TaskQueue<T> enqueue(T element) {
        queue.enqueue(element);
        if (completion.isDone()) {
            completion = new CompletableFuture<>();
        }
        return this;
    }

    /**
     * 머리 요소를 꺼내어 반환 (처리하지 않음).
     *
     * @return 머리 요소, 비어 있으면 empty
     */
    public Optional<T> dequeue() {
        Optional<T> element = poll();
        signalIfCompleted();
        return element;
    }

    public synchronized Optional<T> peek() {
        return queue.peek();
    }

    public TaskQueue<T> clear() {
        synchronized (this) {
            queue.clear();
        }
        signalIfCompleted();
        return this;
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public synchronized boolean isFull() {
        return queue.isFull();
    }

    public synchronized int length() {
        return queue.length();
    }

    public int capacity() {
        return queue.capacity();
    }

    public synchronized List<T> state() {
        return queue.state();
    }

    /**
     * 큐의 요소를 비동기 처리합니다.
     *
     * @param operation 작업
     * @return processed 스냅샷 Future
     * @see #runAsync(TaskOperation, OutcomeHandlers)
     */
    public CompletableFuture<Set<T>> runAsync(TaskOperation<T> operation) {
        return runAsync(operation, OutcomeHandlers.none());
    }

    /**
     * 큐의 요소를 비동기 처리합니다.
     *
     * @param operation 작업
     * @param onSuccess 성공 핸들러 (null 허용)
     * @param onFailure 실패 핸들러 (null 허용)
     * @param onError 오류 핸들러 (null 허용)
     * @return processed 스냅샷 Future
     * @see #runAsync(TaskOperation, OutcomeHandlers)
     */
    public CompletableFuture<Set<T>> runAsync(
        TaskOperation<T> operation,
        Consumer<? super T> onSuccess,
        Consumer<? super T> onFailure,
        BiConsumer<? super T, ? super Throwable> onError
    ) {
        return runAsync(operation, new OutcomeHandlers<T>(onSuccess, onFailure, onError));
    }

    /**
     * 큐의 요소를 동시 실행 수 제한 하에 비동기 처리합니다.
     *
     * <p>큐가 비고 실행 중인 작업이 없어지면 processed 스냅샷으로 완료됩니다.
     * 처리 도중 enqueue된 요소도 다음 보충 시 처리됩니다 (DEFAULT 방식).
     * 개별 요소의 오류로 예외 완료되지 않습니다.</p>
     *
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @return processed 스냅샷 Future
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public CompletableFuture<Set<T>> runAsync(TaskOperation<T> operation, OutcomeHandlers<T> handlers) {
        tasks.requireEnabled("runAsync");
        log.info("TaskQueue run started: length={}, concurrency={}", length(), concurrency());

        return tasks.drain(this::poll, operation, handlers, config.drainMode())
            .thenApply(processed -> {
                signalIfCompleted();
                log.info("TaskQueue run completed: {} processed", processed.size());
                return processed;
            });
    }

    /**
     * 큐의 요소를 호출 스레드에서 하나씩 동기 처리합니다. concurrency는 무시됩니다.
     *
     * @param operation 작업
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public void run(TaskOperation<T> operation) {
        run(operation, OutcomeHandlers.none());
    }

    /**
     * 큐의 요소를 호출 스레드에서 하나씩 동기 처리합니다.
     *
     * @param operation 작업
     * @param onSuccess 성공 핸들러 (null 허용)
     * @param onFailure 실패 핸들러 (null 허용)
     * @param onError 오류 핸들러 (null 허용)
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public void run(
        TaskOperation<T> operation,
        Consumer<? super T> onSuccess,
        Consumer<? super T> onFailure,
        BiConsumer<? super T, ? super Throwable> onError
    ) {
        run(operation, new OutcomeHandlers<T>(onSuccess, onFailure, onError));
    }

    /**
     * 큐의 요소를 호출 스레드에서 하나씩 동기 처리합니다.
     *
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public void run(TaskOperation<T> operation, OutcomeHandlers<T> handlers) {
        tasks.requireEnabled("run");
        Optional<T> next;
        while ((next = poll()).isPresent()) {
            tasks.process(next.get(), operation, handlers);
        }
        signalIfCompleted();
    }

    /**
     * 큐가 비고 실행 중인 작업이 없는지 확인.
     *
     * @return 완료 여부
     */
    public synchronized boolean isCompleted() {
        return queue.isEmpty() && tasks.activeCount() == 0;
    }

    /**
     * 큐가 비고 실행 중인 작업이 없어지는 시점에 processed 스냅샷으로 완료되는 Future.
     *
     * @return 완료 Future (이미 완료 상태면 완료된 Future)
     */
    public synchronized CompletableFuture<Set<T>> awaitCompleted() {
        return completion.copy();
    }

    public int concurrency() {
        return tasks.concurrency();
    }

    public Set<T> processed() {
        return tasks.processed();
    }

    /**
     * 내부 TaskRunner (활성화 게이트 제어용).
     *
     * @return TaskRunner
     */
    public TaskRunner<T> tasks() {
        return tasks;
    }

    public TaskQueueConfig config() {
        return config;
    }

    private synchronized Optional<T> poll() {
        return queue.dequeue();
    }

    private void signalIfCompleted() {
        CompletableFuture<Set<T>> pending = null;
        synchronized (this) {
            if (!completion.isDone() && queue.isEmpty() && tasks.activeCount() == 0) {
                pending = completion;
            }
        }
        if (pending != null) {
            pending.complete(tasks.processed());
        }
    }

    @Override
    public String toString() {
        return "TaskQueue{state=" + state() + ", capacity=" + capacity() + ", concurrency=" + concurrency() + "}";
    }
}
