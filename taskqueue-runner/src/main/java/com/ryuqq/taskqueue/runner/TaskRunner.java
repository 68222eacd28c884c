package com.ryuqq.taskqueue.runner;

import com.ryuqq.taskqueue.core.executor.ConcurrencyLimiter;
import com.ryuqq.taskqueue.core.executor.DrainMode;
import com.ryuqq.taskqueue.core.executor.ItemSource;
import com.ryuqq.taskqueue.core.executor.TaskOperation;
import com.ryuqq.taskqueue.core.outcome.Settlement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 활성화 게이트와 결과 라우팅을 갖춘 작업 실행기.
 *
 * <p>{@link ConcurrencyLimiter} 앞에 enable/disable 게이트를 두고,
 * 요소마다 결과를 세 가지로 분류하여 핸들러에 전달합니다.</p>
 *
 * <p><strong>결과 라우팅:</strong></p>
 * <pre>
 * 작업 종료
 *   ├─ 예외 발생           → onError(item, error)
 *   ├─ Failure로 완료      → onFailure(item)
 *   └─ Success/null로 완료 → onSuccess(item)
 * 어느 경우든 item은 processed에 추가 (재시도 없음)
 * </pre>
 *
 * <p><strong>게이트:</strong> 비활성화 상태에서 모든 진입점은 {@link TaskRunnerDisabledException}을
 * 던지며 상태를 변경하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TaskRunner<Integer> runner = new TaskRunner<>(true, 3);
 * runner.submitAll(List.of(1, 2, 3), operation, OutcomeHandlers.<Integer>none()
 *         .withOnFailure(item -> log.warn("failed: {}", item)))
 *     .thenAccept(processed -> log.info("done: {}", processed));
 * }</pre>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
public final class TaskRunner<T> {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final ConcurrencyLimiter<T> limiter;
    private volatile boolean enabled;

    /**
     * 생성자.
     *
     * @param enabled 초기 활성화 여부
     * @param concurrency 최대 동시 처리 수 (1 이상)
     * @throws IllegalArgumentException concurrency가 양수가 아닌 경우
     */
    public TaskRunner(boolean enabled, int concurrency) {
        this(enabled, new ConcurrencyLimiter<>(concurrency));
    }

    /**
     * 생성자 (커스텀 ConcurrencyLimiter 주입).
     *
     * @param enabled 초기 활성화 여부
     * @param limiter 동시 실행 수 제한기
     * @throws IllegalArgumentException limiter가 null인 경우
     */
    public TaskRunner(boolean enabled, ConcurrencyLimiter<T> limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.enabled = enabled;
        this.limiter = limiter;
    }

    public TaskRunner<T> enable() {
        enabled = true;
        return this;
    }

    public TaskRunner<T> disable() {
        enabled = false;
        return this;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isDisabled() {
        return !enabled;
    }

    /**
     * 요소 하나를 비동기 처리합니다.
     *
     * <p>동시 실행 수가 가득 찬 경우 슬롯이 빌 때까지 기다린 뒤 시작합니다.</p>
     *
     * @param item 처리할 요소
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @return 종료 결과 Future
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public CompletableFuture<Settlement<T>> submitOne(T item, TaskOperation<T> operation, OutcomeHandlers<T> handlers) {
        requireEnabled("submitOne");
        return limiter.admit(item, operation, listenerFor(handlers));
    }

    /**
     * 요소 목록을 동시 실행 수 제한 하에 비동기 처리합니다 (DEFAULT 방식).
     *
     * @param items 처리할 요소 목록
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @return processed 스냅샷 Future
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public CompletableFuture<Set<T>> submitAll(Iterable<? extends T> items, TaskOperation<T> operation, OutcomeHandlers<T> handlers) {
        return submitAll(items, operation, handlers, DrainMode.DEFAULT);
    }

    /**
     * 요소 목록을 동시 실행 수 제한 하에 비동기 처리합니다.
     *
     * <p>개별 요소의 오류나 실패로 반환 Future가 예외 완료되지 않습니다.</p>
     *
     * @param items 처리할 요소 목록
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @param mode drain 대기 방식
     * @return processed 스냅샷 Future
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     * @throws IllegalArgumentException items 또는 그 요소가 null인 경우 (어떤 요소도 시작되지 않음)
     */
    public CompletableFuture<Set<T>> submitAll(
        Iterable<? extends T> items,
        TaskOperation<T> operation,
        OutcomeHandlers<T> handlers,
        DrainMode mode
    ) {
        requireEnabled("submitAll");
        requireItems(items);
        return limiter.drain(ItemSource.of(items), operation, listenerFor(handlers), mode);
    }

    /**
     * 임의의 공급자를 drain합니다. TaskQueue가 큐를 공급자로 사용할 때 호출합니다.
     *
     * @param source 요소 공급자
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @param mode drain 대기 방식
     * @return processed 스냅샷 Future
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public CompletableFuture<Set<T>> drain(
        ItemSource<T> source,
        TaskOperation<T> operation,
        OutcomeHandlers<T> handlers,
        DrainMode mode
    ) {
        requireEnabled("drain");
        return limiter.drain(source, operation, listenerFor(handlers), mode);
    }

    /**
     * 요소 하나를 호출 스레드에서 동기 처리합니다.
     *
     * @param item 처리할 요소
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @return 종료 결과
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     */
    public Settlement<T> process(T item, TaskOperation<T> operation, OutcomeHandlers<T> handlers) {
        requireEnabled("process");
        return limiter.process(item, operation, listenerFor(handlers));
    }

    /**
     * 요소 목록을 하나씩 순서대로 동기 처리합니다. concurrency는 무시됩니다.
     *
     * @param items 처리할 요소 목록
     * @param operation 작업
     * @param handlers 결과 핸들러
     * @throws TaskRunnerDisabledException 비활성화 상태인 경우
     * @throws IllegalArgumentException items 또는 그 요소가 null인 경우 (어떤 요소도 처리되지 않음)
     */
    public void run(Iterable<? extends T> items, TaskOperation<T> operation, OutcomeHandlers<T> handlers) {
        requireEnabled("run");
        requireItems(items);
        for (T item : items) {
            process(item, operation, handlers);
        }
    }

    public CompletableFuture<Void> awaitIdle() {
        return limiter.awaitIdle();
    }

    public int concurrency() {
        return limiter.concurrency();
    }

    public int activeCount() {
        return limiter.activeCount();
    }

    public Set<T> processed() {
        return limiter.processed();
    }

    public ConcurrencyLimiter<T> limiter() {
        return limiter;
    }

    void requireEnabled(String method) {
        if (!enabled) {
            throw new TaskRunnerDisabledException(method);
        }
    }

    private static void requireItems(Iterable<?> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        for (Object item : items) {
            if (item == null) {
                throw new IllegalArgumentException("item cannot be null");
            }
        }
    }

    private Consumer<Settlement<T>> listenerFor(OutcomeHandlers<T> handlers) {
        OutcomeHandlers<T> resolved = resolve(handlers);
        return settlement -> route(settlement, resolved);
    }

    private static <T> OutcomeHandlers<T> resolve(OutcomeHandlers<T> handlers) {
        return handlers == null ? OutcomeHandlers.none() : handlers;
    }

    private void route(Settlement<T> settlement, OutcomeHandlers<T> handlers) {
        T item = settlement.item();
        if (settlement.isError()) {
            log.debug("Error occurred during processing: item={}", item, settlement.error());
            handlers.onError().accept(item, settlement.error());
        } else if (settlement.isFailure()) {
            log.debug("Processing failed: item={}, outcome={}", item, settlement.outcome());
            handlers.onFailure().accept(item);
        } else {
            handlers.onSuccess().accept(item);
        }
    }
}
