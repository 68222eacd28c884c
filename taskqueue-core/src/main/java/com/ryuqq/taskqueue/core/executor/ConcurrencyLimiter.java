package com.ryuqq.taskqueue.core.executor;

import com.ryuqq.taskqueue.core.outcome.Outcome;
import com.ryuqq.taskqueue.core.outcome.Settlement;
import com.ryuqq.taskqueue.core.statemachine.LimiterState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 동시 실행 수 제한기.
 *
 * <p>진행 중(in-flight)인 비동기 작업 집합을 추적하며 동시 실행 수를 {@code concurrency} 이하로 유지합니다.
 * 종료된 요소는 처리 완료(processed) 집합에 기록됩니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>admit: 슬롯이 있으면 즉시, 없으면 슬롯이 빌 때까지 비블로킹 대기 후 작업 시작</li>
 *   <li>drain: 공급자가 소진되고 모든 작업이 종료될 때까지 반복 admit</li>
 *   <li>awaitIdle: in-flight 집합이 비는 시점에 완료되는 Future 제공</li>
 *   <li>작업 예외 격리: 작업 오류는 {@link Settlement}로 기록되며 밖으로 전파되지 않음</li>
 * </ul>
 *
 * <p><strong>종료(settlement) 순서:</strong></p>
 * <pre>
 * 작업 스테이지 완료
 *   ↓
 * 1. listener.accept(settlement)     (onSuccess / onFailure / onError 라우팅)
 *   ↓
 * 2. in-flight 제거 + processed 추가   (lock 내부, 정확히 한 번, listener가 던져도 수행)
 *   ↓
 * 3. 슬롯 Future 완료 → drain 보충 (다음 요소 admit)
 *   ↓
 * 4. 대기자가 있으면 맨 앞 대기자에게 슬롯 전달, 없고 집합이 비었으면 idle 신호 완료
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>activeCount는 저장하지 않고 in-flight 집합 크기에서 계산</li>
 *   <li>용량 검사와 집합 등록은 lock 안에서 원자적으로 수행</li>
 *   <li>가득 찬 상태의 대기자는 도착 순서(FIFO)대로 줄을 서며, 해제된 슬롯은 맨 앞 대기자에게 바로 넘어감</li>
 *   <li>완료 대기는 폴링 없이 사이클마다 한 번 완료되는 Future 사용</li>
 *   <li>사용자 코드(작업, listener, 공급자)는 lock 밖에서 호출</li>
 * </ul>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
public final class ConcurrencyLimiter<T> {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final int concurrency;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<CompletableFuture<Settlement<T>>> inFlight = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<T> processed = new LinkedHashSet<>();

    /**
     * 슬롯을 기다리는 대기자. 해제된 슬롯을 넘겨받으면 완료됩니다.
     */
    private final Deque<CompletableFuture<CompletableFuture<Settlement<T>>>> waiters = new ArrayDeque<>();

    /**
     * 현재 ACTIVE 사이클이 끝날 때 완료되는 신호. IDLE → ACTIVE 전이마다 새로 만들어집니다.
     */
    private CompletableFuture<Void> idleSignal = CompletableFuture.completedFuture(null);

    /**
     * 생성자.
     *
     * @param concurrency 최대 동시 실행 수 (1 이상)
     * @throws IllegalArgumentException concurrency가 양수가 아닌 경우
     */
    public ConcurrencyLimiter(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        this.concurrency = concurrency;
    }

    /**
     * 슬롯이 있을 때만 작업을 시작합니다 (비대기).
     *
     * @param item 처리할 요소
     * @param operation 작업
     * @param listener 종료 시 호출될 listener (null 허용)
     * @return 시작했으면 true, 동시 실행 수 초과면 false
     * @throws IllegalArgumentException item 또는 operation이 null인 경우
     */
    public boolean tryAdmit(T item, TaskOperation<T> operation, Consumer<Settlement<T>> listener) {
        requireArguments(item, operation);
        CompletableFuture<Settlement<T>> slot = tryReserve();
        if (slot == null) {
            return false;
        }
        dispatch(item, operation, slot, listener);
        return true;
    }

    /**
     * 작업 admit.
     *
     * @param item 처리할 요소
     * @param operation 작업
     * @return 종료 결과 Future
     * @see #admit(Object, TaskOperation, Consumer)
     */
    public CompletableFuture<Settlement<T>> admit(T item, TaskOperation<T> operation) {
        return admit(item, operation, null);
    }

    /**
     * 작업 admit.
     *
     * <p>activeCount가 concurrency 미만이면 즉시 시작합니다. 그렇지 않으면 대기열 끝에 서서
     * 앞선 대기자들 다음으로 해제되는 슬롯을 넘겨받아 시작합니다. 호출 스레드는 블로킹되지 않습니다.</p>
     *
     * <p>반환된 Future는 작업 오류로 인해 예외 완료되지 않습니다. 오류는 {@link Settlement#error()}에 담깁니다.</p>
     *
     * @param item 처리할 요소
     * @param operation 작업
     * @param listener 종료 시 호출될 listener (null 허용)
     * @return 종료 결과 Future
     * @throws IllegalArgumentException item 또는 operation이 null인 경우
     */
    public CompletableFuture<Settlement<T>> admit(T item, TaskOperation<T> operation, Consumer<Settlement<T>> listener) {
        requireArguments(item, operation);
        Reservation<T> reservation = reserveOrWait();
        if (reservation.slot() != null) {
            dispatch(item, operation, reservation.slot(), listener);
            return reservation.slot().copy();
        }
        log.debug("Concurrency limit {} reached, waiting for a free slot: item={}", concurrency, item);
        return reservation.granted().thenCompose(slot -> {
            dispatch(item, operation, slot, listener);
            return slot.copy();
        });
    }

    /**
     * 공급자의 요소를 동시 실행 수 제한 하에 모두 처리합니다.
     *
     * <p><strong>보장:</strong></p>
     * <ul>
     *   <li>어느 순간에도 in-flight 작업은 concurrency 이하</li>
     *   <li>공급자의 각 요소는 공급 순서대로 정확히 한 번 admit</li>
     *   <li>슬롯 해제와 다음 admit 사이의 경합으로 요소가 누락되지 않음</li>
     * </ul>
     *
     * <p>반환된 Future는 공급자가 소진되고 in-flight 집합이 빈 뒤 processed 스냅샷으로 완료됩니다.</p>
     *
     * @param source 요소 공급자
     * @param operation 작업
     * @param listener 종료 시 호출될 listener (null 허용)
     * @param mode 대기 방식
     * @return processed 스냅샷 Future
     * @throws IllegalArgumentException source, operation, mode가 null인 경우
     */
    public CompletableFuture<Set<T>> drain(
        ItemSource<T> source,
        TaskOperation<T> operation,
        Consumer<Settlement<T>> listener,
        DrainMode mode
    ) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }

        log.info("Drain started: mode={}, concurrency={}", mode, concurrency);

        CompletableFuture<Void> submitted = mode == DrainMode.RACE
            ? raceLoop(source, operation, listener, null)
            : new Refill(source, operation, listener).start();

        return submitted
            .thenCompose(ignored -> awaitIdle())
            .thenApply(ignored -> {
                Set<T> snapshot = processed();
                log.info("Drain completed: {} processed", snapshot.size());
                return snapshot;
            });
    }

    /**
     * 요소 하나를 호출 스레드에서 동기 처리합니다.
     *
     * <p>작업 스테이지가 완료될 때까지 대기합니다. 동시 실행 수 계산에는 포함되지 않지만
     * 결과는 processed에 기록됩니다.</p>
     *
     * @param item 처리할 요소
     * @param operation 작업
     * @param listener 종료 시 호출될 listener (null 허용)
     * @return 종료 결과
     * @throws IllegalArgumentException item 또는 operation이 null인 경우
     */
    public Settlement<T> process(T item, TaskOperation<T> operation, Consumer<Settlement<T>> listener) {
        requireArguments(item, operation);

        Settlement<T> settlement;
        try {
            CompletionStage<Outcome> stage = operation.apply(item);
            Outcome outcome = stage == null ? null : stage.toCompletableFuture().get();
            settlement = Settlement.completed(item, outcome);
        } catch (ExecutionException e) {
            settlement = Settlement.errored(item, unwrap(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            settlement = Settlement.errored(item, e);
        } catch (Throwable e) {
            settlement = Settlement.errored(item, unwrap(e));
        }

        try {
            notifyListener(listener, settlement);
        } finally {
            lock.lock();
            try {
                processed.add(item);
            } finally {
                lock.unlock();
            }
        }
        log.debug("Processed synchronously: item={}", item);
        return settlement;
    }

    /**
     * in-flight 집합이 비는 시점에 완료되는 Future.
     *
     * <p>신호를 받은 뒤 집합을 다시 확인하므로, 그 사이에 새 작업이 admit되었다면
     * 그 작업까지 기다립니다.</p>
     *
     * @return idle Future (이미 idle이면 완료된 Future)
     */
    public CompletableFuture<Void> awaitIdle() {
        CompletableFuture<Void> signal;
        lock.lock();
        try {
            signal = idleSignal;
        } finally {
            lock.unlock();
        }
        return signal.thenCompose(ignored -> isIdle() ? CompletableFuture.completedFuture(null) : awaitIdle());
    }

    public int concurrency() {
        return concurrency;
    }

    public int activeCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isIdle() {
        return activeCount() == 0;
    }

    public LimiterState state() {
        return LimiterState.of(activeCount());
    }

    /**
     * 처리 완료 요소의 읽기 전용 스냅샷 (종료 순서).
     *
     * @return 불변 Set
     */
    public Set<T> processed() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(processed));
        } finally {
            lock.unlock();
        }
    }

    /**
     * race 방식 제출 루프.
     *
     * <p>슬롯이 없으면 대기열에 서서 슬롯을 넘겨받은 뒤 이어서 제출합니다.</p>
     *
     * @param granted 넘겨받은 슬롯 (없으면 null)
     */
    private CompletableFuture<Void> raceLoop(
        ItemSource<T> source,
        TaskOperation<T> operation,
        Consumer<Settlement<T>> listener,
        CompletableFuture<Settlement<T>> granted
    ) {
        CompletableFuture<Settlement<T>> slot = granted;
        while (true) {
            if (slot == null) {
                Reservation<T> reservation = reserveOrWait();
                if (reservation.slot() == null) {
                    return reservation.granted().thenCompose(next -> raceLoop(source, operation, listener, next));
                }
                slot = reservation.slot();
            }

            Optional<T> next;
            try {
                next = source.poll();
            } catch (RuntimeException e) {
                release(slot);
                return CompletableFuture.failedFuture(e);
            }
            if (next.isEmpty()) {
                release(slot);
                return CompletableFuture.completedFuture(null);
            }
            dispatch(next.get(), operation, slot, listener);
            slot = null;
        }
    }

    /**
     * 빈 슬롯이 있으면 예약, 없으면 null (대기하지 않음).
     */
    private CompletableFuture<Settlement<T>> tryReserve() {
        lock.lock();
        try {
            return inFlight.size() < concurrency ? occupy() : null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 슬롯 예약 또는 대기열 등록 (원자적).
     */
    private Reservation<T> reserveOrWait() {
        lock.lock();
        try {
            if (inFlight.size() < concurrency) {
                return new Reservation<>(occupy(), null);
            }
            CompletableFuture<CompletableFuture<Settlement<T>>> granted = new CompletableFuture<>();
            waiters.addLast(granted);
            return new Reservation<>(null, granted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * lock 보유 상태에서 호출. IDLE → ACTIVE 전이 시 idle 신호를 새로 만듭니다.
     */
    private CompletableFuture<Settlement<T>> occupy() {
        CompletableFuture<Settlement<T>> slot = new CompletableFuture<>();
        if (inFlight.isEmpty()) {
            idleSignal = new CompletableFuture<>();
        }
        inFlight.add(slot);
        return slot;
    }

    /**
     * lock 보유 상태에서 호출. 방금 비운 자리를 가장 오래 기다린 대기자에게 넘기고,
     * 대기자가 없고 집합이 비었으면 idle 신호를 돌려줍니다.
     */
    private Handoff<T> handOff() {
        CompletableFuture<CompletableFuture<Settlement<T>>> waiter = waiters.pollFirst();
        if (waiter != null) {
            CompletableFuture<Settlement<T>> slot = new CompletableFuture<>();
            inFlight.add(slot);
            return new Handoff<>(waiter, slot, null);
        }
        return new Handoff<>(null, null, inFlight.isEmpty() ? idleSignal : null);
    }

    /**
     * 사용하지 않은 예약 슬롯 반환.
     */
    private void release(CompletableFuture<Settlement<T>> slot) {
        Handoff<T> handoff;
        lock.lock();
        try {
            if (!inFlight.remove(slot)) {
                return;
            }
            handoff = handOff();
        } finally {
            lock.unlock();
        }
        handoff.signal();
    }

    private void dispatch(T item, TaskOperation<T> operation, CompletableFuture<Settlement<T>> slot, Consumer<Settlement<T>> listener) {
        log.debug("Admitted: item={}, activeCount={}/{}", item, activeCount(), concurrency);

        CompletionStage<Outcome> stage;
        try {
            stage = operation.apply(item);
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            stage = CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            stage = CompletableFuture.completedFuture(Outcome.success());
        }

        stage.whenComplete((outcome, error) -> settle(
            slot,
            error == null ? Settlement.completed(item, outcome) : Settlement.errored(item, unwrap(error)),
            listener
        ));
    }

    private void settle(CompletableFuture<Settlement<T>> slot, Settlement<T> settlement, Consumer<Settlement<T>> listener) {
        try {
            notifyListener(listener, settlement);
        } finally {
            complete(slot, settlement);
        }
    }

    private void complete(CompletableFuture<Settlement<T>> slot, Settlement<T> settlement) {
        Handoff<T> handoff;
        int remaining;
        lock.lock();
        try {
            if (!inFlight.remove(slot)) {
                log.warn("Settlement for an unknown slot ignored: item={}", settlement.item());
                return;
            }
            processed.add(settlement.item());
            handoff = handOff();
            remaining = inFlight.size();
        } finally {
            lock.unlock();
        }

        log.debug("Settled: item={}, error={}, outcome={}, activeCount={}",
            settlement.item(), settlement.isError(), settlement.outcome(), remaining);

        slot.complete(settlement);
        handoff.signal();
    }

    private void notifyListener(Consumer<Settlement<T>> listener, Settlement<T> settlement) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(settlement);
        } catch (RuntimeException e) {
            log.warn("Settlement listener failed for item {}", settlement.item(), e);
        }
    }

    private void requireArguments(T item, TaskOperation<T> operation) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 예약 결과: 슬롯 또는 슬롯을 넘겨받을 때 완료되는 Future 중 하나.
     */
    private record Reservation<T>(
        CompletableFuture<Settlement<T>> slot,
        CompletableFuture<CompletableFuture<Settlement<T>>> granted
    ) {
    }

    /**
     * 슬롯 해제 후 lock 밖에서 보낼 신호.
     */
    private record Handoff<T>(
        CompletableFuture<CompletableFuture<Settlement<T>>> waiter,
        CompletableFuture<Settlement<T>> slot,
        CompletableFuture<Void> idle
    ) {

        void signal() {
            if (waiter != null) {
                waiter.complete(slot);
            }
            if (idle != null) {
                idle.complete(null);
            }
        }
    }

    /**
     * 기본(self-feeding) drain.
     *
     * <p>작업이 종료될 때마다 {@link #fill()}이 호출되어 빈 슬롯을 채웁니다.
     * work-in-progress 카운터로 보충 루프를 직렬화하므로 동기 완료 작업이 이어져도
     * 재귀 깊이가 늘어나지 않으며, 공급자는 한 번에 한 스레드에서만 호출됩니다.</p>
     */
    private final class Refill {

        private final ItemSource<T> source;
        private final TaskOperation<T> operation;
        private final Consumer<Settlement<T>> listener;
        private final AtomicInteger wip = new AtomicInteger();
        private final AtomicInteger pending = new AtomicInteger();
        private final AtomicReference<CompletableFuture<Settlement<T>>> granted = new AtomicReference<>();
        private final CompletableFuture<Void> exhausted = new CompletableFuture<>();

        Refill(ItemSource<T> source, TaskOperation<T> operation, Consumer<Settlement<T>> listener) {
            this.source = source;
            this.operation = operation;
            this.listener = listener;
        }

        CompletableFuture<Void> start() {
            fill();
            return exhausted;
        }

        void fill() {
            if (wip.getAndIncrement() != 0) {
                return;
            }
            do {
                fillSlots();
            } while (wip.decrementAndGet() != 0);
        }

        private void fillSlots() {
            while (true) {
                CompletableFuture<Settlement<T>> slot = granted.getAndSet(null);
                if (exhausted.isDone()) {
                    if (slot != null) {
                        release(slot);
                    }
                    return;
                }
                if (slot == null) {
                    slot = reserve();
                    if (slot == null) {
                        return;
                    }
                }

                Optional<T> next;
                try {
                    next = source.poll();
                } catch (RuntimeException e) {
                    release(slot);
                    exhausted.completeExceptionally(e);
                    return;
                }
                if (next.isEmpty()) {
                    release(slot);
                    if (pending.get() == 0) {
                        exhausted.complete(null);
                    }
                    return;
                }

                pending.incrementAndGet();
                slot.whenComplete((settlement, error) -> {
                    pending.decrementAndGet();
                    fill();
                });
                dispatch(next.get(), operation, slot, listener);
            }
        }

        /**
         * 자기 작업이 남아 있으면 그 종료가 다시 fill을 호출하므로 대기하지 않습니다.
         * 남은 작업이 없으면 대기열에 서서 넘겨받은 슬롯으로 이어갑니다 (대기자는 최대 하나).
         */
        private CompletableFuture<Settlement<T>> reserve() {
            if (pending.get() > 0) {
                return tryReserve();
            }
            Reservation<T> reservation = reserveOrWait();
            if (reservation.slot() == null) {
                reservation.granted().thenAccept(slot -> {
                    granted.set(slot);
                    fill();
                });
            }
            return reservation.slot();
        }
    }
}
