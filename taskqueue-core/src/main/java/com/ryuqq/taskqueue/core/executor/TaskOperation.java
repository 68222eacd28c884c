package com.ryuqq.taskqueue.core.executor;

import com.ryuqq.taskqueue.core.outcome.Outcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 요소 하나를 처리하는 작업.
 *
 * <p>작업은 {@link CompletionStage}를 반환하며, 스테이지가 완료될 때까지 in-flight 상태로 간주됩니다.</p>
 *
 * <p><strong>결과 해석:</strong></p>
 * <ul>
 *   <li>{@link Outcome#success()} 또는 null로 완료: 성공</li>
 *   <li>{@link Outcome#failure()}로 완료: 선언된 실패</li>
 *   <li>예외를 던지거나 예외로 완료: 오류 (onError)</li>
 *   <li>null 스테이지 반환: 성공</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TaskOperation<Integer> op = item -> CompletableFuture.supplyAsync(() ->
 *     item % 2 == 0 ? Outcome.success() : Outcome.failure("odd"));
 *
 * TaskOperation<String> log = TaskOperation.of(System.out::println);
 * }</pre>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskOperation<T> {

    /**
     * 요소 처리 시작.
     *
     * @param item 처리할 요소
     * @return 처리 결과 스테이지
     * @throws Exception 처리 중 오류 (onError로 전달됨)
     */
    CompletionStage<Outcome> apply(T item) throws Exception;

    /**
     * 값을 반환하지 않는 동기 작업을 감쌉니다. 정상 종료 시 항상 성공입니다.
     *
     * @param action 동기 작업
     * @param <T> 요소 타입
     * @return TaskOperation
     */
    static <T> TaskOperation<T> of(Consumer<? super T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return item -> {
            action.accept(item);
            return CompletableFuture.completedFuture(Outcome.success());
        };
    }

    /**
     * Outcome을 반환하는 동기 작업을 감쌉니다.
     *
     * @param function 동기 작업
     * @param <T> 요소 타입
     * @return TaskOperation
     */
    static <T> TaskOperation<T> ofOutcome(Function<? super T, ? extends Outcome> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        return item -> CompletableFuture.<Outcome>completedFuture(function.apply(item));
    }
}
