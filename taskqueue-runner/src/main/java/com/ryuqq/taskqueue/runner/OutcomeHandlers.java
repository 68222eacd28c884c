package com.ryuqq.taskqueue.runner;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * 요소별 결과 핸들러 묶음 (불변 record).
 *
 * <p>요소 하나당 정확히 하나의 핸들러가 호출됩니다:</p>
 * <ul>
 *   <li>onSuccess: 작업이 성공(또는 결과 없음)으로 완료</li>
 *   <li>onFailure: 작업이 선언된 실패로 완료</li>
 *   <li>onError: 작업이 예외를 던지거나 예외로 완료</li>
 * </ul>
 *
 * <p>null로 전달된 핸들러는 아무 동작도 하지 않는 핸들러로 대체됩니다.</p>
 *
 * @param onSuccess 성공 핸들러
 * @param onFailure 실패 핸들러
 * @param onError 오류 핸들러
 * @param <T> 요소 타입
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public record OutcomeHandlers<T>(
    Consumer<? super T> onSuccess,
    Consumer<? super T> onFailure,
    BiConsumer<? super T, ? super Throwable> onError
) {

    /**
     * Compact constructor (null 핸들러 대체).
     */
    public OutcomeHandlers {
        if (onSuccess == null) {
            onSuccess = item -> { };
        }
        if (onFailure == null) {
            onFailure = item -> { };
        }
        if (onError == null) {
            onError = (item, error) -> { };
        }
    }

    /**
     * 아무 동작도 하지 않는 핸들러 묶음.
     *
     * @param <T> 요소 타입
     * @return OutcomeHandlers
     */
    public static <T> OutcomeHandlers<T> none() {
        return new OutcomeHandlers<T>(null, null, null);
    }

    /**
     * onSuccess만 변경한 새 인스턴스 생성.
     */
    public OutcomeHandlers<T> withOnSuccess(Consumer<? super T> onSuccess) {
        return new OutcomeHandlers<T>(onSuccess, onFailure, onError);
    }

    /**
     * onFailure만 변경한 새 인스턴스 생성.
     */
    public OutcomeHandlers<T> withOnFailure(Consumer<? super T> onFailure) {
        return new OutcomeHandlers<T>(onSuccess, onFailure, onError);
    }

    /**
     * onError만 변경한 새 인스턴스 생성.
     */
    public OutcomeHandlers<T> withOnError(BiConsumer<? super T, ? super Throwable> onError) {
        return new OutcomeHandlers<T>(onSuccess, onFailure, onError);
    }
}
